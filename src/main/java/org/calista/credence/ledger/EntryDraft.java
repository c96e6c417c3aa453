package org.calista.credence.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Unsequenced input to {@link EvidenceLedger#append(EntryDraft)}. The ledger assigns
 * sequence, hash and (unless given) timestamp.
 */
public final class EntryDraft {

    private final EntryKind kind;
    private final ObjectNode payload;
    private final String correlationId;
    private final Long timestampEpochMs;
    private final List<Long> derivedFrom;
    private final Provenance provenance;

    private EntryDraft(Builder b) {
        this.kind = b.kind;
        this.payload = b.payload.deepCopy();
        this.correlationId = b.correlationId;
        this.timestampEpochMs = b.timestampEpochMs;
        this.derivedFrom = List.copyOf(b.derivedFrom);
        this.provenance = b.provenance;
    }

    public EntryKind kind() {
        return kind;
    }

    public ObjectNode payload() {
        return payload.deepCopy();
    }

    public String correlationId() {
        return correlationId;
    }

    /** Null means "now" according to the ledger clock. */
    public Long timestampEpochMs() {
        return timestampEpochMs;
    }

    public List<Long> derivedFrom() {
        return derivedFrom;
    }

    public Provenance provenance() {
        return provenance;
    }

    public static Builder builder(EntryKind kind) {
        return new Builder(kind);
    }

    public static final class Builder {
        private final EntryKind kind;
        private final ObjectNode payload = JsonNodeFactory.instance.objectNode();
        private String correlationId;
        private Long timestampEpochMs;
        private final List<Long> derivedFrom = new ArrayList<>();
        private Provenance provenance = Provenance.NONE;

        private Builder(EntryKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind");
        }

        public Builder payload(ObjectNode node) {
            Objects.requireNonNull(node, "payload");
            this.payload.setAll(node.deepCopy());
            return this;
        }

        public Builder put(String field, String value) {
            payload.put(field, value);
            return this;
        }

        public Builder put(String field, double value) {
            payload.put(field, value);
            return this;
        }

        public Builder put(String field, long value) {
            payload.put(field, value);
            return this;
        }

        public Builder put(String field, boolean value) {
            payload.put(field, value);
            return this;
        }

        public Builder put(String field, JsonNode value) {
            payload.set(field, value == null ? null : value.deepCopy());
            return this;
        }

        public Builder correlationId(String id) {
            this.correlationId = (id == null || id.isBlank()) ? null : id;
            return this;
        }

        public Builder timestampEpochMs(long ts) {
            this.timestampEpochMs = ts;
            return this;
        }

        public Builder derivedFrom(long... sequences) {
            for (long s : sequences) derivedFrom.add(s);
            return this;
        }

        public Builder derivedFrom(List<Long> sequences) {
            derivedFrom.addAll(Objects.requireNonNull(sequences, "sequences"));
            return this;
        }

        public Builder provenance(Provenance p) {
            this.provenance = (p == null) ? Provenance.NONE : p;
            return this;
        }

        public EntryDraft build() {
            return new EntryDraft(this);
        }
    }
}
