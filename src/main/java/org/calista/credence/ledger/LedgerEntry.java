package org.calista.credence.ledger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.List;
import java.util.Objects;

/**
 * One immutable ledger record.
 *
 * <p>
 * {@code sequence} starts at 1 and has no gaps. {@code hash} is the SHA-256 of the
 * canonical form of every other field, including {@code previousHash}, so the log is a
 * hash chain (see {@link EntryHasher}). Corrections are new entries, never edits.
 * </p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LedgerEntry(long sequence,
                          EntryKind kind,
                          JsonNode payload,
                          String correlationId,
                          long timestampEpochMs,
                          List<Long> derivedFrom,
                          Provenance provenance,
                          String previousHash,
                          String hash) {

    public LedgerEntry {
        if (sequence < 1) throw new IllegalArgumentException("sequence must be >= 1, got " + sequence);
        Objects.requireNonNull(kind, "kind");
        payload = (payload == null || payload.isNull()) ? JsonNodeFactory.instance.objectNode() : payload.deepCopy();
        derivedFrom = derivedFrom == null ? List.of() : List.copyOf(derivedFrom);
        provenance = provenance == null ? Provenance.NONE : provenance;
        Objects.requireNonNull(previousHash, "previousHash");
        Objects.requireNonNull(hash, "hash");
    }

    /** Defensive copy; entries never change. */
    @Override
    public JsonNode payload() {
        return payload.deepCopy();
    }

    public boolean derivesFrom(long seq) {
        return derivedFrom.contains(seq);
    }
}
