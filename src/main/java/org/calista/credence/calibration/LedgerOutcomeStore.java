package org.calista.credence.calibration;

import com.fasterxml.jackson.databind.JsonNode;
import org.calista.credence.confidence.ConfidenceCodec;
import org.calista.credence.ledger.EntryDraft;
import org.calista.credence.ledger.EntryKind;
import org.calista.credence.ledger.EvidenceLedger;
import org.calista.credence.ledger.LedgerEntry;
import org.calista.credence.ledger.LedgerQuery;
import org.calista.credence.ledger.Provenance;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Outcome store backed by {@link EntryKind#OUTCOME} ledger entries. Nothing is cached:
 * every read rebuilds from the ledger, so reports always reflect the log.
 */
public final class LedgerOutcomeStore implements OutcomeStore {

    static final String PRODUCER = "producerId";
    static final String PREDICTED = "predicted";
    static final String ACTUAL = "actual";
    static final String VERIFIED_AT = "verifiedAt";

    private final EvidenceLedger ledger;
    private final String correlationId;

    public LedgerOutcomeStore(EvidenceLedger ledger) {
        this(ledger, null);
    }

    /**
     * @param correlationId tag written on new entries; reads are not filtered by it
     */
    public LedgerOutcomeStore(EvidenceLedger ledger, String correlationId) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.correlationId = correlationId;
    }

    @Override
    public void add(Outcome o) {
        Objects.requireNonNull(o, "outcome");
        ledger.append(EntryDraft.builder(EntryKind.OUTCOME)
                .put(PRODUCER, o.producerId())
                .put(PREDICTED, ConfidenceCodec.toJson(o.predicted()))
                .put(ACTUAL, o.actual())
                .put(VERIFIED_AT, o.verifiedAt().toString())
                .correlationId(correlationId)
                .provenance(Provenance.of("calibration", "record_outcome", o.producerId()))
                .build());
    }

    @Override
    public List<Outcome> outcomes(String producerId) {
        List<Outcome> out = new ArrayList<>();
        for (LedgerEntry e : outcomeEntries()) {
            JsonNode p = e.payload();
            if (producerId.equals(p.path(PRODUCER).asText(null))) out.add(decode(e));
        }
        return out;
    }

    @Override
    public Set<String> producers() {
        Set<String> out = new TreeSet<>();
        for (LedgerEntry e : outcomeEntries()) {
            String id = e.payload().path(PRODUCER).asText(null);
            if (id != null) out.add(id);
        }
        return out;
    }

    private List<LedgerEntry> outcomeEntries() {
        return ledger.query(LedgerQuery.builder().kinds(EntryKind.OUTCOME).build());
    }

    static Outcome decode(LedgerEntry e) {
        JsonNode p = e.payload();
        JsonNode actual = p.get(ACTUAL);
        if (actual == null || !actual.isBoolean()) {
            throw new IllegalArgumentException("outcome entry " + e.sequence() + " has no boolean '" + ACTUAL + "'");
        }
        Instant at = p.hasNonNull(VERIFIED_AT)
                ? Instant.parse(p.get(VERIFIED_AT).asText())
                : Instant.ofEpochMilli(e.timestampEpochMs());
        return new Outcome(p.path(PRODUCER).asText(), ConfidenceCodec.fromJson(p.get(PREDICTED)), actual.asBoolean(), at);
    }
}
