package org.calista.credence.defeat;

import com.fasterxml.jackson.databind.JsonNode;
import org.calista.credence.confidence.ConfidenceCodec;
import org.calista.credence.ledger.EntryDraft;
import org.calista.credence.ledger.EntryKind;
import org.calista.credence.ledger.EvidenceLedger;
import org.calista.credence.ledger.LedgerEntry;
import org.calista.credence.ledger.LedgerQuery;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ledger form of defeaters.
 *
 * <p>
 * A {@link EntryKind#DEFEATER} entry carries {@code {id, kind, attacks, strength}}. When the
 * same id is recorded twice the later entry wins; {@code "retracted": true} removes it.
 * </p>
 */
public final class DefeaterRecords {

    public static final String RETRACTED = "retracted";

    private DefeaterRecords() {
    }

    public static EntryDraft toDraft(Defeater d, String correlationId, long... derivedFrom) {
        Objects.requireNonNull(d, "defeater");
        return EntryDraft.builder(EntryKind.DEFEATER)
                .put("id", d.id())
                .put("kind", d.kind().wireName())
                .put("attacks", d.attacks())
                .put("strength", ConfidenceCodec.toJson(d.strength()))
                .correlationId(correlationId)
                .derivedFrom(derivedFrom)
                .build();
    }

    public static EntryDraft retraction(String defeaterId, String correlationId) {
        return EntryDraft.builder(EntryKind.DEFEATER)
                .put("id", defeaterId)
                .put(RETRACTED, true)
                .correlationId(correlationId)
                .build();
    }

    public static Defeater fromEntry(LedgerEntry e) {
        if (e.kind() != EntryKind.DEFEATER) {
            throw new IllegalArgumentException("entry " + e.sequence() + " is " + e.kind().wireName() + ", not a defeater");
        }
        JsonNode p = e.payload();
        return new Defeater(
                text(p, "id", e),
                DefeaterKind.fromWire(text(p, "kind", e)),
                text(p, "attacks", e),
                ConfidenceCodec.fromJson(p.get("strength")));
    }

    /** Current defeaters of a session, or of the whole ledger when {@code correlationId} is null. */
    public static List<Defeater> read(EvidenceLedger ledger, String correlationId) {
        Objects.requireNonNull(ledger, "ledger");
        LedgerQuery.Builder q = LedgerQuery.builder().kinds(EntryKind.DEFEATER);
        if (correlationId != null) q.correlationId(correlationId);

        Map<String, Defeater> current = new LinkedHashMap<>();
        for (LedgerEntry e : ledger.query(q.build())) {
            JsonNode p = e.payload();
            if (p.path(RETRACTED).asBoolean(false)) {
                current.remove(text(p, "id", e));
                continue;
            }
            Defeater d = fromEntry(e);
            current.remove(d.id());
            current.put(d.id(), d);
        }
        return new ArrayList<>(current.values());
    }

    private static String text(JsonNode p, String field, LedgerEntry e) {
        JsonNode v = p.get(field);
        if (v == null || !v.isTextual()) {
            throw new IllegalArgumentException("defeater entry " + e.sequence() + " has no '" + field + "'");
        }
        return v.asText();
    }
}
