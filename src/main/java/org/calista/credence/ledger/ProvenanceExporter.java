package org.calista.credence.ledger;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-side transform from ledger entries to a {@link ProvenanceDocument} and back.
 * Nothing here writes to the ledger.
 */
public final class ProvenanceExporter {

    private static final String ENTRY_PREFIX = ProvenanceDocument.NS_LEDGER + ":entry/";
    private static final String ACTIVITY_PREFIX = ProvenanceDocument.NS_LEDGER + ":activity/";
    private static final String AGENT_PREFIX = ProvenanceDocument.NS_LEDGER + ":agent/";

    /**
     * What an exported entry carries back.
     */
    public record ReconstructedEntry(long sequence,
                                     EntryKind kind,
                                     JsonNode payload,
                                     String correlationId,
                                     long timestampEpochMs,
                                     List<Long> derivedFrom,
                                     Provenance provenance) {
    }

    private ProvenanceExporter() {
    }

    /** Exports {@code [from, to]} (inclusive) of the ledger. */
    public static ProvenanceDocument export(EvidenceLedger ledger, long from, long to) {
        Objects.requireNonNull(ledger, "ledger");
        List<LedgerEntry> segment = new ArrayList<>();
        Iterator<LedgerEntry> it = ledger.readFrom(from);
        while (it.hasNext()) {
            LedgerEntry e = it.next();
            if (e.sequence() > to) break;
            segment.add(e);
        }
        return export(segment);
    }

    public static ProvenanceDocument export(List<LedgerEntry> entries) {
        Objects.requireNonNull(entries, "entries");
        List<ProvenanceDocument.Entity> ents = new ArrayList<>();
        List<ProvenanceDocument.Activity> acts = new ArrayList<>();
        Map<String, ProvenanceDocument.Agent> agents = new LinkedHashMap<>();
        List<ProvenanceDocument.Generation> gens = new ArrayList<>();
        List<ProvenanceDocument.Association> assocs = new ArrayList<>();
        List<ProvenanceDocument.Derivation> ders = new ArrayList<>();

        for (LedgerEntry e : entries) {
            String entityId = entityId(e.sequence());
            String activityId = ACTIVITY_PREFIX + e.sequence();
            Provenance p = e.provenance();

            ents.add(new ProvenanceDocument.Entity(entityId, e.sequence(), e.kind(), e.correlationId(),
                    e.timestampEpochMs(), e.payload(), e.hash()));
            acts.add(new ProvenanceDocument.Activity(activityId, e.kind(), e.timestampEpochMs(), p.source(), p.method()));
            gens.add(new ProvenanceDocument.Generation(entityId, activityId));

            if (p.agent() != null) {
                String agentId = AGENT_PREFIX + URLEncoder.encode(p.agent(), StandardCharsets.UTF_8);
                agents.putIfAbsent(agentId, new ProvenanceDocument.Agent(agentId, p.agent()));
                assocs.add(new ProvenanceDocument.Association(activityId, agentId));
            }
            for (Long parent : e.derivedFrom()) {
                ders.add(new ProvenanceDocument.Derivation(entityId, entityId(parent)));
            }
        }
        return new ProvenanceDocument(ents, acts, new ArrayList<>(agents.values()), gens, assocs, ders);
    }

    /**
     * Re-derives the ordered entries from a document. Parents outside the exported
     * segment are kept as sequence numbers.
     */
    public static List<ReconstructedEntry> reconstruct(ProvenanceDocument doc) {
        Objects.requireNonNull(doc, "doc");

        Map<String, ProvenanceDocument.Activity> activities = new HashMap<>();
        for (ProvenanceDocument.Activity a : doc.activities()) activities.put(a.id(), a);
        Map<String, String> agentNames = new HashMap<>();
        for (ProvenanceDocument.Agent a : doc.agents()) agentNames.put(a.id(), a.name());

        Map<String, String> activityOf = new HashMap<>();
        for (ProvenanceDocument.Generation g : doc.generations()) activityOf.put(g.entity(), g.activity());
        Map<String, String> agentOf = new HashMap<>();
        for (ProvenanceDocument.Association a : doc.associations()) agentOf.put(a.activity(), a.agent());
        Map<String, List<Long>> parents = new HashMap<>();
        for (ProvenanceDocument.Derivation d : doc.derivations()) {
            parents.computeIfAbsent(d.generatedEntity(), k -> new ArrayList<>()).add(sequenceOf(d.usedEntity()));
        }

        List<ReconstructedEntry> out = new ArrayList<>();
        for (ProvenanceDocument.Entity e : doc.entities()) {
            String actId = activityOf.get(e.id());
            ProvenanceDocument.Activity act = actId == null ? null : activities.get(actId);
            String agentId = actId == null ? null : agentOf.get(actId);
            String agent = agentId == null ? null : agentNames.getOrDefault(agentId, decodeAgent(agentId));
            Provenance p = Provenance.of(act == null ? null : act.source(), act == null ? null : act.method(), agent);

            out.add(new ReconstructedEntry(e.sequence(), e.kind(), e.payload(), e.correlationId(),
                    e.timestampEpochMs(), List.copyOf(parents.getOrDefault(e.id(), List.of())), p));
        }
        out.sort(Comparator.comparingLong(ReconstructedEntry::sequence));
        return out;
    }

    private static String entityId(long sequence) {
        return ENTRY_PREFIX + sequence;
    }

    private static long sequenceOf(String entityId) {
        if (!entityId.startsWith(ENTRY_PREFIX)) throw new IllegalArgumentException("not a ledger entity: " + entityId);
        return Long.parseLong(entityId.substring(ENTRY_PREFIX.length()));
    }

    private static String decodeAgent(String agentId) {
        if (!agentId.startsWith(AGENT_PREFIX)) return agentId;
        return URLDecoder.decode(agentId.substring(AGENT_PREFIX.length()), StandardCharsets.UTF_8);
    }
}
