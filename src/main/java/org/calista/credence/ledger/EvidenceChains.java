package org.calista.credence.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import org.calista.credence.confidence.AbsentPolicy;
import org.calista.credence.confidence.AbsentReason;
import org.calista.credence.confidence.ConfidenceAlgebra;
import org.calista.credence.confidence.ConfidenceCodec;
import org.calista.credence.confidence.ConfidenceValue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Walks {@code derivedFrom} links back from an entry and scores the resulting chain.
 *
 * <p>
 * Entries carry their own confidence in {@code payload.confidence} (tagged JSON form).
 * Contradictions are {@link EntryKind#CONTRADICTION} entries inside the chain or
 * deriving from any chain member; their {@code payload.severity} lowers the chain
 * confidence: blocking sets it to 0, each significant one halves it (not below
 * 0.1 unless it already was), each minor one multiplies by 0.9.
 * </p>
 */
public final class EvidenceChains {

    public static final String CONFIDENCE_FIELD = "confidence";
    public static final String SEVERITY_FIELD = "severity";
    public static final int DEFAULT_MAX_DEPTH = 64;

    public enum Aggregation {
        /** Weakest link. */
        MIN,
        MAX,
        PRODUCT,
        WEIGHTED_AVERAGE,
        NOISY_OR
    }

    public enum Severity {
        BLOCKING,
        SIGNIFICANT,
        MINOR;

        static Severity parse(JsonNode payload) {
            JsonNode s = payload.get(SEVERITY_FIELD);
            if (s == null || !s.isTextual()) return MINOR;
            try {
                return valueOf(s.asText().trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return MINOR;
            }
        }
    }

    public record EvidenceChain(long root,
                                List<LedgerEntry> entries,
                                List<LedgerEntry> contradictions,
                                Aggregation aggregation,
                                ConfidenceValue confidence,
                                boolean truncated) {
    }

    private final EvidenceLedger ledger;
    private final int maxDepth;

    public EvidenceChains(EvidenceLedger ledger) {
        this(ledger, DEFAULT_MAX_DEPTH);
    }

    public EvidenceChains(EvidenceLedger ledger, int maxDepth) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1");
        this.maxDepth = maxDepth;
    }

    public EvidenceChain chain(long root, Aggregation aggregation) {
        Objects.requireNonNull(aggregation, "aggregation");
        LedgerEntry start = ledger.get(root)
                .orElseThrow(() -> new IllegalArgumentException("unknown sequence " + root));

        // BFS over ancestors
        Set<Long> seen = new HashSet<>();
        List<LedgerEntry> members = new ArrayList<>();
        Deque<long[]> queue = new ArrayDeque<>();
        queue.add(new long[]{start.sequence(), 0});
        seen.add(start.sequence());
        boolean truncated = false;
        while (!queue.isEmpty()) {
            long[] cur = queue.poll();
            LedgerEntry e = ledger.get(cur[0]).orElseThrow();
            members.add(e);
            for (Long parent : e.derivedFrom()) {
                if (seen.contains(parent)) continue;
                if (cur[1] + 1 > maxDepth) {
                    truncated = true;
                    continue;
                }
                seen.add(parent);
                queue.add(new long[]{parent, cur[1] + 1});
            }
        }
        // derivedFrom always points backwards, so sequence order is a topological order
        members.sort(Comparator.comparingLong(LedgerEntry::sequence));

        List<LedgerEntry> contradictions = new ArrayList<>();
        for (LedgerEntry e : members) if (e.kind() == EntryKind.CONTRADICTION) contradictions.add(e);
        for (LedgerEntry c : ledger.query(LedgerQuery.builder().kinds(EntryKind.CONTRADICTION).build())) {
            if (seen.contains(c.sequence())) continue;
            for (Long target : c.derivedFrom()) {
                if (seen.contains(target)) {
                    contradictions.add(c);
                    break;
                }
            }
        }

        ConfidenceValue conf = penalize(aggregate(members, aggregation), contradictions);
        return new EvidenceChain(root, Collections.unmodifiableList(members),
                Collections.unmodifiableList(contradictions), aggregation, conf, truncated);
    }

    static ConfidenceValue aggregate(List<LedgerEntry> members, Aggregation aggregation) {
        List<ConfidenceValue> values = new ArrayList<>();
        for (LedgerEntry e : members) {
            if (e.kind() == EntryKind.CONTRADICTION) continue;
            JsonNode c = e.payload().get(CONFIDENCE_FIELD);
            if (c != null && c.isObject()) values.add(ConfidenceCodec.fromJson(c));
        }
        if (values.isEmpty()) return ConfidenceValue.absent(AbsentReason.INSUFFICIENT_DATA);

        return switch (aggregation) {
            case MIN -> ConfidenceAlgebra.sequence(values);
            case MAX -> {
                ConfidenceValue acc = values.get(0);
                for (int i = 1; i < values.size(); i++) acc = ConfidenceAlgebra.join(acc, values.get(i));
                yield acc;
            }
            case PRODUCT -> ConfidenceAlgebra.parallelAll(values);
            case WEIGHTED_AVERAGE -> ConfidenceAlgebra.weightedAverage(values, Collections.nCopies(values.size(), 1.0));
            case NOISY_OR -> ConfidenceAlgebra.parallelAny(values, AbsentPolicy.PROPAGATE);
        };
    }

    static ConfidenceValue penalize(ConfidenceValue value, List<LedgerEntry> contradictions) {
        if (contradictions.isEmpty() || value.isAbsent()) return value;
        int blocking = 0;
        int significant = 0;
        int minor = 0;
        for (LedgerEntry c : contradictions) {
            switch (Severity.parse(c.payload())) {
                case BLOCKING -> blocking++;
                case SIGNIFICANT -> significant++;
                case MINOR -> minor++;
            }
        }
        double v = value.pointValue().getAsDouble();
        double factor;
        if (blocking > 0) {
            factor = 0.0;
        } else if (significant > 0) {
            double target = Math.max(Math.min(v, 0.1), v * Math.pow(0.5, significant));
            factor = v == 0.0 ? 1.0 : target / v;
        } else {
            factor = Math.pow(0.9, minor);
        }
        return ConfidenceAlgebra.discount(value, Math.min(1.0, factor));
    }
}
