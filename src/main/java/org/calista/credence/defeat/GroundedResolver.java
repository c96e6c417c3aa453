package org.calista.credence.defeat;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.credence.claim.Claim;
import org.calista.credence.confidence.ConfidenceAlgebra;
import org.calista.credence.confidence.ConfidenceValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * GroundedResolver — computes the grounded extension of an {@link AttackGraph}.
 *
 * <p>
 * Let {@code F(S)} be the defeaters with no attacker in {@code S}. {@code F} is antitone,
 * so each iteration applies it twice; starting from the empty set the iterates of
 * {@code F²} grow monotonically to the least fixed point. The loop stops on a repeat or
 * at {@code maxIterations}; hitting the cap is reported as {@code converged == false},
 * never as an exception.
 * </p>
 *
 * <p>
 * Stateless between calls; one instance may serve concurrent resolutions of different
 * graphs.
 * </p>
 */
public final class GroundedResolver {

    private static final Logger log = LogManager.getLogger(GroundedResolver.class);

    public static final int DEFAULT_MAX_ITERATIONS = 1000;

    private final int maxIterations;
    private final CycleDetector cycles;

    public GroundedResolver() {
        this(DEFAULT_MAX_ITERATIONS);
    }

    public GroundedResolver(int maxIterations) {
        this(maxIterations, new CycleDetector());
    }

    public GroundedResolver(int maxIterations, CycleDetector cycles) {
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be >= 1");
        this.maxIterations = maxIterations;
        this.cycles = Objects.requireNonNull(cycles, "cycles");
    }

    public int maxIterations() {
        return maxIterations;
    }

    public DefeaterResolutionResult resolve(AttackGraph g) {
        Objects.requireNonNull(g, "graph");
        long t0 = System.nanoTime();
        int n = g.nodeCount();

        boolean[] active = new boolean[n];
        int iterations = 0;
        boolean converged = false;
        while (iterations < maxIterations) {
            boolean[] next = step(g, step(g, active));
            iterations++;
            if (Arrays.equals(next, active)) {
                converged = true;
                break;
            }
            active = next;
        }

        Set<String> activeIds = new LinkedHashSet<>();
        Set<String> inactiveIds = new LinkedHashSet<>();
        Set<String> undecidedIds = new LinkedHashSet<>();
        boolean[] undecided = new boolean[n];
        for (int i = 0; i < n; i++) {
            if (g.isClaim(i)) continue;
            if (active[i]) {
                activeIds.add(g.idAt(i));
                continue;
            }
            inactiveIds.add(g.idAt(i));
            if (!attackedByAny(g, i, active)) {
                undecided[i] = true;
                undecidedIds.add(g.idAt(i));
            }
        }

        List<List<String>> found = cycles.find(g);

        Map<String, ClaimVerdict> verdicts = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            if (!g.isClaim(i)) continue;
            verdicts.put(g.idAt(i), verdict(g, i, active, undecided, converged));
        }

        if (!converged) {
            log.warn("defeat.resolve did not converge: iterations={} active={} undecided={} cycles={}",
                    iterations, activeIds.size(), undecidedIds.size(), found);
        } else if (log.isDebugEnabled()) {
            log.debug("defeat.resolve nodes={} edges={} iterations={} active={} undecided={} cycles={} dtUs={}",
                    n, g.edgeCount(), iterations, activeIds.size(), undecidedIds.size(), found.size(),
                    (System.nanoTime() - t0) / 1000);
        }
        return new DefeaterResolutionResult(activeIds, inactiveIds, undecidedIds, converged, iterations, found, verdicts);
    }

    // F(S): defeaters none of whose attackers is in S
    private static boolean[] step(AttackGraph g, boolean[] s) {
        int n = g.nodeCount();
        boolean[] out = new boolean[n];
        for (int i = 0; i < n; i++) {
            if (g.isClaim(i)) continue;
            out[i] = !attackedByAny(g, i, s);
        }
        return out;
    }

    private static boolean attackedByAny(AttackGraph g, int node, boolean[] s) {
        for (int a : g.attackerIdx(node)) {
            if (s[a]) return true;
        }
        return false;
    }

    private static ClaimVerdict verdict(AttackGraph g, int node, boolean[] active, boolean[] undecided, boolean converged) {
        String id = g.idAt(node);
        Claim claim = g.claims().get(id);
        ConfidenceValue base = claim.confidence();

        List<String> activeAttackers = new ArrayList<>();
        List<String> unresolved = new ArrayList<>();
        ConfidenceValue effective = base;
        for (int a : g.attackerIdx(node)) {
            String did = g.idAt(a);
            if (active[a]) {
                activeAttackers.add(did);
                Defeater d = g.defeaters().get(did);
                effective = ConfidenceAlgebra.meet(effective, ConfidenceAlgebra.complement(d.strength()));
            } else if (undecided[a]) {
                unresolved.add(did);
            }
        }

        boolean defeated = !activeAttackers.isEmpty();
        StringBuilder note = new StringBuilder();
        if (!unresolved.isEmpty()) {
            note.append(defeated ? "also attacked by unresolved defeaters " : "attacked only by unresolved defeaters ")
                    .append(unresolved)
                    .append(defeated ? "" : "; treated as not defeated");
        }
        if (!converged && (!unresolved.isEmpty() || defeated)) {
            if (note.length() > 0) note.append("; ");
            note.append("resolution hit the iteration cap before converging");
        }
        if (defeated && effective.isAbsent()) {
            if (note.length() > 0) note.append("; ");
            note.append("an active defeater has no known strength, effective confidence is unknown");
        }
        return new ClaimVerdict(id, base, effective, activeAttackers, unresolved, defeated, note.toString());
    }
}
