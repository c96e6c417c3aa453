package org.calista.credence.defeat;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Lists the claims transitively affected when a claim is defeated.
 *
 * <p>
 * Walks dependency edges breadth-first: claims that {@code depend on} or {@code assume}
 * the defeated claim, and claims it {@code supports}, then their dependents, up to
 * {@code maxDepth}. Nothing is changed here; {@link ClaimStatusUpdater} applies the
 * suggested reductions.
 * </p>
 */
public final class DefeatPropagator {

    public static final int DEFAULT_MAX_DEPTH = 10;

    /** Reduction suggested for a direct {@code depends_on} dependent. */
    public static final double DIRECT_REDUCTION = 0.3;
    public static final double TRANSITIVE_REDUCTION = 0.15;

    public enum DependencyType {
        /** {@code from} is only valid if {@code to} is. */
        DEPENDS_ON,
        /** {@code from} takes {@code to} for granted. */
        ASSUMES,
        /** {@code from} lends support to {@code to}. */
        SUPPORTS
    }

    public enum SuggestedAction {
        MARK_STALE,
        REVALIDATE,
        INVESTIGATE
    }

    public record Dependency(String from, String to, DependencyType type) {
        public Dependency {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
            Objects.requireNonNull(type, "type");
        }
    }

    /**
     * @param path               claims from the defeated one up to (not including) this one
     * @param depth              0 for direct dependents
     * @param suggestedReduction confidence reduction for {@code depends_on} dependents, else 0
     */
    public record AffectedClaim(String claimId,
                                String reason,
                                List<String> path,
                                DependencyType dependencyType,
                                SuggestedAction action,
                                int depth,
                                double suggestedReduction) {
        public AffectedClaim {
            path = List.copyOf(path);
        }
    }

    private final Map<String, List<Dependency>> byTarget = new HashMap<>();
    private final Map<String, List<Dependency>> bySource = new HashMap<>();
    private final int maxDepth;

    public DefeatPropagator(List<Dependency> dependencies) {
        this(dependencies, DEFAULT_MAX_DEPTH);
    }

    public DefeatPropagator(List<Dependency> dependencies, int maxDepth) {
        Objects.requireNonNull(dependencies, "dependencies");
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1");
        this.maxDepth = maxDepth;
        for (Dependency d : dependencies) {
            byTarget.computeIfAbsent(d.to(), k -> new ArrayList<>()).add(d);
            bySource.computeIfAbsent(d.from(), k -> new ArrayList<>()).add(d);
        }
    }

    private record Step(String claimId, List<String> path, int depth, DependencyType via) {
    }

    public List<AffectedClaim> propagate(String defeatedClaimId) {
        Objects.requireNonNull(defeatedClaimId, "defeatedClaimId");
        List<AffectedClaim> out = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        visited.add(defeatedClaimId);

        Deque<Step> queue = new ArrayDeque<>();
        enqueueNeighbours(queue, defeatedClaimId, List.of(defeatedClaimId), 0);

        while (!queue.isEmpty()) {
            Step cur = queue.poll();
            if (cur.depth() >= maxDepth || !visited.add(cur.claimId())) continue;

            out.add(new AffectedClaim(cur.claimId(), reason(cur), cur.path(), cur.via(),
                    action(cur.via(), cur.depth()), cur.depth(), reduction(cur.via(), cur.depth())));

            List<String> next = new ArrayList<>(cur.path());
            next.add(cur.claimId());
            enqueueNeighbours(queue, cur.claimId(), next, cur.depth() + 1);
        }
        return Collections.unmodifiableList(out);
    }

    private void enqueueNeighbours(Deque<Step> queue, String claimId, List<String> path, int depth) {
        for (Dependency d : byTarget.getOrDefault(claimId, List.of())) {
            if (d.type() == DependencyType.DEPENDS_ON || d.type() == DependencyType.ASSUMES) {
                queue.add(new Step(d.from(), path, depth, d.type()));
            }
        }
        for (Dependency d : bySource.getOrDefault(claimId, List.of())) {
            if (d.type() == DependencyType.SUPPORTS) {
                queue.add(new Step(d.to(), path, depth, d.type()));
            }
        }
    }

    private static SuggestedAction action(DependencyType via, int depth) {
        return switch (via) {
            case DEPENDS_ON -> depth == 0 ? SuggestedAction.MARK_STALE : SuggestedAction.REVALIDATE;
            case ASSUMES -> SuggestedAction.INVESTIGATE;
            case SUPPORTS -> depth == 0 ? SuggestedAction.REVALIDATE : SuggestedAction.INVESTIGATE;
        };
    }

    private static double reduction(DependencyType via, int depth) {
        if (via != DependencyType.DEPENDS_ON) return 0.0;
        return depth == 0 ? DIRECT_REDUCTION : TRANSITIVE_REDUCTION;
    }

    private static String reason(Step s) {
        List<String> full = new ArrayList<>(s.path());
        full.add(s.claimId());
        return "affected via " + s.via().name().toLowerCase(Locale.ROOT) + " chain: " + String.join(" -> ", full);
    }
}
