package org.calista.credence.defeat;

import org.calista.credence.claim.Claim;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * AttackGraph — immutable snapshot of claims, defeaters and attack edges.
 *
 * <p>
 * Nodes live in an arena and are addressed by index; edges are stored as
 * attacker → target adjacency arrays in both directions. Only defeaters attack.
 * Construction rejects self-attacks immediately and everything else invalid at
 * {@link Builder#build()}.
 * </p>
 */
public final class AttackGraph {

    private final String[] ids;
    private final boolean[] claimNode;
    private final int[][] attackers;
    private final int[][] targets;
    private final Map<String, Integer> index;
    private final Map<String, Claim> claims;
    private final Map<String, Defeater> defeaters;
    private final int edgeCount;

    private AttackGraph(Builder b, List<Edge> edges) {
        int n = b.order.size();
        this.ids = b.order.toArray(new String[0]);
        this.claimNode = new boolean[n];
        this.index = new HashMap<>(n * 2);
        for (int i = 0; i < n; i++) {
            index.put(ids[i], i);
            claimNode[i] = b.claims.containsKey(ids[i]);
        }

        List<List<Integer>> in = new ArrayList<>(n);
        List<List<Integer>> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            in.add(new ArrayList<>());
            out.add(new ArrayList<>());
        }
        for (Edge e : edges) {
            int a = index.get(e.attacker());
            int t = index.get(e.target());
            out.get(a).add(t);
            in.get(t).add(a);
        }
        this.attackers = toArrays(in);
        this.targets = toArrays(out);
        this.claims = Collections.unmodifiableMap(new LinkedHashMap<>(b.claims));
        this.defeaters = Collections.unmodifiableMap(new LinkedHashMap<>(b.defeaters));
        this.edgeCount = edges.size();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AttackGraph empty() {
        return new Builder().build();
    }

    // -------------------- id-level view --------------------

    public Map<String, Claim> claims() {
        return claims;
    }

    public Map<String, Defeater> defeaters() {
        return defeaters;
    }

    public Optional<Claim> claim(String id) {
        return Optional.ofNullable(claims.get(id));
    }

    public Optional<Defeater> defeater(String id) {
        return Optional.ofNullable(defeaters.get(id));
    }

    public boolean contains(String id) {
        return index.containsKey(id);
    }

    /** Defeaters attacking {@code id}; for a defeater this is its {@code attackedBy} set. */
    public List<String> attackersOf(String id) {
        return idsOf(attackers[require(id)]);
    }

    public List<String> targetsOf(String id) {
        return idsOf(targets[require(id)]);
    }

    public int edgeCount() {
        return edgeCount;
    }

    // -------------------- index-level view (engine) --------------------

    int nodeCount() {
        return ids.length;
    }

    String idAt(int i) {
        return ids[i];
    }

    boolean isClaim(int i) {
        return claimNode[i];
    }

    int[] attackerIdx(int i) {
        return attackers[i];
    }

    int[] targetIdx(int i) {
        return targets[i];
    }

    private int require(String id) {
        Integer i = index.get(id);
        if (i == null) throw new IllegalArgumentException("unknown node: " + id);
        return i;
    }

    private List<String> idsOf(int[] idx) {
        List<String> out = new ArrayList<>(idx.length);
        for (int i : idx) out.add(ids[i]);
        return Collections.unmodifiableList(out);
    }

    private static int[][] toArrays(List<List<Integer>> lists) {
        int[][] out = new int[lists.size()][];
        for (int i = 0; i < lists.size(); i++) {
            List<Integer> l = lists.get(i);
            int[] a = new int[l.size()];
            for (int j = 0; j < a.length; j++) a[j] = l.get(j);
            out[i] = a;
        }
        return out;
    }

    @Override
    public String toString() {
        return "AttackGraph{claims=" + claims.size() + ", defeaters=" + defeaters.size() + ", edges=" + edgeCount + "}";
    }

    private record Edge(String attacker, String target) {
    }

    public static final class Builder {
        private final List<String> order = new ArrayList<>();
        private final Map<String, Claim> claims = new LinkedHashMap<>();
        private final Map<String, Defeater> defeaters = new LinkedHashMap<>();
        private final Set<Edge> edges = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder addClaim(Claim claim) {
            Objects.requireNonNull(claim, "claim");
            register(claim.id());
            claims.put(claim.id(), claim);
            return this;
        }

        public Builder addClaims(Iterable<Claim> cs) {
            for (Claim c : cs) addClaim(c);
            return this;
        }

        /** Adds the defeater and its {@code attacks} edge. */
        public Builder addDefeater(Defeater d) {
            Objects.requireNonNull(d, "defeater");
            if (d.id().equals(d.attacks())) throw new ReflexivityViolationException(d.id());
            register(d.id());
            defeaters.put(d.id(), d);
            edges.add(new Edge(d.id(), d.attacks()));
            return this;
        }

        public Builder addDefeaters(Iterable<Defeater> ds) {
            for (Defeater d : ds) addDefeater(d);
            return this;
        }

        /** Extra attack edge. Endpoints may be added later; they are checked at build. */
        public Builder attack(String attacker, String target) {
            Objects.requireNonNull(attacker, "attacker");
            Objects.requireNonNull(target, "target");
            if (attacker.equals(target)) throw new ReflexivityViolationException(attacker);
            if (claims.containsKey(attacker)) {
                throw new GraphConstructionException("claims cannot attack: " + attacker + " -> " + target);
            }
            edges.add(new Edge(attacker, target));
            return this;
        }

        public AttackGraph build() {
            List<Edge> list = new ArrayList<>(edges.size());
            for (Edge e : edges) {
                if (claims.containsKey(e.attacker())) {
                    throw new GraphConstructionException("claims cannot attack: " + e.attacker() + " -> " + e.target());
                }
                if (!defeaters.containsKey(e.attacker())) {
                    throw new GraphConstructionException("unknown attacker: " + e.attacker());
                }
                if (!claims.containsKey(e.target()) && !defeaters.containsKey(e.target())) {
                    throw new GraphConstructionException("unknown attack target: " + e.target() + " (from " + e.attacker() + ")");
                }
                list.add(e);
            }
            return new AttackGraph(this, list);
        }

        private void register(String id) {
            if (claims.containsKey(id) || defeaters.containsKey(id)) {
                throw new GraphConstructionException("duplicate node id: " + id);
            }
            order.add(id);
        }
    }
}
