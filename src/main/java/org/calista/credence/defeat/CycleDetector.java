package org.calista.credence.defeat;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds attack cycles by depth-first search with an explicit stack.
 *
 * <p>
 * Every back edge found yields one cycle; cycles are rotated to start at their
 * lexicographically smallest id so the same cycle is reported once. The search is
 * O(V+E); the number of reported cycles is capped.
 * </p>
 */
public final class CycleDetector {

    public static final int DEFAULT_MAX_CYCLES = 64;

    private static final int WHITE = 0;
    private static final int GRAY = 1;
    private static final int BLACK = 2;

    private final int maxCycles;

    public CycleDetector() {
        this(DEFAULT_MAX_CYCLES);
    }

    public CycleDetector(int maxCycles) {
        if (maxCycles < 1) throw new IllegalArgumentException("maxCycles must be >= 1");
        this.maxCycles = maxCycles;
    }

    public List<List<String>> find(AttackGraph g) {
        int n = g.nodeCount();
        int[] color = new int[n];
        int[] stackNode = new int[n];
        int[] stackEdge = new int[n];
        int[] depthOf = new int[n];
        Arrays.fill(depthOf, -1);

        Set<List<String>> found = new LinkedHashSet<>();
        for (int root = 0; root < n && found.size() < maxCycles; root++) {
            if (color[root] != WHITE) continue;

            int top = 0;
            stackNode[0] = root;
            stackEdge[0] = 0;
            color[root] = GRAY;
            depthOf[root] = 0;

            while (top >= 0) {
                int u = stackNode[top];
                int[] out = g.targetIdx(u);
                if (stackEdge[top] < out.length) {
                    int v = out[stackEdge[top]++];
                    if (color[v] == WHITE) {
                        top++;
                        stackNode[top] = v;
                        stackEdge[top] = 0;
                        color[v] = GRAY;
                        depthOf[v] = top;
                    } else if (color[v] == GRAY && found.size() < maxCycles) {
                        List<String> cycle = new ArrayList<>(top - depthOf[v] + 1);
                        for (int k = depthOf[v]; k <= top; k++) cycle.add(g.idAt(stackNode[k]));
                        found.add(canonical(cycle));
                    }
                } else {
                    color[u] = BLACK;
                    depthOf[u] = -1;
                    top--;
                }
            }
        }
        List<List<String>> out = new ArrayList<>(found);
        return Collections.unmodifiableList(out);
    }

    public boolean hasCycle(AttackGraph g) {
        return !new CycleDetector(1).find(g).isEmpty();
    }

    static List<String> canonical(List<String> cycle) {
        int start = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (cycle.get(i).compareTo(cycle.get(start)) < 0) start = i;
        }
        List<String> out = new ArrayList<>(cycle.size());
        for (int i = 0; i < cycle.size(); i++) out.add(cycle.get((start + i) % cycle.size()));
        return List.copyOf(out);
    }
}
