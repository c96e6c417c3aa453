package org.calista.credence.defeat;

import org.calista.credence.claim.Claim;
import org.calista.credence.confidence.AbsentReason;
import org.calista.credence.confidence.ConfidenceValue;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GroundedResolverTest {

    private final GroundedResolver resolver = new GroundedResolver();

    private static Claim claim(String id) {
        return Claim.entertained(id, "doc#" + id, "model-a", ConfidenceValue.certain("compiler accepted"));
    }

    private static Defeater defeater(String id, String attacks, double strength) {
        return new Defeater(id, DefeaterKind.REBUTTING, attacks,
                ConfidenceValue.measured(strength, "defeater-bench", 40, strength, strength));
    }

    @Test
    void unattackedDefeaterIsActiveAndLowersConfidence() {
        AttackGraph g = AttackGraph.builder()
                .addClaim(claim("c1"))
                .addDefeater(defeater("d1", "c1", 0.7))
                .build();

        DefeaterResolutionResult r = resolver.resolve(g);

        assertTrue(r.converged());
        assertEquals(Set.of("d1"), r.active());
        ClaimVerdict v = r.verdict("c1").orElseThrow();
        assertTrue(v.defeated());
        assertEquals(List.of("d1"), v.activeDefeaters());
        assertEquals(0.3, v.effectiveConfidence().pointValue().getAsDouble(), 1e-9);
        assertEquals(1.0, v.baseConfidence().pointValue().getAsDouble());
        assertFalse(v.hasDisclosure());
    }

    @Test
    void metaDefeaterReinstatesClaim() {
        AttackGraph g = AttackGraph.builder()
                .addClaim(claim("c1"))
                .addDefeater(defeater("B", "c1", 0.9))
                .addDefeater(defeater("A", "B", 0.9))
                .build();

        DefeaterResolutionResult r = resolver.resolve(g);

        assertTrue(r.isActive("A"));
        assertFalse(r.isActive("B"));
        assertTrue(r.undecided().isEmpty());
        ClaimVerdict v = r.verdict("c1").orElseThrow();
        assertFalse(v.defeated());
        assertEquals(1.0, v.effectiveConfidence().pointValue().getAsDouble(), 1e-9);
        assertFalse(v.hasDisclosure());
    }

    @Test
    void mutualAttackLeavesBothUndecided() {
        AttackGraph g = AttackGraph.builder()
                .addClaim(claim("c1"))
                .addDefeater(defeater("A", "B", 0.8))
                .addDefeater(defeater("B", "A", 0.8))
                .attack("A", "c1")
                .build();

        DefeaterResolutionResult r = resolver.resolve(g);

        assertTrue(r.converged());
        assertTrue(r.active().isEmpty());
        assertEquals(Set.of("A", "B"), r.inactive());
        assertEquals(Set.of("A", "B"), r.undecided());
        assertEquals(List.of(List.of("A", "B")), r.cycles());

        ClaimVerdict v = r.verdict("c1").orElseThrow();
        assertFalse(v.defeated());
        assertEquals(List.of("A"), v.unresolvedDefeaters());
        assertTrue(v.hasDisclosure());
        assertTrue(v.disclosure().contains("unresolved"));
    }

    @Test
    void oddCycleIsReported() {
        AttackGraph g = AttackGraph.builder()
                .addClaim(claim("c1"))
                .addDefeater(defeater("A", "B", 0.5))
                .addDefeater(defeater("B", "C", 0.5))
                .addDefeater(defeater("C", "A", 0.5))
                .attack("C", "c1")
                .build();

        DefeaterResolutionResult r = resolver.resolve(g);

        assertTrue(r.hasCycles());
        assertEquals(List.of(List.of("A", "B", "C")), r.cycles());
        assertEquals(Set.of("A", "B", "C"), r.undecided());
        assertEquals(List.of("C"), r.verdict("c1").orElseThrow().unresolvedDefeaters());
    }

    @Test
    void iterationCapReportsNonConvergence() {
        AttackGraph g = AttackGraph.builder()
                .addClaim(claim("c1"))
                .addDefeater(defeater("C", "c1", 0.6))
                .addDefeater(defeater("B", "C", 0.6))
                .addDefeater(defeater("A", "B", 0.6))
                .build();

        DefeaterResolutionResult capped = new GroundedResolver(1).resolve(g);

        assertFalse(capped.converged());
        assertEquals(1, capped.iterations());
        assertEquals(Set.of("A"), capped.active());
        assertTrue(capped.cycles().isEmpty());
        ClaimVerdict v = capped.verdict("c1").orElseThrow();
        assertEquals(List.of("C"), v.unresolvedDefeaters());
        assertTrue(v.disclosure().contains("iteration cap"));

        DefeaterResolutionResult full = resolver.resolve(g);
        assertTrue(full.converged());
        assertEquals(Set.of("A", "C"), full.active());
        assertTrue(full.verdict("c1").orElseThrow().defeated());
    }

    @Test
    void multipleActiveAttackersTakeTheStrongest() {
        AttackGraph g = AttackGraph.builder()
                .addClaim(claim("c1"))
                .addDefeater(defeater("d1", "c1", 0.2))
                .addDefeater(defeater("d2", "c1", 0.6))
                .build();

        ClaimVerdict v = resolver.resolve(g).verdict("c1").orElseThrow();

        assertEquals(2, v.activeDefeaters().size());
        assertEquals(0.4, v.effectiveConfidence().pointValue().getAsDouble(), 1e-9);
    }

    @Test
    void absentStrengthMakesEffectiveConfidenceUnknown() {
        AttackGraph g = AttackGraph.builder()
                .addClaim(claim("c1"))
                .addDefeater(new Defeater("d1", DefeaterKind.UNDERCUTTING, "c1",
                        ConfidenceValue.absent(AbsentReason.UNCALIBRATED)))
                .build();

        ClaimVerdict v = resolver.resolve(g).verdict("c1").orElseThrow();

        assertTrue(v.defeated());
        assertTrue(v.effectiveConfidence().isAbsent());
        assertTrue(v.hasDisclosure());
    }

    @Test
    void emptyGraphResolvesTrivially() {
        DefeaterResolutionResult r = resolver.resolve(AttackGraph.empty());

        assertTrue(r.converged());
        assertTrue(r.active().isEmpty());
        assertTrue(r.claimVerdicts().isEmpty());
    }

    @Test
    void longAttackChainConvergesUnderDefaultCap() {
        AttackGraph.Builder b = AttackGraph.builder().addClaim(claim("c"));
        b.addDefeater(defeater("d0", "c", 0.8));
        for (int i = 1; i < 999; i++) b.addDefeater(defeater("d" + i, "d" + (i - 1), 0.8));
        AttackGraph g = b.build();

        DefeaterResolutionResult r = resolver.resolve(g);

        assertTrue(r.converged());
        assertEquals(501, r.iterations());
        for (int i = 0; i < 999; i++) {
            assertEquals(i % 2 == 0, r.isActive("d" + i), "d" + i);
        }
        assertEquals(500, r.active().size());
        assertTrue(r.undecided().isEmpty());
        assertFalse(r.hasCycles());
        assertTrue(r.verdict("c").orElseThrow().defeated());
    }

    @Test
    void denseRandomGraphConvergesToAGroundedSet() {
        Random rnd = new Random(20260115L);
        int size = 999;
        AttackGraph.Builder b = AttackGraph.builder().addClaim(claim("c"));
        Set<String> edges = new HashSet<>();
        for (int i = 0; i < size; i++) {
            int t;
            do {
                t = rnd.nextInt(size + 1) - 1;
            } while (t == i);
            String target = t < 0 ? "c" : "d" + t;
            b.addDefeater(defeater("d" + i, target, 0.5));
            edges.add("d" + i + ">" + target);
        }
        // one guaranteed cycle
        for (String[] e : new String[][]{{"d1", "d2"}, {"d2", "d1"}}) {
            if (edges.add(e[0] + ">" + e[1])) b.attack(e[0], e[1]);
        }
        while (edges.size() < 3000) {
            int a = rnd.nextInt(size);
            int t = rnd.nextInt(size);
            if (a == t) continue;
            if (edges.add("d" + a + ">d" + t)) b.attack("d" + a, "d" + t);
        }
        AttackGraph g = b.build();
        assertEquals(3000, g.edgeCount());

        DefeaterResolutionResult r = resolver.resolve(g);

        assertTrue(r.converged());
        assertTrue(r.iterations() <= GroundedResolver.DEFAULT_MAX_ITERATIONS);
        assertTrue(r.hasCycles());
        for (String id : g.defeaters().keySet()) {
            List<String> attackers = g.attackersOf(id);
            if (r.isActive(id)) {
                // conflict-free, and every attacker is itself beaten by an active defeater
                for (String a : attackers) {
                    assertFalse(r.isActive(a), id + " attacked by active " + a);
                    assertTrue(g.attackersOf(a).stream().anyMatch(r::isActive), id + " undefended from " + a);
                }
            } else if (!r.undecided().contains(id)) {
                assertTrue(attackers.stream().anyMatch(r::isActive), id);
            }
        }
        assertEquals(r.active(), resolver.resolve(g).active());
    }
}
