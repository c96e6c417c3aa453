package org.calista.credence.defeat;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.calista.credence.defeat.DefeatPropagator.DependencyType.ASSUMES;
import static org.calista.credence.defeat.DefeatPropagator.DependencyType.DEPENDS_ON;
import static org.calista.credence.defeat.DefeatPropagator.DependencyType.SUPPORTS;
import static org.junit.jupiter.api.Assertions.*;

class DefeatPropagatorTest {

    private static DefeatPropagator.Dependency dep(String from, String to, DefeatPropagator.DependencyType t) {
        return new DefeatPropagator.Dependency(from, to, t);
    }

    private static Map<String, DefeatPropagator.AffectedClaim> byId(List<DefeatPropagator.AffectedClaim> xs) {
        return xs.stream().collect(Collectors.toMap(DefeatPropagator.AffectedClaim::claimId, Function.identity()));
    }

    @Test
    void actionsFollowDependencyTypeAndDepth() {
        DefeatPropagator p = new DefeatPropagator(List.of(
                dep("b", "a", DEPENDS_ON),
                dep("c", "b", DEPENDS_ON),
                dep("d", "a", ASSUMES),
                dep("a", "e", SUPPORTS),
                dep("e", "f", SUPPORTS)));

        Map<String, DefeatPropagator.AffectedClaim> hit = byId(p.propagate("a"));

        assertEquals(5, hit.size());
        assertEquals(DefeatPropagator.SuggestedAction.MARK_STALE, hit.get("b").action());
        assertEquals(0.3, hit.get("b").suggestedReduction(), 1e-12);
        assertEquals(DefeatPropagator.SuggestedAction.REVALIDATE, hit.get("c").action());
        assertEquals(0.15, hit.get("c").suggestedReduction(), 1e-12);
        assertEquals(List.of("a", "b"), hit.get("c").path());
        assertEquals(1, hit.get("c").depth());
        assertEquals(DefeatPropagator.SuggestedAction.INVESTIGATE, hit.get("d").action());
        assertEquals(0.0, hit.get("d").suggestedReduction());
        assertEquals(DefeatPropagator.SuggestedAction.REVALIDATE, hit.get("e").action());
        assertEquals(DefeatPropagator.SuggestedAction.INVESTIGATE, hit.get("f").action());
    }

    @Test
    void cyclesAndDepthAreBounded() {
        DefeatPropagator cyclic = new DefeatPropagator(List.of(
                dep("b", "a", DEPENDS_ON),
                dep("a", "b", DEPENDS_ON)));
        assertEquals(List.of("b"), cyclic.propagate("a").stream().map(DefeatPropagator.AffectedClaim::claimId).toList());

        DefeatPropagator chain = new DefeatPropagator(List.of(
                dep("n1", "n0", DEPENDS_ON),
                dep("n2", "n1", DEPENDS_ON),
                dep("n3", "n2", DEPENDS_ON)), 2);
        assertEquals(List.of("n1", "n2"), chain.propagate("n0").stream().map(DefeatPropagator.AffectedClaim::claimId).toList());
    }

    @Test
    void unrelatedClaimAffectsNothing() {
        DefeatPropagator p = new DefeatPropagator(List.of(dep("b", "a", DEPENDS_ON)));

        assertTrue(p.propagate("z").isEmpty());
        assertTrue(p.propagate("b").isEmpty());
    }
}
