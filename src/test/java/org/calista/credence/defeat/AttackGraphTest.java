package org.calista.credence.defeat;

import org.calista.credence.claim.Claim;
import org.calista.credence.confidence.ConfidenceValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AttackGraphTest {

    private static final ConfidenceValue STRONG = ConfidenceValue.measured(0.9, "d", 10, 0.8, 1.0);

    private static Claim claim(String id) {
        return Claim.entertained(id, null, "model-a", STRONG);
    }

    @Test
    void selfAttackIsRejectedAtConstruction() {
        assertThatThrownBy(() -> AttackGraph.builder()
                .addDefeater(new Defeater("d1", DefeaterKind.UNDERCUTTING, "d1", STRONG)))
                .isInstanceOf(ReflexivityViolationException.class)
                .satisfies(e -> assertThat(((ReflexivityViolationException) e).nodeId()).isEqualTo("d1"));

        assertThatThrownBy(() -> AttackGraph.builder().attack("d2", "d2"))
                .isInstanceOf(ReflexivityViolationException.class);
    }

    @Test
    void unknownEndpointsAndDuplicatesAreRejected() {
        assertThatThrownBy(() -> AttackGraph.builder()
                .addDefeater(new Defeater("d1", DefeaterKind.REBUTTING, "missing", STRONG))
                .build())
                .isInstanceOf(GraphConstructionException.class)
                .hasMessageContaining("missing");

        assertThatThrownBy(() -> AttackGraph.builder().addClaim(claim("x")).addClaim(claim("x")))
                .isInstanceOf(GraphConstructionException.class);

        assertThatThrownBy(() -> AttackGraph.builder()
                .addClaim(claim("c1"))
                .addClaim(claim("c2"))
                .attack("c1", "c2"))
                .isInstanceOf(GraphConstructionException.class);
    }

    @Test
    void exposesAdjacency() {
        AttackGraph g = AttackGraph.builder()
                .addClaim(claim("c1"))
                .addDefeater(new Defeater("d1", DefeaterKind.REBUTTING, "c1", STRONG))
                .addDefeater(new Defeater("d2", DefeaterKind.UNDERMINING, "d1", STRONG))
                .attack("d2", "c1")
                .build();

        assertThat(g.edgeCount()).isEqualTo(3);
        assertThat(g.attackersOf("c1")).containsExactlyInAnyOrder("d1", "d2");
        assertThat(g.targetsOf("d2")).containsExactlyInAnyOrder("d1", "c1");
        assertThat(g.contains("d2")).isTrue();
        assertThat(g.claim("c1")).isPresent();
        assertThat(g.defeater("c1")).isEmpty();
        assertThat(new CycleDetector().hasCycle(g)).isFalse();
        assertThat(g.attackersOf("d2")).isEqualTo(List.of());
        assertThatThrownBy(() -> g.attackersOf("nope")).isInstanceOf(IllegalArgumentException.class);
    }
}
