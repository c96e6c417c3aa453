package org.calista.credence.defeat;

import org.calista.credence.confidence.ConfidenceValue;

import java.util.Objects;

/**
 * Defeater — an argument against a claim or against another defeater.
 *
 * <p>
 * Whether it is active, and who attacks it, is not stored here: both come from the
 * {@link AttackGraph} it is placed in and the {@link GroundedResolver} result.
 * </p>
 *
 * @param attacks  id of the claim or defeater under attack
 * @param strength how much an active defeater takes away; its complement caps the target
 */
public record Defeater(String id, DefeaterKind kind, String attacks, ConfidenceValue strength) {

    public Defeater {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(attacks, "attacks");
        Objects.requireNonNull(strength, "strength");
        if (id.isBlank()) throw new IllegalArgumentException("defeater id must not be blank");
        if (attacks.isBlank()) throw new IllegalArgumentException("defeater " + id + " attacks nothing");
    }
}
