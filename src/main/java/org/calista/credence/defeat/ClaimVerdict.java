package org.calista.credence.defeat;

import org.calista.credence.confidence.ConfidenceValue;

import java.util.List;

/**
 * Outcome of resolution for one claim.
 *
 * @param effectiveConfidence base confidence met with the complement of every active
 *                            attacker's strength; never above the base
 * @param unresolvedDefeaters attackers left undecided (cycle or iteration cap)
 * @param disclosure          human-readable note when the verdict rests on an
 *                            unresolved attack or on a non-converged run; empty otherwise
 */
public record ClaimVerdict(String claimId,
                           ConfidenceValue baseConfidence,
                           ConfidenceValue effectiveConfidence,
                           List<String> activeDefeaters,
                           List<String> unresolvedDefeaters,
                           boolean defeated,
                           String disclosure) {

    public ClaimVerdict {
        activeDefeaters = List.copyOf(activeDefeaters);
        unresolvedDefeaters = List.copyOf(unresolvedDefeaters);
        disclosure = disclosure == null ? "" : disclosure;
    }

    public boolean hasDisclosure() {
        return !disclosure.isEmpty();
    }
}
