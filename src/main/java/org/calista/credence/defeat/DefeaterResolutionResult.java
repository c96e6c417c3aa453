package org.calista.credence.defeat;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Result of one {@link GroundedResolver} run.
 *
 * <p>
 * {@code inactive} is every defeater that is not active. Within it, {@code undecided}
 * are the ones no active defeater attacks (mutual or odd cycles, or the part left
 * open when the iteration cap was hit). A run that hit the cap has
 * {@code converged == false}; its {@code active} set is still sound, only smaller.
 * </p>
 */
public record DefeaterResolutionResult(Set<String> active,
                                       Set<String> inactive,
                                       Set<String> undecided,
                                       boolean converged,
                                       int iterations,
                                       List<List<String>> cycles,
                                       Map<String, ClaimVerdict> claimVerdicts) {

    public DefeaterResolutionResult {
        active = Collections.unmodifiableSet(new LinkedHashSet<>(active));
        inactive = Collections.unmodifiableSet(new LinkedHashSet<>(inactive));
        undecided = Collections.unmodifiableSet(new LinkedHashSet<>(undecided));
        cycles = List.copyOf(cycles);
        claimVerdicts = Collections.unmodifiableMap(new LinkedHashMap<>(claimVerdicts));
    }

    public boolean isActive(String defeaterId) {
        return active.contains(defeaterId);
    }

    public boolean hasCycles() {
        return !cycles.isEmpty();
    }

    public Optional<ClaimVerdict> verdict(String claimId) {
        return Optional.ofNullable(claimVerdicts.get(claimId));
    }
}
