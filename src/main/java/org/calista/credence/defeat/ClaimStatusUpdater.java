package org.calista.credence.defeat;

import org.calista.credence.claim.Claim;
import org.calista.credence.claim.ClaimStatus;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies resolution verdicts to claims. Returns copies; the inputs are untouched.
 *
 * <ul>
 *     <li>a defeated claim becomes {@link ClaimStatus#DEFEATED};</li>
 *     <li>a previously defeated claim whose attackers are all out again becomes
 *     {@link ClaimStatus#ENTERTAINED};</li>
 *     <li>accepted and rejected claims keep their status unless defeated.</li>
 * </ul>
 */
public final class ClaimStatusUpdater {

    private final DefeatStrength strength;

    public ClaimStatusUpdater() {
        this(DefeatStrength.linear());
    }

    public ClaimStatusUpdater(DefeatStrength strength) {
        this.strength = Objects.requireNonNull(strength, "strength");
    }

    public Claim apply(Claim claim, ClaimVerdict verdict) {
        Objects.requireNonNull(claim, "claim");
        if (verdict == null) return claim;
        if (!claim.id().equals(verdict.claimId())) {
            throw new IllegalArgumentException("verdict for " + verdict.claimId() + " applied to " + claim.id());
        }
        if (verdict.defeated()) return claim.withStatus(ClaimStatus.DEFEATED);
        if (claim.status() == ClaimStatus.DEFEATED) return claim.withStatus(ClaimStatus.ENTERTAINED);
        return claim;
    }

    public List<Claim> apply(List<Claim> claims, DefeaterResolutionResult result) {
        Objects.requireNonNull(claims, "claims");
        Objects.requireNonNull(result, "result");
        List<Claim> out = new ArrayList<>(claims.size());
        for (Claim c : claims) out.add(apply(c, result.claimVerdicts().get(c.id())));
        return out;
    }

    /**
     * Weakens the confidence of claims that depend on a defeated one, using the
     * reductions suggested by {@link DefeatPropagator}. Claims not listed are returned
     * unchanged.
     */
    public List<Claim> applyTransitive(List<Claim> claims, List<DefeatPropagator.AffectedClaim> affected) {
        Objects.requireNonNull(claims, "claims");
        Objects.requireNonNull(affected, "affected");
        Map<String, Double> reductions = new HashMap<>();
        for (DefeatPropagator.AffectedClaim a : affected) {
            if (a.suggestedReduction() > 0.0) reductions.merge(a.claimId(), a.suggestedReduction(), Math::max);
        }
        List<Claim> out = new ArrayList<>(claims.size());
        for (Claim c : claims) {
            Double r = reductions.get(c.id());
            out.add(r == null ? c : c.withConfidence(strength.apply(c.confidence(), r)));
        }
        return out;
    }
}
