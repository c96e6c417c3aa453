package org.calista.credence.core;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.calista.credence.calibration.CalibrationTracker;
import org.calista.credence.claim.Claim;
import org.calista.credence.claim.ClaimStatus;
import org.calista.credence.confidence.ConfidenceCodec;
import org.calista.credence.confidence.ConfidenceValue;
import org.calista.credence.confidence.DerivationException;
import org.calista.credence.confidence.DerivationProofBuilder;
import org.calista.credence.defeat.AttackGraph;
import org.calista.credence.defeat.ClaimStatusUpdater;
import org.calista.credence.defeat.ClaimVerdict;
import org.calista.credence.defeat.Defeater;
import org.calista.credence.defeat.DefeaterRecords;
import org.calista.credence.defeat.DefeaterResolutionResult;
import org.calista.credence.defeat.GroundedResolver;
import org.calista.credence.ledger.EntryDraft;
import org.calista.credence.ledger.EntryKind;
import org.calista.credence.ledger.EvidenceLedger;
import org.calista.credence.ledger.Provenance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * ClaimAssessor — the claim path end to end:
 * derive confidence → log claim and defeaters → resolve → effective confidence → status.
 *
 * <p>
 * Derivation errors abort before anything is written. Every claim that gets through
 * leaves a {@link EntryKind#CLAIM} entry, one {@link EntryKind#DEFEATER} entry per
 * defeater and a {@link EntryKind#VERIFICATION} entry with the verdict, all under the
 * request's correlation id.
 * </p>
 */
public final class ClaimAssessor {

    private static final Logger log = LoggerFactory.getLogger(ClaimAssessor.class);

    public record Request(String claimId,
                          String contentRef,
                          String producerId,
                          String formula,
                          Map<String, ConfidenceValue> inputs,
                          List<String> evidenceIds,
                          List<Defeater> defeaters,
                          String correlationId) {
        public Request {
            Objects.requireNonNull(claimId, "claimId");
            Objects.requireNonNull(producerId, "producerId");
            Objects.requireNonNull(formula, "formula");
            inputs = Map.copyOf(Objects.requireNonNull(inputs, "inputs"));
            evidenceIds = evidenceIds == null ? List.of() : List.copyOf(evidenceIds);
            defeaters = defeaters == null ? List.of() : List.copyOf(defeaters);
        }
    }

    /**
     * @param claim         the claim with its derived confidence and resolved status
     * @param claimSequence ledger sequence of the {@link EntryKind#CLAIM} entry
     */
    public record Assessment(Claim claim, long claimSequence, ClaimVerdict verdict, DefeaterResolutionResult resolution) {
        public ConfidenceValue effectiveConfidence() {
            return verdict.effectiveConfidence();
        }
    }

    private final EvidenceLedger ledger;
    private final DerivationProofBuilder proofs;
    private final GroundedResolver resolver;
    private final ClaimStatusUpdater statuses;
    private final CalibrationTracker calibration;
    private final Clock clock;

    public ClaimAssessor(EvidenceLedger ledger,
                         DerivationProofBuilder proofs,
                         GroundedResolver resolver,
                         ClaimStatusUpdater statuses,
                         CalibrationTracker calibration,
                         Clock clock) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.proofs = Objects.requireNonNull(proofs, "proofs");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.statuses = Objects.requireNonNull(statuses, "statuses");
        this.calibration = Objects.requireNonNull(calibration, "calibration");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Assessment assess(Request req) throws DerivationException {
        Objects.requireNonNull(req, "request");

        ConfidenceValue.Derived confidence = proofs.derive(req.formula(), req.inputs());
        Claim claim = new Claim(req.claimId(), req.contentRef(), req.producerId(), confidence,
                req.evidenceIds(), ClaimStatus.ENTERTAINED);

        // graph first: a bad defeater set must not leave a half-logged claim
        AttackGraph graph = AttackGraph.builder()
                .addClaim(claim)
                .addDefeaters(req.defeaters())
                .build();

        long claimSeq = ledger.append(claimDraft(claim, req.formula(), req.correlationId()));
        for (Defeater d : req.defeaters()) {
            ledger.append(DefeaterRecords.toDraft(d, req.correlationId(), claimSeq));
        }

        DefeaterResolutionResult result = resolver.resolve(graph);
        ClaimVerdict verdict = result.claimVerdicts().get(claim.id());
        Claim resolved = statuses.apply(claim, verdict);
        ledger.append(verdictDraft(resolved, verdict, result, req.correlationId(), claimSeq));

        log.info("claim.assess id={} producer={} base={} effective={} status={} defeaters={} converged={}",
                claim.id(), claim.producerId(), confidence.value(), verdict.effectiveConfidence(),
                resolved.status().wireName(), req.defeaters().size(), result.converged());
        if (verdict.hasDisclosure()) log.info("claim.assess id={} disclosure: {}", claim.id(), verdict.disclosure());
        return new Assessment(resolved, claimSeq, verdict, result);
    }

    /**
     * Re-resolves claims against every defeater recorded under {@code correlationId}.
     * Defeaters whose target is neither one of the claims nor another kept defeater are
     * left out.
     */
    public DefeaterResolutionResult resolveSession(String correlationId, List<Claim> claims) {
        Objects.requireNonNull(claims, "claims");
        List<Defeater> recorded = DefeaterRecords.read(ledger, correlationId);

        Set<String> known = new HashSet<>();
        for (Claim c : claims) known.add(c.id());
        Map<String, Defeater> kept = new LinkedHashMap<>();
        for (Defeater d : recorded) kept.put(d.id(), d);
        boolean changed = true;
        while (changed) {
            changed = kept.values().removeIf(d -> !known.contains(d.attacks()) && !kept.containsKey(d.attacks()));
        }
        if (kept.size() < recorded.size() && log.isDebugEnabled()) {
            log.debug("resolveSession {}: {} of {} defeaters target nodes outside the claim set",
                    correlationId, recorded.size() - kept.size(), recorded.size());
        }

        AttackGraph graph = AttackGraph.builder()
                .addClaims(claims)
                .addDefeaters(new ArrayList<>(kept.values()))
                .build();
        return resolver.resolve(graph);
    }

    /** Feeds a verified outcome of {@code claim} back to calibration, under its producer. */
    public void recordOutcome(Claim claim, boolean actual) {
        Objects.requireNonNull(claim, "claim");
        calibration.recordOutcome(claim.producerId(), claim.confidence(), actual, clock.instant());
    }

    private static EntryDraft claimDraft(Claim claim, String formula, String correlationId) {
        ArrayNode evidence = JsonNodeFactory.instance.arrayNode();
        for (String id : claim.evidenceIds()) evidence.add(id);
        return EntryDraft.builder(EntryKind.CLAIM)
                .put("claimId", claim.id())
                .put("contentRef", claim.contentRef())
                .put("producerId", claim.producerId())
                .put("formula", formula)
                .put("confidence", ConfidenceCodec.toJson(claim.confidence()))
                .put("evidenceIds", evidence)
                .correlationId(correlationId)
                .provenance(Provenance.of("claim_producer", "derivation", claim.producerId()))
                .build();
    }

    private static EntryDraft verdictDraft(Claim claim,
                                           ClaimVerdict v,
                                           DefeaterResolutionResult r,
                                           String correlationId,
                                           long claimSeq) {
        ArrayNode active = JsonNodeFactory.instance.arrayNode();
        for (String id : v.activeDefeaters()) active.add(id);
        ArrayNode unresolved = JsonNodeFactory.instance.arrayNode();
        for (String id : v.unresolvedDefeaters()) unresolved.add(id);
        return EntryDraft.builder(EntryKind.VERIFICATION)
                .put("claimId", claim.id())
                .put("status", claim.status().wireName())
                .put("defeated", v.defeated())
                .put("confidence", ConfidenceCodec.toJson(v.effectiveConfidence()))
                .put("activeDefeaters", active)
                .put("unresolvedDefeaters", unresolved)
                .put("converged", r.converged())
                .put("iterations", (long) r.iterations())
                .put("disclosure", v.disclosure())
                .correlationId(correlationId)
                .derivedFrom(claimSeq)
                .provenance(Provenance.of("defeat", "grounded_resolution", null))
                .build();
    }
}
