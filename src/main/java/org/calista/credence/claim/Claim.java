package org.calista.credence.claim;

import org.calista.credence.confidence.ConfidenceValue;

import java.util.List;
import java.util.Objects;

/**
 * Claim — a producer's assertion with its current confidence.
 *
 * <p>
 * Instances are immutable. Status and confidence changes produce copies
 * ({@link #withStatus}, {@link #withConfidence}); history is kept in the ledger, not here.
 * </p>
 */
public final class Claim {

    private final String id;
    private final String contentRef;
    private final String producerId;
    private final ConfidenceValue confidence;
    private final List<String> evidenceIds;
    private final ClaimStatus status;

    public Claim(String id,
                 String contentRef,
                 String producerId,
                 ConfidenceValue confidence,
                 List<String> evidenceIds,
                 ClaimStatus status) {
        this.id = requireId(id);
        this.contentRef = contentRef == null ? "" : contentRef;
        this.producerId = Objects.requireNonNull(producerId, "producerId");
        this.confidence = Objects.requireNonNull(confidence, "confidence");
        this.evidenceIds = evidenceIds == null ? List.of() : List.copyOf(evidenceIds);
        this.status = status == null ? ClaimStatus.ENTERTAINED : status;
    }

    public static Claim entertained(String id, String contentRef, String producerId, ConfidenceValue confidence) {
        return new Claim(id, contentRef, producerId, confidence, List.of(), ClaimStatus.ENTERTAINED);
    }

    public String id() {
        return id;
    }

    public String contentRef() {
        return contentRef;
    }

    public String producerId() {
        return producerId;
    }

    public ConfidenceValue confidence() {
        return confidence;
    }

    public List<String> evidenceIds() {
        return evidenceIds;
    }

    public ClaimStatus status() {
        return status;
    }

    public Claim withStatus(ClaimStatus next) {
        Objects.requireNonNull(next, "status");
        if (next == status) return this;
        return new Claim(id, contentRef, producerId, confidence, evidenceIds, next);
    }

    public Claim withConfidence(ConfidenceValue next) {
        return new Claim(id, contentRef, producerId, next, evidenceIds, status);
    }

    public Claim withEvidence(List<String> ids) {
        return new Claim(id, contentRef, producerId, confidence, ids, status);
    }

    private static String requireId(String id) {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) throw new IllegalArgumentException("claim id must not be blank");
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Claim c)) return false;
        return id.equals(c.id)
                && contentRef.equals(c.contentRef)
                && producerId.equals(c.producerId)
                && confidence.equals(c.confidence)
                && evidenceIds.equals(c.evidenceIds)
                && status == c.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, contentRef, producerId, confidence, evidenceIds, status);
    }

    @Override
    public String toString() {
        return "Claim{" + id + ", " + status.wireName() + ", " + confidence + "}";
    }
}
