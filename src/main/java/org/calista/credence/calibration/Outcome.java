package org.calista.credence.calibration;

import org.calista.credence.confidence.ConfidenceValue;

import java.time.Instant;
import java.util.Objects;

/**
 * A verified prediction: what the producer stated and whether the claim held.
 */
public record Outcome(String producerId, ConfidenceValue predicted, boolean actual, Instant verifiedAt) {

    public Outcome {
        Objects.requireNonNull(producerId, "producerId");
        Objects.requireNonNull(predicted, "predicted");
        Objects.requireNonNull(verifiedAt, "verifiedAt");
        if (producerId.isBlank()) throw new IllegalArgumentException("producerId must not be blank");
        if (predicted.isAbsent()) {
            throw new IllegalArgumentException("an absent confidence states nothing and cannot be scored");
        }
    }

    /** The stated probability: the value's point reading. */
    public double stated() {
        return predicted.pointValue().getAsDouble();
    }
}
