package org.calista.credence.confidence;

/**
 * A confidence value was built with fields that break its invariants
 * (value outside [0,1], low > high, missing tag). Never recovered by clamping.
 */
public class ConfidenceConstructionException extends IllegalArgumentException {

    public ConfidenceConstructionException(String message) {
        super(message);
    }
}
