package org.calista.credence.confidence;

import java.util.Locale;

/**
 * Whether a derived value still carries the calibration of its inputs.
 */
public enum CalibrationStatus {
    /** Every input was calibrated and the combinator keeps calibration. */
    PRESERVED,
    /** At least one input was uncalibrated, or the combinator breaks calibration. */
    DEGRADED,
    /** Nothing to judge from (no inputs). */
    UNKNOWN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CalibrationStatus fromWire(String s) {
        if (s == null) throw new ConfidenceConstructionException("calibrationStatus is required");
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfidenceConstructionException("unknown calibrationStatus: " + s);
        }
    }
}
