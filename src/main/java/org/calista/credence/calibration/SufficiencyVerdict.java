package org.calista.credence.calibration;

import java.util.Locale;

/**
 * What a calibration report may claim. Only {@link #WELL_CALIBRATED} says the stated
 * confidences can be trusted, and it is never issued without enough samples.
 */
public enum SufficiencyVerdict {
    INSUFFICIENT_DATA,
    WELL_CALIBRATED,
    MISCALIBRATED,
    /** Error far above target; the producer's distribution probably moved. */
    DISTRIBUTION_SHIFT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
