package org.calista.credence.confidence;

import java.util.Locale;

/** Why a confidence is {@link ConfidenceValue.Absent}. */
public enum AbsentReason {
    UNCALIBRATED,
    INSUFFICIENT_DATA,
    NOT_APPLICABLE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AbsentReason fromWire(String s) {
        if (s == null) throw new ConfidenceConstructionException("absent reason is required");
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfidenceConstructionException("unknown absent reason: " + s);
        }
    }
}
