package org.calista.credence.claim;

import java.util.Locale;

public enum ClaimStatus {
    /** Produced, not yet settled. */
    ENTERTAINED,
    ACCEPTED,
    REJECTED,
    /** At least one active defeater attacks it. */
    DEFEATED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ClaimStatus fromWire(String s) {
        if (s == null || s.isBlank()) return ENTERTAINED;
        return valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
