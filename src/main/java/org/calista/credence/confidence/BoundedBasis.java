package org.calista.credence.confidence;

import java.util.Locale;

/** Where the interval of a {@link ConfidenceValue.Bounded} comes from. */
public enum BoundedBasis {
    THEORETICAL,
    LITERATURE,
    FORMAL_ANALYSIS,
    ESTIMATED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BoundedBasis fromWire(String s) {
        if (s == null) throw new ConfidenceConstructionException("basis is required");
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfidenceConstructionException("unknown bounded basis: " + s);
        }
    }
}
