package org.calista.credence.defeat;

import java.util.Locale;

public enum DefeaterKind {
    /** Attacks the premises or the evidence. */
    UNDERMINING,
    /** Attacks the conclusion directly. */
    REBUTTING,
    /** Attacks the inference from premises to conclusion. */
    UNDERCUTTING;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DefeaterKind fromWire(String s) {
        if (s == null) throw new IllegalArgumentException("defeater kind is required");
        try {
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown defeater kind: " + s, e);
        }
    }
}
