package org.calista.credence.ledger;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** What a ledger entry records. */
public enum EntryKind {
    EXTRACTION,
    RETRIEVAL,
    SYNTHESIS,
    CLAIM,
    VERIFICATION,
    CONTRADICTION,
    FEEDBACK,
    OUTCOME,
    TOOL_CALL,
    EPISODE,
    CALIBRATION,
    DEFEATER,
    /** Supersedes an earlier entry named in {@code derivedFrom}. */
    CORRECTION;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EntryKind fromWire(String s) {
        if (s == null || s.isBlank()) throw new IllegalArgumentException("entry kind is required");
        return valueOf(s.trim().toUpperCase(Locale.ROOT));
    }
}
