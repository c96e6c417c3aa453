package org.calista.credence.confidence;

/**
 * How n-ary combinators treat {@link ConfidenceValue.Absent} inputs.
 */
public enum AbsentPolicy {
    /** Any absent input makes the result absent (default). */
    PROPAGATE,
    /**
     * Absent inputs are skipped; the result is absent only when every input is.
     * Must be chosen explicitly by the caller.
     */
    NEUTRAL
}
