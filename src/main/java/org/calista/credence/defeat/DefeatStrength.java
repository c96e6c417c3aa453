package org.calista.credence.defeat;

import org.calista.credence.confidence.ConfidenceAlgebra;
import org.calista.credence.confidence.ConfidenceValue;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Graded weakening of a confidence by defeat reductions.
 *
 * <ul>
 *     <li>{@link Method#LINEAR}: {@code max(0, s - r)}, applied per reduction.</li>
 *     <li>{@link Method#BAYESIAN}: posterior mean of {@code Beta(α0 + s, β0 + Σr)} with
 *     {@code α0 = prior·n0}, {@code β0 = (1-prior)·n0}.</li>
 * </ul>
 *
 * The result is produced with {@link ConfidenceAlgebra#discount}, so it is a proven,
 * degraded value and never exceeds the input.
 */
public final class DefeatStrength {

    public static final double DEFAULT_PRIOR_STRENGTH = 0.5;
    public static final double DEFAULT_PRIOR_SAMPLE_SIZE = 2.0;

    public enum Method {
        LINEAR,
        BAYESIAN;

        public static Method parse(String s) {
            if (s == null || s.isBlank()) return LINEAR;
            return valueOf(s.trim().toUpperCase(Locale.ROOT));
        }
    }

    private final Method method;
    private final double priorStrength;
    private final double priorSampleSize;

    private DefeatStrength(Method method, double priorStrength, double priorSampleSize) {
        this.method = Objects.requireNonNull(method, "method");
        if (!(priorStrength > 0.0 && priorStrength < 1.0)) {
            throw new IllegalArgumentException("priorStrength must be within (0,1), got " + priorStrength);
        }
        if (!(priorSampleSize > 0.0) || !Double.isFinite(priorSampleSize)) {
            throw new IllegalArgumentException("priorSampleSize must be > 0, got " + priorSampleSize);
        }
        this.priorStrength = priorStrength;
        this.priorSampleSize = priorSampleSize;
    }

    public static DefeatStrength linear() {
        return new DefeatStrength(Method.LINEAR, DEFAULT_PRIOR_STRENGTH, DEFAULT_PRIOR_SAMPLE_SIZE);
    }

    public static DefeatStrength bayesian() {
        return bayesian(DEFAULT_PRIOR_STRENGTH, DEFAULT_PRIOR_SAMPLE_SIZE);
    }

    public static DefeatStrength bayesian(double priorStrength, double priorSampleSize) {
        return new DefeatStrength(Method.BAYESIAN, priorStrength, priorSampleSize);
    }

    public static DefeatStrength of(Method method) {
        return method == Method.BAYESIAN ? bayesian() : linear();
    }

    public Method method() {
        return method;
    }

    /** Numeric kernel: strength after the given reductions, all within [0,1]. */
    public double reduced(double strength, List<Double> reductions) {
        requireUnit("strength", strength);
        double total = 0.0;
        double s = strength;
        for (Double r : reductions) {
            requireUnit("reduction", r == null ? Double.NaN : r);
            total += r;
            s = Math.max(0.0, s - r);
        }
        if (method == Method.LINEAR) return s;

        double alpha = priorStrength * priorSampleSize + strength;
        double beta = (1.0 - priorStrength) * priorSampleSize + total;
        return Math.min(strength, alpha / (alpha + beta));
    }

    /**
     * Applies the reductions to a confidence. Absent stays absent.
     */
    public ConfidenceValue apply(ConfidenceValue value, List<Double> reductions) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(reductions, "reductions");
        if (value.isAbsent() || reductions.isEmpty()) return value;
        double v = value.pointValue().getAsDouble();
        if (v == 0.0) return ConfidenceAlgebra.discount(value, 1.0);
        double target = reduced(v, reductions);
        return ConfidenceAlgebra.discount(value, Math.min(1.0, target / v));
    }

    public ConfidenceValue apply(ConfidenceValue value, double reduction) {
        return apply(value, List.of(reduction));
    }

    private static void requireUnit(String what, double v) {
        if (!Double.isFinite(v) || v < 0.0 || v > 1.0) {
            throw new IllegalArgumentException(what + " must be within [0,1], got " + v);
        }
    }

    @Override
    public String toString() {
        return method == Method.LINEAR
                ? "DefeatStrength(linear)"
                : String.format(Locale.ROOT, "DefeatStrength(bayesian, prior=%.3f, n0=%.1f)", priorStrength, priorSampleSize);
    }
}
