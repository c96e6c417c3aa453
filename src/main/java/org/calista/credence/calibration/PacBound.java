package org.calista.credence.calibration;

/**
 * Hoeffding sample-size bounds: with {@code n} samples an observed rate is within
 * {@code ε} of the true rate with probability at least {@code 1-δ} when
 * {@code n ≥ ln(2/δ) / (2ε²)}.
 */
public final class PacBound {

    private PacBound() {
    }

    /** {@code ⌈ln(2/δ) / (2ε²)⌉}; 185 for ε = 0.1, δ = 0.05. */
    public static long requiredSamples(double epsilon, double delta) {
        requireOpenUnit("epsilon", epsilon);
        requireOpenUnit("delta", delta);
        return (long) Math.ceil(Math.log(2.0 / delta) / (2.0 * epsilon * epsilon));
    }

    /** Smallest ε guaranteed by {@code n} samples at failure probability δ. */
    public static double achievableEpsilon(long n, double delta) {
        requireOpenUnit("delta", delta);
        if (n <= 0) return 1.0;
        return Math.min(1.0, Math.sqrt(Math.log(2.0 / delta) / (2.0 * n)));
    }

    public static boolean sufficient(long n, double epsilon, double delta) {
        return n >= requiredSamples(epsilon, delta);
    }

    private static void requireOpenUnit(String what, double v) {
        if (!(v > 0.0 && v < 1.0)) throw new IllegalArgumentException(what + " must be within (0,1), got " + v);
    }
}
