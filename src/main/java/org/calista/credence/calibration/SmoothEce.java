package org.calista.credence.calibration;

import java.util.List;
import java.util.Objects;

/**
 * Binning-free expected calibration error. Reliability at each evaluation point is a
 * Nadaraya-Watson estimate of the outcome rate; the gap to the point is weighted by
 * the kernel density of stated confidences there.
 */
public final class SmoothEce {

    public static final int DEFAULT_EVAL_POINTS = 100;
    static final double MIN_BANDWIDTH = 0.01;
    static final double MAX_BANDWIDTH = 0.5;

    private static final double INV_SQRT_2PI = 1.0 / Math.sqrt(2.0 * Math.PI);

    public enum Kernel {
        GAUSSIAN {
            @Override
            double weight(double u) {
                return Math.exp(-0.5 * u * u) * INV_SQRT_2PI;
            }
        },
        EPANECHNIKOV {
            @Override
            double weight(double u) {
                return Math.abs(u) <= 1.0 ? 0.75 * (1.0 - u * u) : 0.0;
            }
        };

        abstract double weight(double u);
    }

    private SmoothEce() {
    }

    /** Gaussian kernel, Silverman bandwidth, {@value #DEFAULT_EVAL_POINTS} evaluation steps. */
    public static double compute(List<Outcome> outcomes) {
        return compute(outcomes, Kernel.GAUSSIAN, Double.NaN, DEFAULT_EVAL_POINTS);
    }

    /**
     * @param bandwidth NaN selects Silverman's rule
     * @throws IllegalArgumentException when {@code outcomes} is empty or the arguments are out of range
     */
    public static double compute(List<Outcome> outcomes, Kernel kernel, double bandwidth, int evalPoints) {
        Objects.requireNonNull(outcomes, "outcomes");
        Objects.requireNonNull(kernel, "kernel");
        if (outcomes.isEmpty()) throw new IllegalArgumentException("smooth ECE needs at least one outcome");
        if (evalPoints < 1) throw new IllegalArgumentException("evalPoints must be >= 1");
        if (!Double.isNaN(bandwidth) && !(bandwidth > 0.0 && bandwidth <= 1.0)) {
            throw new IllegalArgumentException("bandwidth must be within (0,1]");
        }

        int n = outcomes.size();
        double[] p = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            Outcome o = outcomes.get(i);
            p[i] = Math.min(1.0, Math.max(0.0, o.stated()));
            y[i] = o.actual() ? 1.0 : 0.0;
        }
        if (n == 1) return Math.abs(p[0] - y[0]);

        double h = Double.isNaN(bandwidth) ? silvermanBandwidth(p) : bandwidth;
        double weightedGap = 0.0;
        double totalDensity = 0.0;
        for (int e = 0; e <= evalPoints; e++) {
            double at = (double) e / evalPoints;
            double kSum = 0.0;
            double kySum = 0.0;
            for (int i = 0; i < n; i++) {
                double w = kernel.weight((at - p[i]) / h);
                kSum += w;
                kySum += w * y[i];
            }
            double density = kSum / (n * h);
            double reliability = kSum > 0.0 ? kySum / kSum : at;
            weightedGap += Math.abs(at - reliability) * density;
            totalDensity += density;
        }
        return totalDensity > 0.0 ? weightedGap / totalDensity : 0.0;
    }

    /** 1.06·σ·n^(-1/5) over the stated confidences, clamped to [0.01, 0.5]. */
    static double silvermanBandwidth(double[] p) {
        int n = p.length;
        double mean = 0.0;
        for (double v : p) mean += v;
        mean /= n;
        double var = 0.0;
        for (double v : p) var += (v - mean) * (v - mean);
        var /= (n - 1);
        double h = 1.06 * Math.sqrt(var) * Math.pow(n, -0.2);
        return Math.min(MAX_BANDWIDTH, Math.max(MIN_BANDWIDTH, h));
    }
}
