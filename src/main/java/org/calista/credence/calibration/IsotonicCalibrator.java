package org.calista.credence.calibration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Monotone recalibration map fitted by pool-adjacent-violators over (stated, outcome)
 * pairs. Between knots the map is piecewise linear; outside it is clamped to the
 * first and last knot.
 *
 * <p>
 * Outcomes with the same stated value are pooled before PAV runs, so every raw value
 * maps to exactly one calibrated value.
 * </p>
 */
public final class IsotonicCalibrator {

    private final double[] xs;
    private final double[] ys;
    private final int sampleSize;
    private final boolean strictlyMonotonic;

    private IsotonicCalibrator(double[] xs, double[] ys, int sampleSize, boolean strictlyMonotonic) {
        this.xs = xs;
        this.ys = ys;
        this.sampleSize = sampleSize;
        this.strictlyMonotonic = strictlyMonotonic;
    }

    /**
     * @throws IllegalArgumentException when {@code outcomes} is empty
     */
    public static IsotonicCalibrator fit(List<Outcome> outcomes) {
        Objects.requireNonNull(outcomes, "outcomes");
        if (outcomes.isEmpty()) throw new IllegalArgumentException("cannot fit an isotonic map without outcomes");

        List<Outcome> sorted = new ArrayList<>(outcomes);
        sorted.sort(Comparator.comparingDouble(Outcome::stated));

        int n = sorted.size();
        double[] sum = new double[n];
        int[] count = new int[n];
        double[] lo = new double[n];
        double[] hi = new double[n];
        int top = -1;

        for (Outcome o : sorted) {
            double p = o.stated();
            double y = o.actual() ? 1.0 : 0.0;
            if (top >= 0 && hi[top] == p) {
                sum[top] += y;
                count[top]++;
            } else {
                top++;
                sum[top] = y;
                count[top] = 1;
                lo[top] = p;
                hi[top] = p;
            }
            // pool while the previous block's mean exceeds this one's
            while (top > 0 && sum[top - 1] * count[top] > sum[top] * count[top - 1]) {
                sum[top - 1] += sum[top];
                count[top - 1] += count[top];
                hi[top - 1] = hi[top];
                top--;
            }
        }

        double[] kx = new double[2 * (top + 1)];
        double[] ky = new double[2 * (top + 1)];
        int k = 0;
        boolean strict = true;
        double prev = Double.NEGATIVE_INFINITY;
        for (int b = 0; b <= top; b++) {
            double mean = sum[b] / count[b];
            if (mean <= prev) strict = false;
            prev = mean;
            kx[k] = lo[b];
            ky[k++] = mean;
            if (hi[b] > lo[b]) {
                kx[k] = hi[b];
                ky[k++] = mean;
            }
        }
        return new IsotonicCalibrator(Arrays.copyOf(kx, k), Arrays.copyOf(ky, k), n, strict);
    }

    /** Calibrated probability for a stated confidence. */
    public double calibrate(double raw) {
        if (xs.length == 1 || raw <= xs[0]) return ys[0];
        if (raw >= xs[xs.length - 1]) return ys[ys.length - 1];
        int idx = Arrays.binarySearch(xs, raw);
        if (idx >= 0) return ys[idx];
        int hi = -idx - 1;
        int lo = hi - 1;
        double t = (raw - xs[lo]) / (xs[hi] - xs[lo]);
        return ys[lo] + t * (ys[hi] - ys[lo]);
    }

    public int sampleSize() {
        return sampleSize;
    }

    /** False when two adjacent pooled blocks ended with the same mean. */
    public boolean isStrictlyMonotonic() {
        return strictlyMonotonic;
    }

    public double minRaw() {
        return xs[0];
    }

    public double maxRaw() {
        return xs[xs.length - 1];
    }

    public int knotCount() {
        return xs.length;
    }

    public double[] knotsX() {
        return xs.clone();
    }

    public double[] knotsY() {
        return ys.clone();
    }
}
