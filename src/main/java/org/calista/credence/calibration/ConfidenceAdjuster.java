package org.calista.credence.calibration;

import org.calista.credence.confidence.ConfidenceAlgebra;
import org.calista.credence.confidence.ConfidenceValue;

import java.util.List;
import java.util.Objects;

/**
 * Shrinks a stated confidence toward the observed accuracy of its calibration bucket.
 *
 * <p>
 * Below {@code minSamples} in the bucket nothing changes. The weight of the observed
 * accuracy grows linearly and reaches 1 at {@code fullWeightSamples}; at full weight the
 * result is the bucket's {@link ConfidenceValue.Measured} accuracy itself, otherwise a
 * weighted average of the two. The original value and the report are not modified.
 * </p>
 */
public final class ConfidenceAdjuster {

    public static final int DEFAULT_MIN_SAMPLES = 3;
    public static final int DEFAULT_FULL_WEIGHT_SAMPLES = 20;

    public record Adjustment(ConfidenceValue raw, ConfidenceValue calibrated, double weight, CalibrationBucket bucket) {
        public boolean adjusted() {
            return weight > 0.0;
        }
    }

    private final int minSamples;
    private final int fullWeightSamples;

    public ConfidenceAdjuster() {
        this(DEFAULT_MIN_SAMPLES, DEFAULT_FULL_WEIGHT_SAMPLES);
    }

    public ConfidenceAdjuster(int minSamples, int fullWeightSamples) {
        if (minSamples < 1) throw new IllegalArgumentException("minSamples must be >= 1");
        if (fullWeightSamples < minSamples) throw new IllegalArgumentException("fullWeightSamples must be >= minSamples");
        this.minSamples = minSamples;
        this.fullWeightSamples = fullWeightSamples;
    }

    public Adjustment adjust(ConfidenceValue stated, CalibrationReport report) {
        Objects.requireNonNull(stated, "stated");
        Objects.requireNonNull(report, "report");
        if (stated.isAbsent()) return new Adjustment(stated, stated, 0.0, null);

        CalibrationBucket b = report.bucketFor(stated.pointValue().getAsDouble()).orElse(null);
        if (b == null || b.sampleCount() < minSamples) return new Adjustment(stated, stated, 0.0, b);

        double weight = Math.min(1.0, (double) b.sampleCount() / fullWeightSamples);
        ConfidenceValue.Measured observed = ConfidenceValue.measured(
                b.observedAccuracy(),
                "calibration:" + report.producerId() + ":bucket" + b.index(),
                b.sampleCount(),
                b.observedAccuracy(),
                b.wilson95().low(),
                b.wilson95().high(),
                report.generatedAt());
        if (weight >= 1.0) return new Adjustment(stated, observed, 1.0, b);

        ConfidenceValue blended = ConfidenceAlgebra.weightedAverage(List.of(stated, observed), List.of(1.0 - weight, weight));
        return new Adjustment(stated, blended, weight, b);
    }
}
