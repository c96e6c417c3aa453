package org.calista.credence.calibration;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Calibration of one producer as of {@code generatedAt}. The ECE figure and the
 * sufficiency verdict always travel together.
 *
 * @param ece                 Σ (n_b / N)·|accuracy_b − midpoint_b|
 * @param mce                 largest per-bucket gap over non-empty buckets
 * @param smoothEce           kernel-smoothed ECE, see {@link SmoothEce}; 0 without outcomes
 * @param overconfidenceRatio fraction of samples whose stated confidence exceeded the outcome
 * @param requiredSamples     PAC sample requirement the verdict was checked against
 */
public record CalibrationReport(String producerId,
                                int sampleCount,
                                double ece,
                                double mce,
                                double smoothEce,
                                double brierScore,
                                double logLoss,
                                double overconfidenceRatio,
                                List<CalibrationBucket> buckets,
                                SufficiencyVerdict sufficiency,
                                long requiredSamples,
                                List<String> recommendations,
                                Instant generatedAt) {

    public CalibrationReport {
        buckets = List.copyOf(buckets);
        recommendations = List.copyOf(recommendations);
    }

    public boolean isWellCalibrated() {
        return sufficiency == SufficiencyVerdict.WELL_CALIBRATED;
    }

    /** Bucket holding {@code confidence}; the last bucket includes 1.0. */
    public Optional<CalibrationBucket> bucketFor(double confidence) {
        for (int i = 0; i < buckets.size(); i++) {
            CalibrationBucket b = buckets.get(i);
            boolean last = i == buckets.size() - 1;
            if (confidence >= b.low() && (confidence < b.high() || (last && confidence <= b.high()))) {
                return Optional.of(b);
            }
        }
        return Optional.empty();
    }
}
