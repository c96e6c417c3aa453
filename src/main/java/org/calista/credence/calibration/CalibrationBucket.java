package org.calista.credence.calibration;

/**
 * One fixed-width confidence bucket. The last bucket of a report includes its upper
 * bound, the others exclude it.
 *
 * @param statedMean       mean stated confidence of the samples, 0 when empty
 * @param observedAccuracy fraction of samples that held, 0 when empty
 */
public record CalibrationBucket(int index,
                                double low,
                                double high,
                                int sampleCount,
                                int successes,
                                double statedMean,
                                double observedAccuracy,
                                WilsonInterval wilson95) {

    public double midpoint() {
        return (low + high) / 2.0;
    }

    public boolean isEmpty() {
        return sampleCount == 0;
    }

    /** Gap between observed accuracy and the bucket midpoint. */
    public double gap() {
        return Math.abs(observedAccuracy - midpoint());
    }
}
