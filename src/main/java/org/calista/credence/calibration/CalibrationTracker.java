package org.calista.credence.calibration;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.credence.confidence.ConfidenceValue;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * CalibrationTracker — turns (stated confidence, outcome) pairs into calibration reports.
 *
 * <p>
 * Outcomes go to the injected {@link OutcomeStore}; two trackers over different stores
 * share nothing. {@link #report} reads a snapshot of the store and may run while
 * outcomes are still being recorded.
 * </p>
 */
public final class CalibrationTracker {

    private static final Logger log = LogManager.getLogger(CalibrationTracker.class);

    static final double LOG_LOSS_EPS = 1e-15;

    /**
     * @param targetEce ECE at or below which a sufficient report is well calibrated;
     *                  above three times this it is a distribution shift
     */
    public record Settings(int bucketCount, double targetEce, double pacEpsilon, double pacDelta) {

        public static final Settings DEFAULTS = new Settings(10, 0.05, 0.1, 0.05);

        public Settings {
            if (bucketCount < 1) throw new IllegalArgumentException("bucketCount must be >= 1");
            if (!(targetEce > 0.0 && targetEce < 1.0)) throw new IllegalArgumentException("targetEce must be within (0,1)");
            PacBound.requiredSamples(pacEpsilon, pacDelta);
        }

        public long requiredSamples() {
            return PacBound.requiredSamples(pacEpsilon, pacDelta);
        }
    }

    private final OutcomeStore store;
    private final Settings settings;
    private final Clock clock;

    public CalibrationTracker(OutcomeStore store) {
        this(store, Settings.DEFAULTS, Clock.systemUTC());
    }

    public CalibrationTracker(OutcomeStore store, Settings settings, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Settings settings() {
        return settings;
    }

    public OutcomeStore store() {
        return store;
    }

    /**
     * @throws IllegalArgumentException when {@code predicted} is absent
     */
    public void recordOutcome(String producerId, ConfidenceValue predicted, boolean actual, Instant verifiedAt) {
        Outcome o = new Outcome(producerId, predicted, actual, verifiedAt == null ? clock.instant() : verifiedAt);
        store.add(o);
        if (log.isDebugEnabled()) {
            log.debug("calibration.record producer={} stated={} actual={}", producerId, fmt(o.stated()), actual);
        }
    }

    public CalibrationReport report(String producerId, int minSamples) {
        Objects.requireNonNull(producerId, "producerId");
        if (minSamples < 0) throw new IllegalArgumentException("minSamples must be >= 0");
        CalibrationReport r = compute(producerId, store.outcomes(producerId), minSamples, settings, clock.instant());
        log.info("calibration.report producer={} n={} ece={} smoothEce={} mce={} verdict={}",
                producerId, r.sampleCount(), fmt(r.ece()), fmt(r.smoothEce()), fmt(r.mce()), r.sufficiency().wireName());
        return r;
    }

    /** Isotonic recalibration map for the producer; empty until it has outcomes. */
    public Optional<IsotonicCalibrator> isotonic(String producerId) {
        Objects.requireNonNull(producerId, "producerId");
        List<Outcome> outcomes = store.outcomes(producerId);
        if (outcomes.isEmpty()) return Optional.empty();
        IsotonicCalibrator map = IsotonicCalibrator.fit(outcomes);
        log.debug("calibration.isotonic producer={} n={} knots={}", producerId, map.sampleSize(), map.knotCount());
        return Optional.of(map);
    }

    // -------------------- Computation --------------------

    public static CalibrationReport compute(String producerId,
                                            List<Outcome> outcomes,
                                            int minSamples,
                                            Settings settings,
                                            Instant now) {
        int k = settings.bucketCount();
        int[] count = new int[k];
        int[] hits = new int[k];
        double[] statedSum = new double[k];

        int n = outcomes.size();
        double brier = 0.0;
        double logLoss = 0.0;
        int overconfident = 0;
        for (Outcome o : outcomes) {
            double p = o.stated();
            double y = o.actual() ? 1.0 : 0.0;
            int b = bucketIndex(p, k);
            count[b]++;
            if (o.actual()) hits[b]++;
            statedSum[b] += p;

            brier += (p - y) * (p - y);
            double pc = Math.min(1.0 - LOG_LOSS_EPS, Math.max(LOG_LOSS_EPS, p));
            logLoss -= y * Math.log(pc) + (1.0 - y) * Math.log(1.0 - pc);
            if (p > y) overconfident++;
        }

        List<CalibrationBucket> buckets = new ArrayList<>(k);
        double ece = 0.0;
        double mce = 0.0;
        for (int i = 0; i < k; i++) {
            double low = (double) i / k;
            double high = (double) (i + 1) / k;
            double acc = count[i] == 0 ? 0.0 : (double) hits[i] / count[i];
            double mean = count[i] == 0 ? 0.0 : statedSum[i] / count[i];
            CalibrationBucket b = new CalibrationBucket(i, low, high, count[i], hits[i], mean, acc,
                    WilsonInterval.of95(hits[i], count[i]));
            buckets.add(b);
            if (count[i] > 0) {
                ece += ((double) count[i] / n) * b.gap();
                mce = Math.max(mce, b.gap());
            }
        }

        double brierScore = n == 0 ? 0.0 : brier / n;
        double meanLogLoss = n == 0 ? 0.0 : logLoss / n;
        double overRatio = n == 0 ? 0.0 : (double) overconfident / n;
        double smoothEce = n == 0 ? 0.0 : SmoothEce.compute(outcomes);
        long required = settings.requiredSamples();
        SufficiencyVerdict verdict = verdict(n, minSamples, required, ece, settings.targetEce());

        List<String> recs = recommendations(n, minSamples, required, ece, mce, brierScore, buckets, settings, verdict);
        return new CalibrationReport(producerId, n, ece, mce, smoothEce, brierScore, meanLogLoss, overRatio,
                buckets, verdict, required, recs, now);
    }

    static int bucketIndex(double p, int k) {
        int i = Math.min(k - 1, Math.max(0, (int) Math.floor(p * k)));
        if (i > 0 && p < (double) i / k) i--;
        else if (i < k - 1 && p >= (double) (i + 1) / k) i++;
        return i;
    }

    static SufficiencyVerdict verdict(int n, int minSamples, long required, double ece, double targetEce) {
        if (n < minSamples || n < required) return SufficiencyVerdict.INSUFFICIENT_DATA;
        if (ece <= targetEce) return SufficiencyVerdict.WELL_CALIBRATED;
        if (ece > targetEce * 3.0) return SufficiencyVerdict.DISTRIBUTION_SHIFT;
        return SufficiencyVerdict.MISCALIBRATED;
    }

    private static List<String> recommendations(int n,
                                                int minSamples,
                                                long required,
                                                double ece,
                                                double mce,
                                                double brier,
                                                List<CalibrationBucket> buckets,
                                                Settings settings,
                                                SufficiencyVerdict verdict) {
        double targetEce = settings.targetEce();
        List<String> out = new ArrayList<>();
        if (verdict == SufficiencyVerdict.INSUFFICIENT_DATA) {
            long need = Math.max(minSamples, required);
            out.add(String.format(Locale.ROOT,
                    "Only %d outcomes; %d are needed before calibration can be trusted (ε-bound %.3f at this size).",
                    n, need, PacBound.achievableEpsilon(n, settings.pacDelta())));
        }
        if (ece > targetEce) {
            out.add(String.format(Locale.ROOT, "ECE %.3f exceeds target %.3f; recalibrate stated confidences.", ece, targetEce));
        }
        int over = 0;
        int under = 0;
        for (CalibrationBucket b : buckets) {
            if (b.sampleCount() < 5) continue;
            if (b.statedMean() > b.observedAccuracy() + 0.1) over++;
            if (b.observedAccuracy() > b.statedMean() + 0.1) under++;
        }
        if (over > 0) out.add("Overconfidence in " + over + " bucket(s); lower confidence in those ranges.");
        if (under > 0) out.add("Underconfidence in " + under + " bucket(s); raise confidence in those ranges.");
        if (mce > 0.2) {
            out.add(String.format(Locale.ROOT, "Maximum calibration error %.3f is high; start with the worst bucket.", mce));
        }
        if (brier > 0.25) {
            out.add(String.format(Locale.ROOT, "Brier score %.3f is worse than a constant 0.5 forecast.", brier));
        }
        for (CalibrationBucket b : buckets) {
            if (b.sampleCount() < 10) continue;
            double err = Math.abs(b.observedAccuracy() - b.midpoint());
            if (err > 0.15) {
                out.add(String.format(Locale.ROOT, "Around %.0f%%: %s confidence by about %.0f%%.",
                        b.midpoint() * 100.0, b.observedAccuracy() > b.midpoint() ? "increase" : "decrease", err * 100.0));
            }
        }
        if (verdict == SufficiencyVerdict.WELL_CALIBRATED && mce <= 0.15) {
            out.add("Calibration is good; keep monitoring for distribution shift.");
        }
        return out;
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.4f", v);
    }
}
