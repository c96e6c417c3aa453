package org.calista.credence.calibration;

import org.calista.credence.confidence.AbsentReason;
import org.calista.credence.confidence.ConfidenceValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.ArgumentMatchers.any;

@ExtendWith(MockitoExtension.class)
class CalibrationTrackerTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    /** Small PAC requirement (21 samples) so verdicts other than insufficient are reachable. */
    private static final CalibrationTracker.Settings LOOSE = new CalibrationTracker.Settings(10, 0.05, 0.3, 0.05);

    @Mock
    OutcomeStore store;

    private static List<Outcome> outcomes(String producer, double stated, int total, int correct) {
        List<Outcome> out = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            out.add(new Outcome(producer, ConfidenceValue.measured(stated, "bench", 200, stated, stated),
                    i < correct, NOW));
        }
        return out;
    }

    @Test
    void overconfidentProducerBelowSampleRequirement() {
        CalibrationTracker tracker = new CalibrationTracker(new InMemoryOutcomeStore(), CalibrationTracker.Settings.DEFAULTS, CLOCK);
        for (Outcome o : outcomes("model-a", 0.8, 25, 15)) {
            tracker.recordOutcome(o.producerId(), o.predicted(), o.actual(), o.verifiedAt());
        }

        CalibrationReport r = tracker.report("model-a", 20);

        assertEquals(25, r.sampleCount());
        assertEquals(0.25, r.ece(), 1e-9);
        assertEquals(0.25, r.mce(), 1e-9);
        // measured against the stated 0.8 rather than the bucket midpoint
        assertEquals(0.2, r.smoothEce(), 1e-6);
        assertEquals(0.28, r.brierScore(), 1e-9);
        assertEquals(0.4, r.overconfidenceRatio(), 1e-9);
        assertEquals(10, r.buckets().size());
        CalibrationBucket b8 = r.buckets().get(8);
        assertEquals(25, b8.sampleCount());
        assertEquals(15, b8.successes());
        assertEquals(0.6, b8.observedAccuracy(), 1e-12);
        assertEquals(SufficiencyVerdict.INSUFFICIENT_DATA, r.sufficiency());
        assertEquals(185, r.requiredSamples());
        assertEquals(NOW, r.generatedAt());
        assertFalse(r.isWellCalibrated());
        assertTrue(r.recommendations().get(0).startsWith("Only 25 outcomes; 185 are needed"));
    }

    @Test
    void verdictFollowsErrorOnceSamplesSuffice() {
        assertEquals(21, LOOSE.requiredSamples());

        CalibrationReport good = CalibrationTracker.compute("p", outcomes("p", 0.75, 40, 30), 20, LOOSE, NOW);
        assertEquals(SufficiencyVerdict.WELL_CALIBRATED, good.sufficiency());
        assertTrue(good.isWellCalibrated());

        CalibrationReport off = CalibrationTracker.compute("p", outcomes("p", 0.75, 40, 27), 20, LOOSE, NOW);
        assertEquals(0.075, off.ece(), 1e-9);
        assertEquals(SufficiencyVerdict.MISCALIBRATED, off.sufficiency());

        CalibrationReport shifted = CalibrationTracker.compute("p", outcomes("p", 0.95, 40, 20), 20, LOOSE, NOW);
        assertEquals(SufficiencyVerdict.DISTRIBUTION_SHIFT, shifted.sufficiency());

        CalibrationReport few = CalibrationTracker.compute("p", outcomes("p", 0.75, 40, 30), 50, LOOSE, NOW);
        assertEquals(SufficiencyVerdict.INSUFFICIENT_DATA, few.sufficiency());
    }

    @Test
    void emptyHistoryReportsNothingKnown() {
        CalibrationReport r = CalibrationTracker.compute("p", List.of(), 0, CalibrationTracker.Settings.DEFAULTS, NOW);

        assertEquals(0, r.sampleCount());
        assertEquals(0.0, r.ece());
        assertEquals(0.0, r.smoothEce());
        assertEquals(SufficiencyVerdict.INSUFFICIENT_DATA, r.sufficiency());
        assertTrue(r.buckets().stream().allMatch(CalibrationBucket::isEmpty));
    }

    @Test
    void bucketEdgesAreHalfOpenExceptTheLast() {
        assertEquals(0, CalibrationTracker.bucketIndex(0.0, 10));
        assertEquals(3, CalibrationTracker.bucketIndex(0.3, 10));
        assertEquals(2, CalibrationTracker.bucketIndex(0.2999, 10));
        assertEquals(9, CalibrationTracker.bucketIndex(1.0, 10));
        assertEquals(2, CalibrationTracker.bucketIndex(0.5, 5));
        assertEquals(4, CalibrationTracker.bucketIndex(1.0, 5));
    }

    @Test
    void recordingGoesToTheInjectedStore() {
        CalibrationTracker tracker = new CalibrationTracker(store, CalibrationTracker.Settings.DEFAULTS, CLOCK);

        tracker.recordOutcome("model-b", ConfidenceValue.certain("proof"), true, null);

        ArgumentCaptor<Outcome> captor = ArgumentCaptor.forClass(Outcome.class);
        verify(store).add(captor.capture());
        assertEquals("model-b", captor.getValue().producerId());
        assertEquals(1.0, captor.getValue().stated());
        assertEquals(NOW, captor.getValue().verifiedAt());
    }

    @Test
    void reportReadsTheStoreSnapshot() {
        when(store.outcomes("model-c")).thenReturn(outcomes("model-c", 0.35, 4, 1));
        CalibrationTracker tracker = new CalibrationTracker(store, CalibrationTracker.Settings.DEFAULTS, CLOCK);

        CalibrationReport r = tracker.report("model-c", 0);

        assertEquals(4, r.sampleCount());
        assertEquals(1, r.buckets().get(3).successes());
    }

    @Test
    void absentPredictionIsRejectedBeforeStoring() {
        CalibrationTracker tracker = new CalibrationTracker(store, CalibrationTracker.Settings.DEFAULTS, CLOCK);

        assertThrows(IllegalArgumentException.class,
                () -> tracker.recordOutcome("model-a", ConfidenceValue.absent(AbsentReason.UNCALIBRATED), true, NOW));
        verify(store, never()).add(any());
        assertThrows(IllegalArgumentException.class, () -> tracker.report("model-a", -1));
    }

    @Test
    void settingsRejectBadBounds() {
        assertThrows(IllegalArgumentException.class, () -> new CalibrationTracker.Settings(0, 0.05, 0.1, 0.05));
        assertThrows(IllegalArgumentException.class, () -> new CalibrationTracker.Settings(10, 1.5, 0.1, 0.05));
        assertThrows(IllegalArgumentException.class, () -> new CalibrationTracker.Settings(10, 0.05, 0.0, 0.05));
    }
}
