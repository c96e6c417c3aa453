package org.calista.credence.calibration;

import org.calista.credence.confidence.ConfidenceValue;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class IsotonicCalibratorTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private static Outcome o(double stated, boolean actual) {
        return new Outcome("model-a", ConfidenceValue.measured(stated, "bench", 200, stated, stated), actual, NOW);
    }

    @Test
    void violatorsArePooledIntoOneBlock() {
        IsotonicCalibrator map = IsotonicCalibrator.fit(List.of(
                o(0.9, true), o(0.8, true), o(0.7, false), o(0.6, true), o(0.3, false)));

        assertArrayEquals(new double[]{0.3, 0.6, 0.7, 0.8, 0.9}, map.knotsX(), 1e-12);
        assertArrayEquals(new double[]{0.0, 0.5, 0.5, 1.0, 1.0}, map.knotsY(), 1e-12);
        assertEquals(5, map.sampleSize());
        assertFalse(map.isStrictlyMonotonic());
        assertEquals(0.3, map.minRaw());
        assertEquals(0.9, map.maxRaw());
    }

    @Test
    void interpolatesBetweenKnotsAndClampsOutside() {
        IsotonicCalibrator map = IsotonicCalibrator.fit(List.of(
                o(0.9, true), o(0.8, true), o(0.7, false), o(0.6, true), o(0.3, false)));

        assertEquals(0.0, map.calibrate(0.1), 1e-12);
        assertEquals(0.25, map.calibrate(0.45), 1e-12);
        assertEquals(0.5, map.calibrate(0.65), 1e-12);
        assertEquals(0.75, map.calibrate(0.75), 1e-12);
        assertEquals(1.0, map.calibrate(0.8), 1e-12);
        assertEquals(1.0, map.calibrate(0.99), 1e-12);
    }

    @Test
    void sameStatedValueMapsToOneRate() {
        IsotonicCalibrator map = IsotonicCalibrator.fit(List.of(
                o(0.5, false), o(0.5, true), o(0.5, true), o(0.5, true)));

        assertEquals(1, map.knotCount());
        assertEquals(0.75, map.calibrate(0.5), 1e-12);
        assertEquals(0.75, map.calibrate(0.0), 1e-12);
        assertTrue(map.isStrictlyMonotonic());
    }

    @Test
    void fittedMapIsNonDecreasing() {
        Random rnd = new Random(7);
        List<Outcome> outcomes = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            double p = rnd.nextInt(101) / 100.0;
            outcomes.add(o(p, rnd.nextDouble() < p * p));
        }

        IsotonicCalibrator map = IsotonicCalibrator.fit(outcomes);

        double prev = -1.0;
        for (int i = 0; i <= 1000; i++) {
            double v = map.calibrate(i / 1000.0);
            assertTrue(v >= prev - 1e-12, "dropped at " + i);
            assertTrue(v >= 0.0 && v <= 1.0);
            prev = v;
        }
        assertEquals(500, map.sampleSize());
    }

    @Test
    void emptyHistoryCannotBeFitted() {
        assertThrows(IllegalArgumentException.class, () -> IsotonicCalibrator.fit(List.of()));
    }

    @Test
    void trackerFitsFromItsStore() {
        CalibrationTracker tracker = new CalibrationTracker(new InMemoryOutcomeStore());
        assertTrue(tracker.isotonic("model-a").isEmpty());

        tracker.recordOutcome("model-a", o(0.9, true).predicted(), true, NOW);
        tracker.recordOutcome("model-a", o(0.2, false).predicted(), false, NOW);

        IsotonicCalibrator map = tracker.isotonic("model-a").orElseThrow();
        assertEquals(2, map.sampleSize());
        assertEquals(0.0, map.calibrate(0.2), 1e-12);
        assertEquals(1.0, map.calibrate(0.9), 1e-12);
        assertTrue(map.isStrictlyMonotonic());
    }
}
