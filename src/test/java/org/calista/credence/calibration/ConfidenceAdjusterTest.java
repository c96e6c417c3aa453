package org.calista.credence.calibration;

import org.calista.credence.confidence.AbsentReason;
import org.calista.credence.confidence.ConfidenceValue;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ConfidenceAdjusterTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private static CalibrationReport report(double stated, int total, int correct) {
        List<Outcome> out = new ArrayList<>();
        for (int i = 0; i < total; i++) {
            out.add(new Outcome("m", ConfidenceValue.measured(stated, "bench", 200, stated, stated), i < correct, NOW));
        }
        return CalibrationTracker.compute("m", out, 0, CalibrationTracker.Settings.DEFAULTS, NOW);
    }

    private static final ConfidenceValue STATED = ConfidenceValue.measured(0.8, "bench", 200, 0.75, 0.85);

    @Test
    void fullWeightReplacesWithObservedAccuracy() {
        ConfidenceAdjuster.Adjustment a = new ConfidenceAdjuster().adjust(STATED, report(0.8, 25, 15));

        assertThat(a.adjusted()).isTrue();
        assertThat(a.weight()).isEqualTo(1.0);
        assertThat(a.calibrated()).isInstanceOf(ConfidenceValue.Measured.class);
        assertThat(a.calibrated().pointValue().getAsDouble()).isCloseTo(0.6, within(1e-12));
        assertThat(((ConfidenceValue.Measured) a.calibrated()).datasetId()).isEqualTo("calibration:m:bucket8");
        assertThat(a.raw()).isSameAs(STATED);
    }

    @Test
    void partialWeightBlends() {
        ConfidenceAdjuster.Adjustment a = new ConfidenceAdjuster(3, 50).adjust(STATED, report(0.8, 25, 15));

        assertThat(a.weight()).isCloseTo(0.5, within(1e-12));
        assertThat(a.calibrated().pointValue().getAsDouble()).isCloseTo(0.7, within(1e-9));
    }

    @Test
    void sparseBucketOrAbsentValueIsLeftAlone() {
        ConfidenceAdjuster adjuster = new ConfidenceAdjuster();

        ConfidenceAdjuster.Adjustment sparse = adjuster.adjust(STATED, report(0.8, 2, 1));
        assertThat(sparse.adjusted()).isFalse();
        assertThat(sparse.calibrated()).isSameAs(STATED);

        ConfidenceValue absent = ConfidenceValue.absent(AbsentReason.INSUFFICIENT_DATA);
        assertThat(adjuster.adjust(absent, report(0.8, 25, 15)).calibrated()).isSameAs(absent);
    }

    @Test
    void rejectsInconsistentThresholds() {
        assertThatThrownBy(() -> new ConfidenceAdjuster(0, 20)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ConfidenceAdjuster(10, 5)).isInstanceOf(IllegalArgumentException.class);
    }
}
