package org.calista.credence.calibration;

import org.calista.credence.confidence.ConfidenceValue;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SmoothEceTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private static void add(List<Outcome> out, double stated, int total, int correct) {
        for (int i = 0; i < total; i++) {
            out.add(new Outcome("p", ConfidenceValue.measured(stated, "bench", 200, stated, stated), i < correct, NOW));
        }
    }

    @Test
    void singleOutcomeIsItsAbsoluteError() {
        List<Outcome> one = new ArrayList<>();
        add(one, 0.8, 1, 0);

        assertThat(SmoothEce.compute(one)).isCloseTo(0.8, within(1e-12));
    }

    @Test
    void constantForecastMeasuresItsGapToTheHitRate() {
        List<Outcome> all = new ArrayList<>();
        add(all, 0.9, 40, 40);

        assertThat(SmoothEce.compute(all)).isCloseTo(0.1, within(1e-6));
        assertThat(SmoothEce.compute(all, SmoothEce.Kernel.EPANECHNIKOV, 0.1, 100)).isCloseTo(0.1, within(1e-6));
    }

    @Test
    void matchedRatesScoreBelowInvertedRates() {
        List<Outcome> matched = new ArrayList<>();
        add(matched, 0.2, 10, 2);
        add(matched, 0.5, 10, 5);
        add(matched, 0.8, 10, 8);
        List<Outcome> inverted = new ArrayList<>();
        add(inverted, 0.2, 10, 8);
        add(inverted, 0.5, 10, 5);
        add(inverted, 0.8, 10, 2);

        double good = SmoothEce.compute(matched);
        double bad = SmoothEce.compute(inverted);

        assertThat(good).isLessThan(0.1);
        assertThat(bad).isGreaterThan(0.2);
    }

    @Test
    void silvermanBandwidthIsClamped() {
        assertThat(SmoothEce.silvermanBandwidth(new double[]{0.5, 0.5, 0.5})).isEqualTo(SmoothEce.MIN_BANDWIDTH);
        assertThat(SmoothEce.silvermanBandwidth(new double[]{0.2, 0.5, 0.8}))
                .isBetween(SmoothEce.MIN_BANDWIDTH, SmoothEce.MAX_BANDWIDTH);
    }

    @Test
    void badArgumentsAreRejected() {
        List<Outcome> two = new ArrayList<>();
        add(two, 0.6, 2, 1);

        assertThatThrownBy(() -> SmoothEce.compute(List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SmoothEce.compute(two, SmoothEce.Kernel.GAUSSIAN, 0.0, 100))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SmoothEce.compute(two, SmoothEce.Kernel.GAUSSIAN, Double.NaN, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
