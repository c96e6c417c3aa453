package org.calista.credence.confidence;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceValueTest {

    @Test
    void constructionValidatesInsteadOfClamping() {
        assertThrows(ConfidenceConstructionException.class, () -> ConfidenceValue.measured(1.01, "d", 10, 0.9, 1.0));
        assertThrows(ConfidenceConstructionException.class, () -> ConfidenceValue.measured(0.5, "d", -1, 0.4, 0.6));
        assertThrows(ConfidenceConstructionException.class, () -> ConfidenceValue.measured(0.5, "d", 10, 0.6, 0.4));
        assertThrows(ConfidenceConstructionException.class, () -> ConfidenceValue.measured(Double.NaN, "d", 10, 0.4, 0.6));
        assertThrows(ConfidenceConstructionException.class, () -> ConfidenceValue.measured(0.5, " ", 10, 0.4, 0.6));
        assertThrows(ConfidenceConstructionException.class, () -> ConfidenceValue.bounded(0.6, 0.4, BoundedBasis.ESTIMATED));
        assertThrows(ConfidenceConstructionException.class, () -> ConfidenceValue.certain(""));
    }

    @Test
    void readingsPerVariant() {
        ConfidenceValue.Bounded b = ConfidenceValue.bounded(0.2, 0.6, BoundedBasis.LITERATURE);
        assertEquals(0.4, b.pointValue().getAsDouble(), 1e-12);
        assertEquals(0.2, b.effectiveValue(), 1e-12);

        ConfidenceValue.Deterministic no = ConfidenceValue.impossible("type error");
        assertEquals(0.0, no.pointValue().getAsDouble());
        assertEquals(CalibrationStatus.PRESERVED, no.calibrationStatus());

        ConfidenceValue.Absent a = ConfidenceValue.absent(AbsentReason.NOT_APPLICABLE);
        assertTrue(a.pointValue().isEmpty());
        assertEquals(0.0, a.effectiveValue());
    }

    @Test
    void wireNamesParseBack() {
        for (ConfidenceValue.Type t : ConfidenceValue.Type.values()) {
            assertEquals(t, ConfidenceValue.Type.fromWire(t.wireName()));
        }
        assertEquals(BoundedBasis.FORMAL_ANALYSIS, BoundedBasis.fromWire("formal_analysis"));
        assertThrows(ConfidenceConstructionException.class, () -> CalibrationStatus.fromWire("calibrated-ish"));
    }
}
