package org.calista.credence.calibration;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PacBoundTest {

    @Test
    void hoeffdingSampleRequirement() {
        assertEquals(185, PacBound.requiredSamples(0.1, 0.05));
        assertEquals(738, PacBound.requiredSamples(0.05, 0.05));
        assertTrue(PacBound.sufficient(185, 0.1, 0.05));
        assertFalse(PacBound.sufficient(184, 0.1, 0.05));
    }

    @Test
    void achievableEpsilonShrinksWithSamples() {
        assertEquals(1.0, PacBound.achievableEpsilon(0, 0.05));
        assertTrue(PacBound.achievableEpsilon(185, 0.05) <= 0.1);
        assertTrue(PacBound.achievableEpsilon(1000, 0.05) < PacBound.achievableEpsilon(100, 0.05));
    }

    @Test
    void rejectsParametersOutsideUnitInterval() {
        assertThrows(IllegalArgumentException.class, () -> PacBound.requiredSamples(0.0, 0.05));
        assertThrows(IllegalArgumentException.class, () -> PacBound.requiredSamples(0.1, 1.0));
    }
}
