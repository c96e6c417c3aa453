package org.calista.credence.claim;

import org.calista.credence.confidence.ConfidenceValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ClaimTest {

    private final Claim base = Claim.entertained("c1", null, "model-a", ConfidenceValue.certain("proof"));

    @Test
    void withersReturnNewInstances() {
        Claim accepted = base.withStatus(ClaimStatus.ACCEPTED);

        assertSame(base, base.withStatus(ClaimStatus.ENTERTAINED));
        assertEquals(ClaimStatus.ACCEPTED, accepted.status());
        assertEquals(ClaimStatus.ENTERTAINED, base.status());
        assertEquals("", base.contentRef());
        assertEquals(List.of("e1"), base.withEvidence(List.of("e1")).evidenceIds());
    }

    @Test
    void statusWireNames() {
        assertEquals("defeated", ClaimStatus.DEFEATED.wireName());
        assertEquals(ClaimStatus.ENTERTAINED, ClaimStatus.fromWire(" "));
        assertEquals(ClaimStatus.REJECTED, ClaimStatus.fromWire("rejected"));
    }

    @Test
    void rejectsMissingFields() {
        assertThrows(NullPointerException.class,
                () -> Claim.entertained("c1", "r", null, ConfidenceValue.certain("proof")));
        assertThrows(IllegalArgumentException.class,
                () -> Claim.entertained(" ", "r", "m", ConfidenceValue.certain("proof")));
    }
}
