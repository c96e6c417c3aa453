package org.calista.credence.ledger;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReplaySessionTest {

    @Test
    void sessionCollectsEntriesInOrderAndVerifies() {
        InMemoryEvidenceLedger ledger = new InMemoryEvidenceLedger();
        ledger.append(EntryDraft.builder(EntryKind.TOOL_CALL).put("cmd", "ls").correlationId("a").build());
        ledger.append(EntryDraft.builder(EntryKind.TOOL_CALL).put("cmd", "cat").correlationId("b").build());
        ledger.append(EntryDraft.builder(EntryKind.CLAIM).put("text", "x").correlationId("a").build());

        ReplaySession s = ReplaySession.of(ledger, "a");

        assertEquals(2, s.size());
        assertEquals(1, s.entries().get(0).sequence());
        assertEquals(3, s.entries().get(1).sequence());
        assertTrue(s.verifyIntegrity());
        assertTrue(s.tampered().isEmpty());
        assertEquals(0, ReplaySession.of(ledger, "none").size());
    }

    @Test
    void foldOverSamePrefixIsDeterministic() {
        InMemoryEvidenceLedger ledger = new InMemoryEvidenceLedger();
        for (int i = 1; i <= 5; i++) ledger.append(EntryDraft.builder(EntryKind.FEEDBACK).put("score", (long) i).build());

        long first = ReplaySession.fold(ledger, 3, 0L, (acc, e) -> acc + e.payload().get("score").asLong());
        ledger.append(EntryDraft.builder(EntryKind.FEEDBACK).put("score", 100L).build());
        long second = ReplaySession.fold(ledger, 3, 0L, (acc, e) -> acc + e.payload().get("score").asLong());

        assertEquals(6L, first);
        assertEquals(first, second);
        assertEquals(115L, (long) ReplaySession.fold(ledger, Long.MAX_VALUE, 0L,
                (acc, e) -> acc + e.payload().get("score").asLong()));
    }
}
