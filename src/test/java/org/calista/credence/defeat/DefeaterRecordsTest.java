package org.calista.credence.defeat;

import org.calista.credence.confidence.ConfidenceValue;
import org.calista.credence.ledger.EntryDraft;
import org.calista.credence.ledger.EntryKind;
import org.calista.credence.ledger.InMemoryEvidenceLedger;
import org.calista.credence.ledger.LedgerEntry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefeaterRecordsTest {

    private static Defeater d(String id, String attacks, double s) {
        return new Defeater(id, DefeaterKind.UNDERMINING, attacks, ConfidenceValue.measured(s, "review", 12, s, s));
    }

    @Test
    void latestRecordWinsAndRetractionRemoves() {
        InMemoryEvidenceLedger ledger = new InMemoryEvidenceLedger();
        ledger.append(DefeaterRecords.toDraft(d("d1", "c1", 0.4), "s1"));
        ledger.append(DefeaterRecords.toDraft(d("d2", "c1", 0.6), "s1"));
        ledger.append(DefeaterRecords.toDraft(d("d3", "c9", 0.6), "other"));
        ledger.append(DefeaterRecords.toDraft(d("d1", "c1", 0.7), "s1"));
        ledger.append(DefeaterRecords.retraction("d2", "s1"));

        List<Defeater> current = DefeaterRecords.read(ledger, "s1");

        assertThat(current).containsExactly(d("d1", "c1", 0.7));
        assertThat(DefeaterRecords.read(ledger, null)).extracting(Defeater::id).containsExactlyInAnyOrder("d1", "d3");
    }

    @Test
    void entryRoundTripsThroughPayload() {
        InMemoryEvidenceLedger ledger = new InMemoryEvidenceLedger();
        long claim = ledger.append(EntryDraft.builder(EntryKind.CLAIM).put("claimId", "c1").build());
        long seq = ledger.append(DefeaterRecords.toDraft(d("d1", "c1", 0.25), "s1", claim));

        LedgerEntry e = ledger.get(seq).orElseThrow();

        assertThat(e.kind()).isEqualTo(EntryKind.DEFEATER);
        assertThat(e.derivedFrom()).containsExactly(claim);
        assertThat(DefeaterRecords.fromEntry(e)).isEqualTo(d("d1", "c1", 0.25));
        assertThatThrownBy(() -> DefeaterRecords.fromEntry(ledger.get(claim).orElseThrow()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
