package org.calista.credence.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProvenanceExporterTest {

    @Test
    void exportedSegmentReconstructsLosslessly() throws Exception {
        InMemoryEvidenceLedger ledger = new InMemoryEvidenceLedger();
        ledger.append(EntryDraft.builder(EntryKind.EXTRACTION).put("file", "Main.java")
                .provenance(Provenance.of("repo", "ast_parse", "indexer bot")).correlationId("s1").build());
        ledger.append(EntryDraft.builder(EntryKind.RETRIEVAL).put("hits", "4")
                .provenance(Provenance.of("search", null, "indexer bot")).correlationId("s1").build());
        ledger.append(EntryDraft.builder(EntryKind.CLAIM).put("text", "Main wires the kernel").put("score", 0.7)
                .derivedFrom(1, 2).correlationId("s1").build());

        ProvenanceDocument doc = ProvenanceExporter.export(ledger, 1, 3);

        assertThat(doc.entities()).hasSize(3);
        assertThat(doc.agents()).hasSize(1);
        assertThat(doc.derivations()).hasSize(2);

        ObjectMapper mapper = new ObjectMapper();
        JsonNode json = mapper.readTree(mapper.writeValueAsString(doc.toJson()));
        List<ProvenanceExporter.ReconstructedEntry> back = ProvenanceExporter.reconstruct(ProvenanceDocument.fromJson(json));

        assertThat(back).hasSize(3);
        for (ProvenanceExporter.ReconstructedEntry r : back) {
            LedgerEntry orig = ledger.get(r.sequence()).orElseThrow();
            assertThat(r.kind()).isEqualTo(orig.kind());
            assertThat(r.payload()).isEqualTo(orig.payload());
            assertThat(r.correlationId()).isEqualTo(orig.correlationId());
            assertThat(r.timestampEpochMs()).isEqualTo(orig.timestampEpochMs());
            assertThat(r.derivedFrom()).containsExactlyInAnyOrderElementsOf(orig.derivedFrom());
            assertThat(r.provenance()).isEqualTo(orig.provenance());
        }
    }

    @Test
    void segmentKeepsParentsOutsideItAsSequences() {
        InMemoryEvidenceLedger ledger = new InMemoryEvidenceLedger();
        ledger.append(EntryDraft.builder(EntryKind.EXTRACTION).build());
        ledger.append(EntryDraft.builder(EntryKind.SYNTHESIS).derivedFrom(1).build());

        List<ProvenanceExporter.ReconstructedEntry> back =
                ProvenanceExporter.reconstruct(ProvenanceExporter.export(ledger, 2, 2));

        assertThat(back).singleElement().satisfies(r -> {
            assertThat(r.sequence()).isEqualTo(2);
            assertThat(r.derivedFrom()).containsExactly(1L);
            assertThat(r.provenance()).isEqualTo(Provenance.NONE);
        });
    }
}
