package org.calista.credence.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.credence.io.FileIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonlEvidenceLedgerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void reopenRestoresEntriesAndContinuesSequence() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = io.resolve("ledger.jsonl");

        try (JsonlEvidenceLedger ledger = JsonlEvidenceLedger.open(io, mapper, file, CLOCK)) {
            ledger.append(EntryDraft.builder(EntryKind.EXTRACTION).put("note", "alpha")
                    .provenance(Provenance.of("repo", "ast_parse", null)).correlationId("s1").build());
            ledger.append(EntryDraft.builder(EntryKind.SYNTHESIS).put("score", 0.3).derivedFrom(1).build());
        }

        List<String> lines = Files.readAllLines(file);
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).isEqualTo(JsonlEvidenceLedger.SCHEMA_LINE);

        try (JsonlEvidenceLedger again = JsonlEvidenceLedger.open(io, mapper, file, CLOCK)) {
            assertThat(again.lastSequence()).isEqualTo(2);
            assertThat(again.verifyIntegrity().intact()).isTrue();
            LedgerEntry first = again.get(1).orElseThrow();
            assertThat(first.payload().get("note").asText()).isEqualTo("alpha");
            assertThat(first.provenance().method()).isEqualTo("ast_parse");
            assertThat(again.get(2).orElseThrow().derivedFrom()).containsExactly(1L);

            assertThat(again.append(EntryDraft.builder(EntryKind.FEEDBACK).put("ok", true).build())).isEqualTo(3);
        }
    }

    @Test
    void editedFileIsRefused() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = io.resolve("ledger.jsonl");
        try (JsonlEvidenceLedger ledger = JsonlEvidenceLedger.open(io, mapper, file, CLOCK)) {
            ledger.append(EntryDraft.builder(EntryKind.CLAIM).put("note", "alpha").build());
            ledger.append(EntryDraft.builder(EntryKind.CLAIM).put("note", "beta").build());
        }

        String text = Files.readString(file);
        Files.writeString(file, text.replace("\"alpha\"", "\"gamma\""));

        assertThatThrownBy(() -> JsonlEvidenceLedger.open(io, mapper, file, CLOCK))
                .isInstanceOf(LedgerException.class)
                .hasMessageContaining("integrity");
    }

    @Test
    void unparsableLineIsRefused() throws Exception {
        FileIO io = new FileIO(dir);
        Path file = io.resolve("ledger.jsonl");
        Files.writeString(file, JsonlEvidenceLedger.SCHEMA_LINE + "\n{not json\n");

        assertThatThrownBy(() -> JsonlEvidenceLedger.open(io, mapper, file, CLOCK))
                .isInstanceOf(LedgerException.class)
                .hasMessageContaining("corrupt ledger line 2");
    }
}
