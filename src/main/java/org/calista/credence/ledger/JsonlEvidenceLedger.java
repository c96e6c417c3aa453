package org.calista.credence.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.credence.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * JsonlEvidenceLedger — durable ledger: one JSON entry per line, append-only.
 *
 * <p>
 * First line of a new file is the schema marker {@code {"_schema":"credence-ledger-v1"}}.
 * On open every line is parsed and the hash chain is verified; a damaged file is
 * refused rather than partially loaded. Appends go to the file (through
 * {@link FileIO#appendJsonl}) before they become visible to readers.
 * </p>
 */
public final class JsonlEvidenceLedger implements EvidenceLedger {

    private static final Logger log = LoggerFactory.getLogger(JsonlEvidenceLedger.class);

    static final String SCHEMA_LINE = "{\"_schema\":\"credence-ledger-v1\"}";

    private final Path file;
    private final InMemoryEvidenceLedger delegate;

    private JsonlEvidenceLedger(Path file, InMemoryEvidenceLedger delegate) {
        this.file = file;
        this.delegate = delegate;
    }

    public static JsonlEvidenceLedger open(FileIO io, ObjectMapper mapper, Path file) throws IOException {
        return open(io, mapper, file, Clock.systemUTC());
    }

    public static JsonlEvidenceLedger open(FileIO io, ObjectMapper mapper, Path file, Clock clock) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(clock, "clock");

        List<LedgerEntry> restored = new ArrayList<>();
        if (io.exists(file)) {
            int lineNo = 0;
            for (String line : io.readJsonl(file)) {
                lineNo++;
                if (line.contains("\"_schema\"")) continue;
                try {
                    restored.add(mapper.readValue(line, LedgerEntry.class));
                } catch (IOException | IllegalArgumentException e) {
                    throw new LedgerException("corrupt ledger line " + lineNo + " in " + file, e);
                }
            }
        } else {
            io.appendJsonl(file, SCHEMA_LINE);
        }

        IntegrityReport report = InMemoryEvidenceLedger.verify(restored);
        if (!report.intact()) {
            throw new LedgerException("ledger " + file + " failed integrity check at sequences " + report.broken());
        }

        InMemoryEvidenceLedger.EntrySink sink = e -> io.appendJsonl(file, mapper.writeValueAsString(e));
        InMemoryEvidenceLedger mem = new InMemoryEvidenceLedger(clock, sink, restored);
        log.info("JSONL ledger opened: file={}, entries={}", file, restored.size());
        return new JsonlEvidenceLedger(file, mem);
    }

    public Path file() {
        return file;
    }

    @Override
    public long append(EntryDraft draft) {
        return delegate.append(draft);
    }

    @Override
    public long correct(long originalSequence, EntryDraft correction) {
        return delegate.correct(originalSequence, correction);
    }

    @Override
    public Iterator<LedgerEntry> readFrom(long sequence) {
        return delegate.readFrom(sequence);
    }

    @Override
    public List<LedgerEntry> correlate(String correlationId) {
        return delegate.correlate(correlationId);
    }

    @Override
    public Optional<LedgerEntry> get(long sequence) {
        return delegate.get(sequence);
    }

    @Override
    public long lastSequence() {
        return delegate.lastSequence();
    }

    @Override
    public List<LedgerEntry> query(LedgerQuery query) {
        return delegate.query(query);
    }

    @Override
    public Subscription subscribe(Consumer<LedgerEntry> listener) {
        return delegate.subscribe(listener);
    }

    @Override
    public IntegrityReport verifyIntegrity() {
        return delegate.verifyIntegrity();
    }
}
