package org.calista.credence.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * InMemoryEvidenceLedger — array-backed ledger guarded by a read/write lock.
 *
 * <p>
 * The write lock serializes appends, so sequence numbers are gap-free and the hash
 * chain is linear. Readers take the read lock only long enough to copy references;
 * iterators fix their upper bound at creation, which gives each reader a stable prefix.
 * An optional {@link EntrySink} makes the ledger durable: the entry becomes visible
 * only after the sink accepted it.
 * </p>
 */
public class InMemoryEvidenceLedger implements EvidenceLedger {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEvidenceLedger.class);

    /** Durable side of an append. Called under the write lock. */
    @FunctionalInterface
    interface EntrySink {
        void write(LedgerEntry entry) throws IOException;
    }

    private final Clock clock;
    private final EntrySink sink;

    private final List<LedgerEntry> entries = new ArrayList<>();
    private final Map<String, List<Integer>> byCorrelation = new HashMap<>();
    private final List<Consumer<LedgerEntry>> listeners = new CopyOnWriteArrayList<>();

    private final ReentrantReadWriteLock rw = new ReentrantReadWriteLock();

    public InMemoryEvidenceLedger() {
        this(Clock.systemUTC());
    }

    public InMemoryEvidenceLedger(Clock clock) {
        this(clock, null, List.of());
    }

    /**
     * @param restored entries already persisted, in order; the caller has verified them
     */
    InMemoryEvidenceLedger(Clock clock, EntrySink sink, List<LedgerEntry> restored) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sink = sink;
        for (LedgerEntry e : restored) {
            if (e.sequence() != entries.size() + 1) {
                throw new IllegalArgumentException("restored entries out of order at sequence " + e.sequence());
            }
            index(e);
        }
    }

    // -------------------- Writes --------------------

    @Override
    public long append(EntryDraft draft) {
        Objects.requireNonNull(draft, "draft");
        return appendInternal(draft.kind(), draft);
    }

    @Override
    public long correct(long originalSequence, EntryDraft correction) {
        Objects.requireNonNull(correction, "correction");
        if (get(originalSequence).isEmpty()) {
            throw new IllegalArgumentException("cannot correct unknown sequence " + originalSequence);
        }
        List<Long> from = new ArrayList<>();
        from.add(originalSequence);
        for (Long s : correction.derivedFrom()) if (s != originalSequence) from.add(s);

        EntryDraft.Builder b = EntryDraft.builder(EntryKind.CORRECTION)
                .payload(correction.payload())
                .correlationId(correction.correlationId())
                .derivedFrom(from)
                .provenance(correction.provenance());
        b.put("corrects", originalSequence);
        if (correction.timestampEpochMs() != null) b.timestampEpochMs(correction.timestampEpochMs());
        return appendInternal(EntryKind.CORRECTION, b.build());
    }

    private long appendInternal(EntryKind kind, EntryDraft draft) {
        LedgerEntry e;
        rw.writeLock().lock();
        try {
            long seq = entries.size() + 1L;
            for (Long d : draft.derivedFrom()) {
                if (d == null || d < 1 || d >= seq) {
                    throw new IllegalArgumentException("derivedFrom references unknown sequence " + d + " (next is " + seq + ")");
                }
            }
            String prev = entries.isEmpty() ? EntryHasher.GENESIS : entries.get(entries.size() - 1).hash();
            long ts = draft.timestampEpochMs() != null ? draft.timestampEpochMs() : clock.millis();
            JsonNode payload = draft.payload();

            String hash = EntryHasher.hash(seq, kind, payload, draft.correlationId(), ts,
                    draft.derivedFrom(), draft.provenance(), prev);
            e = new LedgerEntry(seq, kind, payload, draft.correlationId(), ts,
                    draft.derivedFrom(), draft.provenance(), prev, hash);

            if (sink != null) {
                try {
                    sink.write(e);
                } catch (IOException io) {
                    throw new LedgerException("append failed at sequence " + seq, io);
                }
            }
            index(e);
        } finally {
            rw.writeLock().unlock();
        }

        if (log.isDebugEnabled()) {
            log.debug("ledger append: seq={}, kind={}, correlationId={}", e.sequence(), e.kind().wireName(), e.correlationId());
        }
        publish(e);
        return e.sequence();
    }

    // called under write lock (or from the constructor)
    private void index(LedgerEntry e) {
        int idx = entries.size();
        entries.add(e);
        if (e.correlationId() != null) {
            byCorrelation.computeIfAbsent(e.correlationId(), k -> new ArrayList<>()).add(idx);
        }
    }

    private void publish(LedgerEntry e) {
        for (Consumer<LedgerEntry> l : listeners) {
            try {
                l.accept(e);
            } catch (RuntimeException ex) {
                // a listener must not undo a committed append
                log.warn("ledger listener failed for seq={}", e.sequence(), ex);
            }
        }
    }

    // -------------------- Reads --------------------

    @Override
    public Iterator<LedgerEntry> readFrom(long sequence) {
        final int limit = count();
        final int start = (int) Math.max(0L, Math.min((long) limit, sequence - 1L));
        return new Iterator<>() {
            private int next = start;

            @Override
            public boolean hasNext() {
                return next < limit;
            }

            @Override
            public LedgerEntry next() {
                if (next >= limit) throw new NoSuchElementException();
                rw.readLock().lock();
                try {
                    return entries.get(next++);
                } finally {
                    rw.readLock().unlock();
                }
            }
        };
    }

    @Override
    public List<LedgerEntry> correlate(String correlationId) {
        if (correlationId == null) return List.of();
        rw.readLock().lock();
        try {
            List<Integer> idx = byCorrelation.get(correlationId);
            if (idx == null) return List.of();
            List<LedgerEntry> out = new ArrayList<>(idx.size());
            for (int i : idx) out.add(entries.get(i));
            return Collections.unmodifiableList(out);
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public Optional<LedgerEntry> get(long sequence) {
        rw.readLock().lock();
        try {
            if (sequence < 1 || sequence > entries.size()) return Optional.empty();
            return Optional.of(entries.get((int) (sequence - 1)));
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public long lastSequence() {
        return count();
    }

    @Override
    public List<LedgerEntry> query(LedgerQuery q) {
        Objects.requireNonNull(q, "query");
        List<LedgerEntry> snap = snapshot();
        List<LedgerEntry> hits = new ArrayList<>();
        for (LedgerEntry e : snap) if (q.matches(e)) hits.add(e);
        if (q.order() == LedgerQuery.Order.DESCENDING) Collections.reverse(hits);

        int from = Math.min(q.offset(), hits.size());
        int to = (int) Math.min((long) hits.size(), (long) from + q.limit());
        return Collections.unmodifiableList(new ArrayList<>(hits.subList(from, to)));
    }

    @Override
    public Subscription subscribe(Consumer<LedgerEntry> listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @Override
    public IntegrityReport verifyIntegrity() {
        return verify(snapshot());
    }

    static IntegrityReport verify(List<LedgerEntry> chain) {
        List<Long> broken = new ArrayList<>();
        String prev = EntryHasher.GENESIS;
        long expectedSeq = 1;
        for (LedgerEntry e : chain) {
            boolean ok = e.sequence() == expectedSeq
                    && e.previousHash().equals(prev)
                    && e.hash().equals(EntryHasher.recompute(e));
            if (!ok) broken.add(e.sequence());
            prev = e.hash();
            expectedSeq = e.sequence() + 1;
        }
        return new IntegrityReport(chain.size(), broken);
    }

    /** Consistent copy of the current prefix. */
    public List<LedgerEntry> snapshot() {
        rw.readLock().lock();
        try {
            return List.copyOf(entries);
        } finally {
            rw.readLock().unlock();
        }
    }

    private int count() {
        rw.readLock().lock();
        try {
            return entries.size();
        } finally {
            rw.readLock().unlock();
        }
    }
}
