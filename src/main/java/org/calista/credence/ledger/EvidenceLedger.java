package org.calista.credence.ledger;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * EvidenceLedger — append-only, totally ordered log of evidence events.
 *
 * <p>
 * Appends are serialized and get consecutive sequence numbers starting at 1. Reads run
 * concurrently with appends and see a consistent prefix. Entries are never mutated or
 * deleted; a correction is a new {@link EntryKind#CORRECTION} entry that derives from
 * the original.
 * </p>
 */
public interface EvidenceLedger extends AutoCloseable {

    /**
     * Appends an entry.
     *
     * @return assigned sequence number
     * @throws LedgerException          when the backing store fails; nothing was appended
     * @throws IllegalArgumentException when {@code derivedFrom} names an unknown sequence
     */
    long append(EntryDraft draft);

    /**
     * Appends a correction of {@code originalSequence}. The draft kind is ignored; the
     * stored entry is a {@link EntryKind#CORRECTION} deriving from the original.
     */
    long correct(long originalSequence, EntryDraft correction);

    /**
     * Lazy, ordered iteration from {@code sequence} (inclusive) up to the last entry that
     * existed when this call was made. Calling again restarts.
     */
    Iterator<LedgerEntry> readFrom(long sequence);

    /** Entries with this correlation id (session / trace), in sequence order. */
    List<LedgerEntry> correlate(String correlationId);

    Optional<LedgerEntry> get(long sequence);

    /** Last assigned sequence, 0 when empty. */
    long lastSequence();

    List<LedgerEntry> query(LedgerQuery query);

    /**
     * Registers a listener called after each successful append, on the appending thread.
     *
     * @return handle that removes the listener
     */
    Subscription subscribe(Consumer<LedgerEntry> listener);

    /** Recomputes every hash and back-link. */
    IntegrityReport verifyIntegrity();

    @Override
    default void close() {
    }

    @FunctionalInterface
    interface Subscription extends AutoCloseable {
        void unsubscribe();

        @Override
        default void close() {
            unsubscribe();
        }
    }
}
