package org.calista.credence.ledger;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Ordered entries of one correlation id together with the result of re-hashing them.
 */
public final class ReplaySession {

    private final String correlationId;
    private final List<LedgerEntry> entries;
    private final List<Long> tampered;

    private ReplaySession(String correlationId, List<LedgerEntry> entries, List<Long> tampered) {
        this.correlationId = correlationId;
        this.entries = List.copyOf(entries);
        this.tampered = List.copyOf(tampered);
    }

    /**
     * Collects the session and recomputes each entry hash. Back-links are checked
     * against the ledger, since session entries are usually not adjacent.
     */
    public static ReplaySession of(EvidenceLedger ledger, String correlationId) {
        Objects.requireNonNull(ledger, "ledger");
        Objects.requireNonNull(correlationId, "correlationId");
        List<LedgerEntry> es = ledger.correlate(correlationId);
        List<Long> bad = new ArrayList<>();
        for (LedgerEntry e : es) {
            String expectedPrev = e.sequence() == 1
                    ? EntryHasher.GENESIS
                    : ledger.get(e.sequence() - 1).map(LedgerEntry::hash).orElse(null);
            if (!e.hash().equals(EntryHasher.recompute(e)) || !e.previousHash().equals(expectedPrev)) {
                bad.add(e.sequence());
            }
        }
        return new ReplaySession(correlationId, es, bad);
    }

    /**
     * Folds the ledger prefix {@code [1, upTo]} into a state. Same prefix, same state.
     */
    public static <S> S fold(EvidenceLedger ledger, long upTo, S initial, BiFunction<S, LedgerEntry, S> step) {
        Objects.requireNonNull(ledger, "ledger");
        Objects.requireNonNull(step, "step");
        S state = initial;
        Iterator<LedgerEntry> it = ledger.readFrom(1);
        while (it.hasNext()) {
            LedgerEntry e = it.next();
            if (e.sequence() > upTo) break;
            state = step.apply(state, e);
        }
        return state;
    }

    public String correlationId() {
        return correlationId;
    }

    public List<LedgerEntry> entries() {
        return entries;
    }

    public List<Long> tampered() {
        return tampered;
    }

    public boolean verifyIntegrity() {
        return tampered.isEmpty();
    }

    public int size() {
        return entries.size();
    }
}
