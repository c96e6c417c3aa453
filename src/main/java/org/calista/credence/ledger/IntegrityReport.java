package org.calista.credence.ledger;

import java.util.List;

/**
 * Result of walking the hash chain.
 *
 * @param entriesChecked how many entries were recomputed
 * @param broken         sequences whose hash or back-link does not match
 */
public record IntegrityReport(long entriesChecked, List<Long> broken) {

    public IntegrityReport {
        broken = List.copyOf(broken);
    }

    public boolean intact() {
        return broken.isEmpty();
    }
}
