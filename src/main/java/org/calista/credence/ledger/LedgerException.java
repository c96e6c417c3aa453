package org.calista.credence.ledger;

/**
 * Storage failure underneath a ledger. The entry was not appended.
 */
public class LedgerException extends RuntimeException {

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    public LedgerException(String message) {
        super(message);
    }
}
