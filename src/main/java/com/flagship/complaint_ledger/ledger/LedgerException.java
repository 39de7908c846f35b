package com.flagship.complaint_ledger.ledger;

/**
 * Base class for failures reported by a {@link LedgerClient}.
 *
 * The engine only classifies these by type; the message is carried into
 * logs and failure markers but never parsed.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
