package com.flagship.complaint_ledger.ledger;

/**
 * An operation was sent but no terminal outcome was observed within the
 * configured wait. The operation may still be confirmed later.
 */
public class LedgerTimeoutException extends LedgerException {

    public LedgerTimeoutException(String message) {
        super(message);
    }

    public LedgerTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
