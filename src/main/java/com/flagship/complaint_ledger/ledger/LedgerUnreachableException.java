package com.flagship.complaint_ledger.ledger;

/**
 * The ledger node could not be reached (transport or connectivity failure).
 */
public class LedgerUnreachableException extends LedgerException {

    public LedgerUnreachableException(String message, Throwable cause) {
        super(message, cause);
    }
}
