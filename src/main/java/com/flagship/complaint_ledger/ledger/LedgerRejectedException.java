package com.flagship.complaint_ledger.ledger;

/**
 * The ledger refused the operation: duplicate mint, unknown complaint,
 * unauthorized sender, insufficient funds for gas, out-of-order nonce.
 */
public class LedgerRejectedException extends LedgerException {

    public LedgerRejectedException(String reason) {
        super(reason);
    }
}
