package com.flagship.complaint_ledger.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * Proof that a ledger operation was confirmed.
 *
 * The reference is the transaction hash; it is what the record store keeps
 * in its receipt column.
 */
@Value
public class LedgerReceipt {
    String reference;
    Long blockNumber;
    Instant confirmedAt;

    public static LedgerReceipt of(String reference, Long blockNumber) {
        return new LedgerReceipt(reference, blockNumber, Instant.now());
    }
}
