package com.flagship.complaint_ledger.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * A complaint as the ledger stores it.
 * Read-only from the engine's point of view.
 */
@Value
public class LedgerRecord {
    long complaintId;
    String city;
    String category;
    String recordedBy;
    Instant timestamp;
    LedgerStatus status;

    /**
     * Returns a copy carrying a new status, used by the in-memory ledger.
     */
    public LedgerRecord withStatus(LedgerStatus newStatus) {
        return new LedgerRecord(complaintId, city, category, recordedBy, timestamp, newStatus);
    }
}
