package com.flagship.complaint_ledger.complaint;

import lombok.Value;

import java.time.Instant;

/**
 * Marker recorded when a mint did not end with a persisted receipt.
 *
 * Phase 3: Mint coordination.
 *
 * Kept apart from the receipt column so that an error text can never be
 * mistaken for a transaction hash.
 */
@Value
public class MintFailure {
    long complaintId;
    Kind kind;
    String reason;
    String receipt;
    int attempts;
    Instant recordedAt;

    public enum Kind {
        REJECTED,     // Ledger refused; not retried automatically
        UNREACHABLE,  // Transport failure; a later sweep may retry
        TIMEOUT,      // No terminal outcome observed; a later sweep may retry
        WRITE_BACK    // Ledger confirmed but the receipt could not be stored
    }

    public static MintFailure rejected(long complaintId, String reason) {
        return new MintFailure(complaintId, Kind.REJECTED, reason, null, 1, Instant.now());
    }

    public static MintFailure unreachable(long complaintId, String reason) {
        return new MintFailure(complaintId, Kind.UNREACHABLE, reason, null, 1, Instant.now());
    }

    public static MintFailure timeout(long complaintId, String reason) {
        return new MintFailure(complaintId, Kind.TIMEOUT, reason, null, 1, Instant.now());
    }

    /**
     * The ledger holds a record for this complaint but the store does not know it.
     * Retrying the mint would be rejected as a duplicate, so an operator has to
     * copy the receipt into the store.
     */
    public static MintFailure writeBack(long complaintId, String receipt, String reason) {
        return new MintFailure(complaintId, Kind.WRITE_BACK, reason, receipt, 1, Instant.now());
    }

    /**
     * Whether the backlog sweep should try this complaint again.
     */
    public boolean isRetryable() {
        return kind == Kind.UNREACHABLE || kind == Kind.TIMEOUT;
    }
}
