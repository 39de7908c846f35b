package com.flagship.complaint_ledger.sync;

/**
 * What a call to {@link StatusSyncCoordinator#syncStatus} did.
 */
public enum StatusSyncOutcome {
    SUBMITTED,        // Status update confirmed on the ledger
    ALREADY_CURRENT,  // Ledger already confirmed this status; no ledger call
    IN_FLIGHT,        // Same target status underway; dropped
    NOT_MINTED,       // Complaint has no receipt yet; deferred until the mint confirms
    FAILED            // Ledger rejected, unreachable or timed out, or store unreadable
}
