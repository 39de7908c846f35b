package com.flagship.complaint_ledger.sync;

/**
 * What a call to {@link MintCoordinator#mint} did.
 */
public enum MintOutcome {
    MINTED,              // Confirmed on the ledger and receipt stored
    ALREADY_MINTED,      // Receipt already present; no ledger call
    IN_FLIGHT,           // Same mint underway elsewhere; dropped
    RECORD_NOT_FOUND,    // Complaint not visible in the store; nothing submitted
    STORE_UNAVAILABLE,   // Store could not be read; nothing submitted
    FAILED,              // Ledger rejected, unreachable or timed out; marker recorded
    WRITE_BACK_FAILED    // Ledger confirmed but receipt not stored; needs manual reconciliation
}
