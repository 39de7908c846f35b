package com.flagship.complaint_ledger.complaint;

import lombok.Value;

/**
 * Where a complaint stands with respect to the ledger.
 *
 * Exactly one of:
 * - UNMINTED: no receipt, no failure recorded
 * - MINTED: receipt stored
 * - FAILED: no receipt, last attempt left a failure marker
 */
@Value
public class MintState {
    long complaintId;
    State state;
    String receipt;
    MintFailure failure;

    public enum State {
        UNMINTED,
        MINTED,
        FAILED
    }

    public static MintState unminted(long complaintId) {
        return new MintState(complaintId, State.UNMINTED, null, null);
    }

    public static MintState minted(long complaintId, String receipt) {
        return new MintState(complaintId, State.MINTED, receipt, null);
    }

    public static MintState failed(long complaintId, MintFailure failure) {
        return new MintState(complaintId, State.FAILED, null, failure);
    }
}
