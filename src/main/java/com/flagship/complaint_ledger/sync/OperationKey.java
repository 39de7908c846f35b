package com.flagship.complaint_ledger.sync;

import lombok.Value;

/**
 * Identity of a ledger operation for de-duplication.
 *
 * A mint is identified by the complaint id alone. A status update is
 * identified by the complaint id and the target code, so repeated
 * notifications towards the same status collapse while a different target
 * proceeds independently.
 */
@Value
public class OperationKey {
    Kind kind;
    long complaintId;
    Integer statusCode;

    public enum Kind {
        MINT,
        STATUS_UPDATE
    }

    public static OperationKey mint(long complaintId) {
        return new OperationKey(Kind.MINT, complaintId, null);
    }

    public static OperationKey statusUpdate(long complaintId, int statusCode) {
        return new OperationKey(Kind.STATUS_UPDATE, complaintId, statusCode);
    }

    @Override
    public String toString() {
        return kind == Kind.MINT
            ? "mint:" + complaintId
            : "status:" + complaintId + ":" + statusCode;
    }
}
