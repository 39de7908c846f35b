package com.flagship.complaint_ledger.sync;

import com.flagship.complaint_ledger.ledger.LedgerClient;
import com.flagship.complaint_ledger.ledger.LedgerReceipt;
import com.flagship.complaint_ledger.ledger.LedgerStatus;
import lombok.Value;

/**
 * A ledger-mutating call waiting to go through the serializer.
 */
@Value
public class LedgerOperation {
    Type type;
    long complaintId;
    String city;
    String category;
    LedgerStatus status;

    public enum Type {
        MINT,
        STATUS_UPDATE
    }

    public static LedgerOperation mint(long complaintId, String city, String category) {
        return new LedgerOperation(Type.MINT, complaintId, city, category, LedgerStatus.PENDING);
    }

    public static LedgerOperation statusUpdate(long complaintId, LedgerStatus status) {
        return new LedgerOperation(Type.STATUS_UPDATE, complaintId, null, null, status);
    }

    LedgerReceipt execute(LedgerClient client) {
        return switch (type) {
            case MINT -> client.create(complaintId, city, category);
            case STATUS_UPDATE -> client.updateStatus(complaintId, status);
        };
    }

    public String describe() {
        return type == Type.MINT
            ? String.format("create(%d, \"%s\", \"%s\")", complaintId, city, category)
            : String.format("updateStatus(%d, %d)", complaintId, status.getCode());
    }
}
