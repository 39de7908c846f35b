package com.flagship.complaint_ledger.consumer;

import com.flagship.complaint_ledger.complaint.ComplaintRecord;
import lombok.Value;

/**
 * A row change on the complaints table, normalized from the feed's wire shape.
 *
 * before is absent for inserts and often for updates (depends on the
 * table's replica identity); after is absent for deletes.
 */
@Value
public class ChangeEvent {
    ChangeOperation operation;
    String table;
    ComplaintRecord before;
    ComplaintRecord after;

    public Long complaintId() {
        if (after != null && after.getId() != null) {
            return after.getId();
        }
        return before != null ? before.getId() : null;
    }
}
