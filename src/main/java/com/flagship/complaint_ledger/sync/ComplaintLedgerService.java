package com.flagship.complaint_ledger.sync;

import com.flagship.complaint_ledger.complaint.ComplaintRecord;
import com.flagship.complaint_ledger.complaint.ComplaintRecordStore;
import com.flagship.complaint_ledger.complaint.MintFailure;
import com.flagship.complaint_ledger.complaint.MintState;
import com.flagship.complaint_ledger.ledger.LedgerClient;
import com.flagship.complaint_ledger.ledger.LedgerRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for callers outside the change feed.
 *
 * Manual triggers go through the same coordinators as feed events, so they
 * share the in-flight registry and the submission serializer.
 */
@Service
@RequiredArgsConstructor
public class ComplaintLedgerService {

    private final MintCoordinator mintCoordinator;
    private final StatusSyncCoordinator statusSyncCoordinator;
    private final BacklogReconciler backlogReconciler;
    private final ComplaintRecordStore recordStore;
    private final LedgerClient ledgerClient;

    public MintOutcome mintNow(ComplaintRecord record) {
        return mintCoordinator.mint(record);
    }

    /**
     * @throws IllegalArgumentException if the complaint does not exist
     */
    public MintOutcome mintNow(long complaintId) {
        return mintCoordinator.mint(load(complaintId));
    }

    public StatusSyncOutcome syncStatusNow(ComplaintRecord record) {
        return statusSyncCoordinator.syncStatus(record);
    }

    /**
     * @throws IllegalArgumentException if the complaint does not exist
     */
    public StatusSyncOutcome syncStatusNow(long complaintId) {
        return statusSyncCoordinator.syncStatus(load(complaintId));
    }

    public BacklogReport reconcileBacklogNow() {
        return backlogReconciler.reconcileBacklog();
    }

    /**
     * Reads the complaint as recorded on the ledger.
     *
     * @throws com.flagship.complaint_ledger.ledger.LedgerException if the ledger cannot be read
     */
    public Optional<LedgerRecord> getLedgerRecord(long complaintId) {
        return ledgerClient.read(complaintId);
    }

    public MintState getMintState(long complaintId) {
        return recordStore.mintState(complaintId);
    }

    /**
     * Mints that need an operator: rejected, or confirmed without a stored receipt.
     */
    public List<MintFailure> getFailuresNeedingAttention() {
        return recordStore.findFailuresNeedingAttention();
    }

    private ComplaintRecord load(long complaintId) {
        return recordStore.findById(complaintId)
            .orElseThrow(() -> new IllegalArgumentException("Complaint not found: " + complaintId));
    }
}
