package com.flagship.complaint_ledger.complaint;

import java.util.List;
import java.util.Optional;

/**
 * Access to the complaint records the engine mirrors.
 *
 * The engine reads projections, sets the receipt once, and keeps failure
 * markers. It never deletes complaints.
 */
public interface ComplaintRecordStore {

    /**
     * Complaints without a receipt that should be minted, ascending by id.
     * Complaints whose last failure is not retryable are excluded.
     */
    List<ComplaintRecord> findUnminted();

    Optional<ComplaintRecord> findById(long complaintId);

    /**
     * Stores the receipt of a confirmed mint.
     *
     * @return false if no row was updated (record missing or receipt already set)
     * @throws org.springframework.dao.DataAccessException if the store is unavailable
     */
    boolean writeReceipt(long complaintId, String receipt);

    /**
     * Records or replaces the failure marker of a complaint.
     */
    void recordMintFailure(MintFailure failure);

    /**
     * Removes the failure marker after a successful mint.
     */
    void clearMintFailure(long complaintId);

    MintState mintState(long complaintId);

    /**
     * Failures that will not be retried automatically (rejections, lost receipts), newest first.
     */
    List<MintFailure> findFailuresNeedingAttention();

    /**
     * Size of the backlog, for health and metrics.
     */
    long countUnminted();
}
