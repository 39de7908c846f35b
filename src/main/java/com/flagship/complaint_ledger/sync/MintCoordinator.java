package com.flagship.complaint_ledger.sync;

import com.flagship.complaint_ledger.complaint.ComplaintRecord;
import com.flagship.complaint_ledger.complaint.ComplaintRecordStore;
import com.flagship.complaint_ledger.complaint.MintFailure;
import com.flagship.complaint_ledger.observability.CorrelationContext;
import com.flagship.complaint_ledger.observability.SyncMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Mints complaints onto the ledger exactly once.
 *
 * Phase 3: Mint coordination.
 *
 * Guards, checked before any ledger call:
 * 1. Record already carries a receipt -> no-op
 * 2. In-flight key for this complaint cannot be acquired -> dropped
 * 3. Fresh read from the store shows a receipt -> no-op
 *
 * Outcomes after submission:
 * - confirmed: receipt stored, failure marker cleared, pending status changes propagated
 * - failed: failure marker recorded; the receipt column is left untouched
 * - confirmed but receipt not stored: WRITE_BACK marker, logged for manual reconciliation
 *
 * The in-flight key is released on every outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MintCoordinator {

    private final InFlightRegistry inFlightRegistry;
    private final SubmissionSerializer serializer;
    private final ComplaintRecordStore recordStore;
    private final StatusSyncCoordinator statusSyncCoordinator;
    private final SyncMetrics metrics;

    /**
     * Mints a complaint if it has not been minted yet.
     *
     * Blocks until the ledger reaches a terminal outcome. Never throws for
     * ledger or write-back failures; those are recorded and reported through
     * the returned outcome.
     */
    public MintOutcome mint(ComplaintRecord record) {
        long complaintId = record.getId();
        CorrelationContext.putComplaintId(complaintId);

        try {
            if (record.hasReceipt()) {
                log.debug("Complaint {} already has receipt {}, skipping", complaintId, record.getLedgerReceipt());
                return finish(MintOutcome.ALREADY_MINTED);
            }

            OperationKey key = OperationKey.mint(complaintId);
            if (!inFlightRegistry.tryAcquire(key)) {
                log.info("Complaint {} is already being minted, skipping", complaintId);
                return finish(MintOutcome.IN_FLIGHT);
            }

            try {
                return finish(mintAcquired(record));
            } finally {
                inFlightRegistry.release(key);
            }
        } finally {
            CorrelationContext.removeComplaintId();
        }
    }

    private MintOutcome mintAcquired(ComplaintRecord notified) {
        long complaintId = notified.getId();

        Optional<ComplaintRecord> stored;
        try {
            stored = recordStore.findById(complaintId);
        } catch (DataAccessException e) {
            log.warn("Could not read complaint {} before minting: {}", complaintId, e.getMessage());
            return MintOutcome.STORE_UNAVAILABLE;
        }

        if (stored.isEmpty()) {
            log.warn("Complaint {} is not visible in the record store, not minting", complaintId);
            return MintOutcome.RECORD_NOT_FOUND;
        }
        if (stored.get().hasReceipt()) {
            log.info("Complaint {} was minted meanwhile (receipt {}), skipping",
                    complaintId, stored.get().getLedgerReceipt());
            return MintOutcome.ALREADY_MINTED;
        }

        ComplaintRecord record = stored.get();
        LedgerOperation operation = LedgerOperation.mint(complaintId, record.ledgerCity(), record.ledgerCategory());
        log.info("Minting complaint {}: city={}, category={}", complaintId, operation.getCity(), operation.getCategory());

        SubmissionResult result = serializer.submit(operation);

        if (!result.isConfirmed()) {
            recordFailure(complaintId, result);
            return MintOutcome.FAILED;
        }

        String receipt = result.getReceipt().getReference();
        if (!persistReceipt(complaintId, receipt)) {
            return MintOutcome.WRITE_BACK_FAILED;
        }

        try {
            recordStore.clearMintFailure(complaintId);
        } catch (DataAccessException e) {
            log.warn("Complaint {} minted but its old failure marker could not be cleared: {}",
                    complaintId, e.getMessage());
        }

        log.info("Complaint {} minted, receipt {} stored", complaintId, receipt);
        statusSyncCoordinator.onMinted(record.withReceipt(receipt));
        return MintOutcome.MINTED;
    }

    private boolean persistReceipt(long complaintId, String receipt) {
        String reason;
        try {
            if (recordStore.writeReceipt(complaintId, receipt)) {
                return true;
            }
            reason = "no row updated (record missing or receipt already set)";
        } catch (DataAccessException e) {
            reason = e.getMessage();
        }

        metrics.recordWriteBackFailure();
        log.error("WRITE-BACK FAILURE: complaint {} is minted on the ledger with receipt {} " +
                  "but the receipt could not be stored ({}). Needs manual reconciliation; " +
                  "retrying the mint would be rejected as a duplicate.",
                complaintId, receipt, reason);

        try {
            recordStore.recordMintFailure(MintFailure.writeBack(complaintId, receipt, reason));
        } catch (DataAccessException e) {
            log.error("Could not record write-back failure for complaint {} (receipt {}): {}",
                    complaintId, receipt, e.getMessage());
        }
        return false;
    }

    private void recordFailure(long complaintId, SubmissionResult result) {
        MintFailure failure = switch (result.getOutcome()) {
            case REJECTED -> MintFailure.rejected(complaintId, result.getReason());
            case UNREACHABLE -> MintFailure.unreachable(complaintId, result.getReason());
            case TIMEOUT -> MintFailure.timeout(complaintId, result.getReason());
            case CONFIRMED -> throw new IllegalStateException("Confirmed submission is not a failure");
        };

        log.warn("Mint of complaint {} failed: kind={}, retryable={}, reason={}",
                complaintId, failure.getKind(), failure.isRetryable(), failure.getReason());

        try {
            recordStore.recordMintFailure(failure);
        } catch (DataAccessException e) {
            log.error("Could not record mint failure for complaint {}: {}", complaintId, e.getMessage());
        }
    }

    private MintOutcome finish(MintOutcome outcome) {
        metrics.recordMint(outcome.name());
        return outcome;
    }
}
