package com.flagship.complaint_ledger.sync;

import com.flagship.complaint_ledger.complaint.ComplaintRecord;
import com.flagship.complaint_ledger.complaint.ComplaintRecordStore;
import com.flagship.complaint_ledger.ledger.LedgerStatus;
import com.flagship.complaint_ledger.ledger.StatusMapper;
import com.flagship.complaint_ledger.observability.CorrelationContext;
import com.flagship.complaint_ledger.observability.SyncMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Propagates status transitions of minted complaints to the ledger.
 *
 * Phase 3: Status coordination.
 *
 * Rules, in order:
 * 1. If the ledger already confirmed the target status for this complaint, do nothing
 * 2. If the complaint has no receipt yet, drop the update; the mint picks up
 *    the current status once it confirms (see {@link #onMinted})
 * 3. Acquire the in-flight key (complaint id + target code); drop on failure
 * 4. Submit through the serializer and release the key on any outcome
 *
 * The confirmed-status memory holds at most sync.status-memory.max-entries
 * complaints, least recently used evicted first. An evicted complaint is
 * treated like one seen after a restart: its next repeated status is
 * submitted once more, and the ledger accepts it.
 */
@Service
@Slf4j
public class StatusSyncCoordinator {

    static final int DEFAULT_MEMORY_ENTRIES = 100_000;

    private final InFlightRegistry inFlightRegistry;
    private final SubmissionSerializer serializer;
    private final ComplaintRecordStore recordStore;
    private final SyncMetrics metrics;

    // Last status the ledger confirmed, per complaint
    private final Map<Long, LedgerStatus> confirmedStatuses;

    public StatusSyncCoordinator(InFlightRegistry inFlightRegistry,
                                 SubmissionSerializer serializer,
                                 ComplaintRecordStore recordStore,
                                 SyncMetrics metrics) {
        this(inFlightRegistry, serializer, recordStore, metrics, DEFAULT_MEMORY_ENTRIES);
    }

    @Autowired
    public StatusSyncCoordinator(InFlightRegistry inFlightRegistry,
                                 SubmissionSerializer serializer,
                                 ComplaintRecordStore recordStore,
                                 SyncMetrics metrics,
                                 @Value("${sync.status-memory.max-entries:100000}") int maxMemoryEntries) {
        this.inFlightRegistry = inFlightRegistry;
        this.serializer = serializer;
        this.recordStore = recordStore;
        this.metrics = metrics;
        this.confirmedStatuses = Collections.synchronizedMap(new LinkedHashMap<Long, LedgerStatus>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Long, LedgerStatus> eldest) {
                return size() > maxMemoryEntries;
            }
        });
    }

    /**
     * Brings the ledger status of a complaint in line with the record's status.
     *
     * @param record the record state from the notification (or a fresh read)
     * @return what happened; never throws for ledger failures
     */
    public StatusSyncOutcome syncStatus(ComplaintRecord record) {
        long complaintId = record.getId();
        LedgerStatus target = StatusMapper.map(record.getStatus());
        CorrelationContext.putComplaintId(complaintId);

        try {
            if (target == confirmedStatuses.get(complaintId)) {
                log.debug("Complaint {} already at {} on the ledger, skipping", complaintId, target);
                return finish(StatusSyncOutcome.ALREADY_CURRENT);
            }

            boolean minted;
            try {
                minted = isMinted(record);
            } catch (DataAccessException e) {
                log.warn("Could not read complaint {} to check mint state: {}", complaintId, e.getMessage());
                return finish(StatusSyncOutcome.FAILED);
            }

            if (!minted) {
                log.info("Complaint {} not minted yet, deferring status {} until the mint confirms",
                        complaintId, record.getStatus());
                return finish(StatusSyncOutcome.NOT_MINTED);
            }

            OperationKey key = OperationKey.statusUpdate(complaintId, target.getCode());
            if (!inFlightRegistry.tryAcquire(key)) {
                log.info("Status update for complaint {} to {} already in flight, skipping", complaintId, target);
                return finish(StatusSyncOutcome.IN_FLIGHT);
            }

            try {
                log.info("Updating ledger status for complaint {} -> {} ({})",
                        complaintId, record.getStatus(), target.getCode());

                SubmissionResult result = serializer.submit(LedgerOperation.statusUpdate(complaintId, target));

                if (result.isConfirmed()) {
                    confirmedStatuses.put(complaintId, target);
                    return finish(StatusSyncOutcome.SUBMITTED);
                }

                log.warn("Status update for complaint {} to {} failed: outcome={}, reason={}",
                        complaintId, target, result.getOutcome(), result.getReason());
                return finish(StatusSyncOutcome.FAILED);

            } finally {
                inFlightRegistry.release(key);
            }
        } finally {
            CorrelationContext.removeComplaintId();
        }
    }

    /**
     * Called by the mint coordinator once a mint is confirmed and stored.
     *
     * A minted complaint starts as PENDING on the ledger. Status changes that
     * arrived before the mint were dropped, so the current status is read
     * back and propagated if it differs. A status a live update confirmed
     * after the receipt was stored is kept.
     */
    void onMinted(ComplaintRecord minted) {
        long complaintId = minted.getId();
        confirmedStatuses.putIfAbsent(complaintId, LedgerStatus.PENDING);

        ComplaintRecord current;
        try {
            current = recordStore.findById(complaintId).orElse(minted);
        } catch (DataAccessException e) {
            log.warn("Could not re-read complaint {} after mint, using notified status: {}",
                    complaintId, e.getMessage());
            current = minted;
        }

        if (StatusMapper.map(current.getStatus()) != LedgerStatus.PENDING) {
            log.info("Complaint {} changed status to {} before its mint confirmed, propagating",
                    complaintId, current.getStatus());
            syncStatus(current.hasReceipt() ? current : current.withReceipt(minted.getLedgerReceipt()));
        }
    }

    /**
     * Last status the ledger confirmed for a complaint, if this engine has seen one.
     */
    public LedgerStatus confirmedStatus(long complaintId) {
        return confirmedStatuses.get(complaintId);
    }

    private boolean isMinted(ComplaintRecord record) {
        if (record.hasReceipt()) {
            return true;
        }
        return recordStore.findById(record.getId())
            .map(ComplaintRecord::hasReceipt)
            .orElse(false);
    }

    private StatusSyncOutcome finish(StatusSyncOutcome outcome) {
        metrics.recordStatusSync(outcome.name());
        return outcome;
    }
}
