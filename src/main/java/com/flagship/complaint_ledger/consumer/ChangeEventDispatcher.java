package com.flagship.complaint_ledger.consumer;

import com.flagship.complaint_ledger.complaint.ComplaintRecord;
import com.flagship.complaint_ledger.observability.CorrelationContext;
import com.flagship.complaint_ledger.observability.SyncMetrics;
import com.flagship.complaint_ledger.sync.MintCoordinator;
import com.flagship.complaint_ledger.sync.StatusSyncCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Objects;

/**
 * Turns change events into sync jobs on the worker pool.
 *
 * Phase 4: Change feed.
 *
 * Routing:
 * - INSERT -> mint, after the settle delay so the inserting transaction is visible
 * - UPDATE with a changed, non-empty status -> status sync
 * - anything else (DELETE, other tables, unchanged status) -> ignored
 *
 * Dispatch only schedules; ledger work never runs on the listener thread.
 */
@Component
@Slf4j
public class ChangeEventDispatcher {

    private final MintCoordinator mintCoordinator;
    private final StatusSyncCoordinator statusSyncCoordinator;
    private final TaskScheduler workerScheduler;
    private final SyncMetrics metrics;
    private final String complaintsTable;
    private final long settleDelayMs;

    public ChangeEventDispatcher(MintCoordinator mintCoordinator,
                                 StatusSyncCoordinator statusSyncCoordinator,
                                 @Qualifier("syncWorkerScheduler") TaskScheduler workerScheduler,
                                 SyncMetrics metrics,
                                 @Value("${feed.table:complaints}") String complaintsTable,
                                 @Value("${feed.settle-delay-ms:1000}") long settleDelayMs) {
        this.mintCoordinator = mintCoordinator;
        this.statusSyncCoordinator = statusSyncCoordinator;
        this.workerScheduler = workerScheduler;
        this.metrics = metrics;
        this.complaintsTable = complaintsTable;
        this.settleDelayMs = settleDelayMs;
    }

    /**
     * @return true if a sync job was scheduled
     */
    public boolean dispatch(ChangeEvent event, String correlationId) {
        boolean handled = route(event, correlationId);
        metrics.recordFeedEvent(event.getOperation().name(), handled);
        return handled;
    }

    private boolean route(ChangeEvent event, String correlationId) {
        if (event.getTable() != null && !complaintsTable.equals(event.getTable())) {
            log.debug("Ignoring change on table {}", event.getTable());
            return false;
        }

        ComplaintRecord after = event.getAfter();

        switch (event.getOperation()) {
            case INSERT:
                if (after == null || after.getId() == null) {
                    log.warn("INSERT event without a complaint id, skipping");
                    return false;
                }
                log.info("New complaint {} detected, minting in {} ms", after.getId(), settleDelayMs);
                return schedule(correlationId, after.getId(), () -> mintCoordinator.mint(after), settleDelayMs);

            case UPDATE:
                if (after == null || after.getId() == null) {
                    log.warn("UPDATE event without a complaint id, skipping");
                    return false;
                }
                if (!statusChanged(event.getBefore(), after)) {
                    log.debug("Complaint {} updated without a status change", after.getId());
                    return false;
                }
                log.info("Complaint {} status changed: {} -> {}", after.getId(),
                        event.getBefore() != null ? event.getBefore().getStatus() : null, after.getStatus());
                return schedule(correlationId, after.getId(), () -> statusSyncCoordinator.syncStatus(after), 0);

            default:
                log.debug("Ignoring {} of complaint {}", event.getOperation(), event.complaintId());
                return false;
        }
    }

    static boolean statusChanged(ComplaintRecord before, ComplaintRecord after) {
        String current = after.getStatus();
        if (current == null || current.isBlank()) {
            return false;
        }
        return before == null || !Objects.equals(before.getStatus(), current);
    }

    private boolean schedule(String correlationId, Long complaintId, Runnable job, long delayMs) {
        Runnable task = CorrelationContext.wrap(correlationId, complaintId, () -> runGuarded(complaintId, job));
        try {
            if (delayMs > 0) {
                workerScheduler.schedule(task, Instant.now().plusMillis(delayMs));
            } else {
                workerScheduler.schedule(task, Instant.now());
            }
            return true;
        } catch (TaskRejectedException e) {
            log.warn("Sync job for complaint {} rejected (worker pool shutting down); " +
                     "the backlog sweep will pick it up", complaintId);
            return false;
        }
    }

    private void runGuarded(Long complaintId, Runnable job) {
        try {
            job.run();
        } catch (RuntimeException e) {
            log.error("Sync job for complaint {} failed: {}", complaintId, e.getMessage(), e);
        }
    }
}
