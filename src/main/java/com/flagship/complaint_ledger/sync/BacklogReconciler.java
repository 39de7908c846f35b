package com.flagship.complaint_ledger.sync;

import com.flagship.complaint_ledger.complaint.ComplaintRecord;
import com.flagship.complaint_ledger.complaint.ComplaintRecordStore;
import com.flagship.complaint_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mints every complaint that has no receipt yet.
 *
 * Phase 4: Backlog reconciliation.
 *
 * Runs once at startup, before the change feed is subscribed, and optionally
 * on a schedule afterwards. Candidates are minted one at a time in ascending
 * id order with a pause between them. Mints of the same complaint triggered
 * concurrently by the feed are absorbed by the in-flight registry.
 *
 * A failure of one complaint never stops the pass. A shutdown does: once
 * requestStop() is called the pass ends after the complaint being minted.
 */
@Service
@Slf4j
public class BacklogReconciler {

    private final ComplaintRecordStore recordStore;
    private final MintCoordinator mintCoordinator;
    private final long interOperationDelayMs;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean stopRequested;

    public BacklogReconciler(ComplaintRecordStore recordStore,
                             MintCoordinator mintCoordinator,
                             @Value("${sync.backlog.inter-operation-delay-ms:2000}") long interOperationDelayMs) {
        this.recordStore = recordStore;
        this.mintCoordinator = mintCoordinator;
        this.interOperationDelayMs = interOperationDelayMs;
    }

    /**
     * Runs one reconciliation pass.
     *
     * @throws org.springframework.dao.DataAccessException if the backlog cannot be read
     */
    public BacklogReport reconcileBacklog() {
        if (stopRequested) {
            log.info("Engine is shutting down, skipping backlog reconciliation");
            return BacklogReport.empty();
        }
        if (!running.compareAndSet(false, true)) {
            log.info("Backlog reconciliation already running, skipping");
            return BacklogReport.alreadyRunning();
        }

        boolean ownsCorrelationId = MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY) == null;
        if (ownsCorrelationId) {
            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.generateCorrelationId());
        }

        try {
            List<ComplaintRecord> backlog = recordStore.findUnminted();
            if (backlog.isEmpty()) {
                log.info("No complaints waiting to be minted");
                return BacklogReport.empty();
            }

            log.info("Found {} complaint(s) to mint", backlog.size());
            Map<MintOutcome, Integer> outcomes = new EnumMap<>(MintOutcome.class);

            for (int i = 0; i < backlog.size(); i++) {
                if (stopRequested) {
                    log.warn("Backlog reconciliation stopped for shutdown after {} of {} complaint(s)",
                            i, backlog.size());
                    break;
                }
                ComplaintRecord record = backlog.get(i);
                MintOutcome outcome;
                try {
                    outcome = mintCoordinator.mint(record);
                } catch (RuntimeException e) {
                    log.error("Unexpected error minting complaint {}: {}", record.getId(), e.getMessage(), e);
                    outcome = MintOutcome.FAILED;
                }
                outcomes.merge(outcome, 1, Integer::sum);

                if (i < backlog.size() - 1 && !pause()) {
                    log.warn("Backlog reconciliation interrupted after {} of {} complaint(s)", i + 1, backlog.size());
                    break;
                }
            }

            BacklogReport report = BacklogReport.of(backlog.size(), outcomes);
            log.info("Backlog reconciliation finished: {}", report.summary());
            return report;

        } finally {
            running.set(false);
            if (ownsCorrelationId) {
                MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Ends the current pass after the complaint being minted and refuses new passes.
     */
    public void requestStop() {
        stopRequested = true;
    }

    private boolean pause() {
        if (interOperationDelayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(interOperationDelayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
