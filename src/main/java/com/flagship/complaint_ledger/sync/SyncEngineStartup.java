package com.flagship.complaint_ledger.sync;

import com.flagship.complaint_ledger.complaint.ComplaintRecordStore;
import com.flagship.complaint_ledger.consumer.ChangeFeedSubscription;
import com.flagship.complaint_ledger.ledger.LedgerClient;
import com.flagship.complaint_ledger.ledger.LedgerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Brings the engine live.
 *
 * Order:
 * 1. Verify the ledger, the record store and the broker are reachable
 * 2. Reconcile the backlog
 * 3. Subscribe to the change feed
 *
 * Any failure in step 1 or 2 aborts startup; the engine never runs half-configured.
 * Subscribing after the backlog pass means inserts made during the pass are
 * delivered by the feed and deduplicated by the mint guards.
 */
@Component
@ConditionalOnProperty(name = "sync.startup.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SyncEngineStartup implements ApplicationRunner {

    private final LedgerClient ledgerClient;
    private final ComplaintRecordStore recordStore;
    private final BacklogReconciler backlogReconciler;
    private final ChangeFeedSubscription feedSubscription;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Starting complaint ledger synchronization (sender {})", ledgerClient.senderIdentity());

        verifyLedger();
        long backlogSize = verifyRecordStore();
        feedSubscription.verifyBrokerReachable();

        log.info("Collaborators reachable, {} complaint(s) in backlog", backlogSize);

        BacklogReport report;
        try {
            report = backlogReconciler.reconcileBacklog();
        } catch (DataAccessException e) {
            throw new IllegalStateException("Backlog reconciliation failed: " + e.getMessage(), e);
        }

        feedSubscription.start();
        log.info("Synchronization engine live; startup backlog: {}", report.summary());
    }

    private void verifyLedger() {
        try {
            ledgerClient.verifyConnectivity();
        } catch (LedgerException e) {
            throw new IllegalStateException("Ledger not reachable at startup: " + e.getMessage(), e);
        }
    }

    private long verifyRecordStore() {
        try {
            return recordStore.countUnminted();
        } catch (DataAccessException e) {
            throw new IllegalStateException("Record store not reachable at startup: " + e.getMessage(), e);
        }
    }
}
