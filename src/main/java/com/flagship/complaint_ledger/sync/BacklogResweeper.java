package com.flagship.complaint_ledger.sync;

import com.flagship.complaint_ledger.consumer.ChangeFeedSubscription;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Re-runs backlog reconciliation on a fixed delay.
 *
 * Inserts that happen while the feed is disconnected are never delivered;
 * the periodic sweep picks them up. Only runs once the feed is live, so it
 * never competes with the startup pass.
 */
@Component
@ConditionalOnProperty(name = "sync.resweep.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class BacklogResweeper {

    private final BacklogReconciler backlogReconciler;
    private final ChangeFeedSubscription feedSubscription;

    @Scheduled(fixedDelayString = "${sync.resweep.interval-ms:300000}",
               initialDelayString = "${sync.resweep.interval-ms:300000}")
    public void resweep() {
        if (!feedSubscription.isStarted()) {
            log.debug("Change feed not live yet, skipping backlog re-sweep");
            return;
        }
        try {
            BacklogReport report = backlogReconciler.reconcileBacklog();
            if (report.getCandidates() > 0) {
                log.info("Backlog re-sweep: {}", report.summary());
            }
        } catch (DataAccessException e) {
            log.warn("Backlog re-sweep could not read the record store: {}", e.getMessage());
        }
    }
}
