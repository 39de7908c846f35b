package com.flagship.complaint_ledger.observability;

import com.flagship.complaint_ledger.complaint.ComplaintRecordStore;
import com.flagship.complaint_ledger.complaint.MintFailure;
import com.flagship.complaint_ledger.complaint.MintFailureRepository;
import com.flagship.complaint_ledger.consumer.ChangeFeedSubscription;
import com.flagship.complaint_ledger.consumer.FeedConnectionMonitor;
import com.flagship.complaint_ledger.consumer.FeedConnectionState;
import com.flagship.complaint_ledger.ledger.LedgerClient;
import com.flagship.complaint_ledger.ledger.LedgerException;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the synchronization engine.
 *
 * Phase 6: Observability
 */
public class HealthIndicators {

    /**
     * Health indicator for ledger node connectivity.
     */
    @Component("ledgerHealth")
    public static class LedgerHealthIndicator implements HealthIndicator {

        private final LedgerClient ledgerClient;

        public LedgerHealthIndicator(LedgerClient ledgerClient) {
            this.ledgerClient = ledgerClient;
        }

        @Override
        public Health health() {
            try {
                ledgerClient.verifyConnectivity();
                return Health.up()
                        .withDetail("sender", ledgerClient.senderIdentity())
                        .build();
            } catch (LedgerException e) {
                return Health.down()
                        .withDetail("sender", ledgerClient.senderIdentity())
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Health indicator for the change feed subscription.
     */
    @Component("changeFeedHealth")
    public static class ChangeFeedHealthIndicator implements HealthIndicator {

        private final ChangeFeedSubscription subscription;
        private final FeedConnectionMonitor monitor;

        public ChangeFeedHealthIndicator(ChangeFeedSubscription subscription, FeedConnectionMonitor monitor) {
            this.subscription = subscription;
            this.monitor = monitor;
        }

        @Override
        public Health health() {
            if (!subscription.isStarted()) {
                return Health.status("STARTING")
                        .withDetail("note", "Feed subscribes after backlog reconciliation")
                        .build();
            }

            FeedConnectionState state = monitor.getState();
            Health.Builder builder = switch (state) {
                case SUBSCRIBED -> Health.up();
                case CONNECTING -> Health.status("CONNECTING");
                case ERROR, DISCONNECTED -> Health.down();
            };

            builder.withDetail("state", state)
                    .withDetail("since", monitor.getSince().toString())
                    .withDetail("partitions", monitor.getAssignedPartitions());
            if (monitor.getLastError() != null) {
                builder.withDetail("lastError", monitor.getLastError());
            }
            return builder.build();
        }
    }

    /**
     * Health indicator for the mint backlog.
     * Write-back failures make it DOWN: they need an operator.
     */
    @Component("backlogHealth")
    public static class BacklogHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 100;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 1000;

        private final ComplaintRecordStore recordStore;
        private final MintFailureRepository failureRepository;

        public BacklogHealthIndicator(ComplaintRecordStore recordStore, MintFailureRepository failureRepository) {
            this.recordStore = recordStore;
            this.failureRepository = failureRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = recordStore.countUnminted();
                long writeBackFailures = failureRepository.countByKind(MintFailure.Kind.WRITE_BACK);
                long rejected = failureRepository.countByKind(MintFailure.Kind.REJECTED);

                Health.Builder builder = writeBackFailures > 0 || backlogSize >= BACKLOG_CRITICAL_THRESHOLD
                        ? Health.down()
                        : backlogSize >= BACKLOG_WARNING_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.up();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("writeBackFailures", writeBackFailures)
                        .withDetail("rejectedMints", rejected)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }
}
