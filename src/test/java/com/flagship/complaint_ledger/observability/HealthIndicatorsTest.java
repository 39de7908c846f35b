package com.flagship.complaint_ledger.observability;

import com.flagship.complaint_ledger.complaint.ComplaintRecordStore;
import com.flagship.complaint_ledger.complaint.MintFailure;
import com.flagship.complaint_ledger.complaint.MintFailureRepository;
import com.flagship.complaint_ledger.consumer.ChangeFeedSubscription;
import com.flagship.complaint_ledger.consumer.FeedConnectionMonitor;
import com.flagship.complaint_ledger.ledger.InMemoryLedgerClient;
import com.flagship.complaint_ledger.ledger.LedgerClient;
import com.flagship.complaint_ledger.ledger.LedgerUnreachableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Phase 6 Tests: Health indicators
 */
class HealthIndicatorsTest {

    @Test
    @DisplayName("Ledger health is UP when the node answers and DOWN when it does not")
    void testLedgerHealth() {
        Health up = new HealthIndicators.LedgerHealthIndicator(new InMemoryLedgerClient("0xaa")).health();
        assertEquals(Status.UP, up.getStatus());
        assertEquals("0xaa", up.getDetails().get("sender"));

        LedgerClient unreachable = mock(LedgerClient.class);
        doThrow(new LedgerUnreachableException("Ledger node unreachable", null)).when(unreachable).verifyConnectivity();

        Health down = new HealthIndicators.LedgerHealthIndicator(unreachable).health();
        assertEquals(Status.DOWN, down.getStatus());
        assertEquals("Ledger node unreachable", down.getDetails().get("error"));
    }

    @Test
    @DisplayName("Change feed health follows the connection state")
    void testChangeFeedHealth() {
        ChangeFeedSubscription subscription = mock(ChangeFeedSubscription.class);
        FeedConnectionMonitor monitor = new FeedConnectionMonitor();
        HealthIndicators.ChangeFeedHealthIndicator indicator =
            new HealthIndicators.ChangeFeedHealthIndicator(subscription, monitor);

        assertEquals("STARTING", indicator.health().getStatus().getCode());

        when(subscription.isStarted()).thenReturn(true);
        monitor.onConnecting();
        assertEquals("CONNECTING", indicator.health().getStatus().getCode());

        monitor.onSubscribed(1);
        assertEquals(Status.UP, indicator.health().getStatus());

        monitor.onError("no poll for 90000 ms");
        Health error = indicator.health();
        assertEquals(Status.DOWN, error.getStatus());
        assertEquals("no poll for 90000 ms", error.getDetails().get("lastError"));
    }

    @Test
    @DisplayName("Backlog health is DOWN while write-back failures exist")
    void testBacklogHealth() {
        ComplaintRecordStore store = mock(ComplaintRecordStore.class);
        MintFailureRepository failures = mock(MintFailureRepository.class);
        when(store.countUnminted()).thenReturn(3L);
        HealthIndicators.BacklogHealthIndicator indicator = new HealthIndicators.BacklogHealthIndicator(store, failures);

        assertEquals(Status.UP, indicator.health().getStatus());

        when(store.countUnminted()).thenReturn(150L);
        assertEquals("WARNING", indicator.health().getStatus().getCode());

        when(store.countUnminted()).thenReturn(3L);
        when(failures.countByKind(MintFailure.Kind.WRITE_BACK)).thenReturn(1L);
        Health down = indicator.health();
        assertEquals(Status.DOWN, down.getStatus());
        assertEquals(1L, down.getDetails().get("writeBackFailures"));
    }
}
