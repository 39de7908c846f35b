package com.flagship.complaint_ledger.consumer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Tracks the change feed connection state for logging and health checks.
 */
@Component
@Slf4j
public class FeedConnectionMonitor {

    private FeedConnectionState state = FeedConnectionState.DISCONNECTED;
    private Instant since = Instant.now();
    private String lastError;
    private int assignedPartitions;

    public synchronized void onConnecting() {
        transition(FeedConnectionState.CONNECTING, null);
    }

    public synchronized void onSubscribed(int partitions) {
        assignedPartitions = partitions;
        lastError = null;
        transition(FeedConnectionState.SUBSCRIBED, partitions + " partition(s) assigned");
    }

    public synchronized void onError(String reason) {
        lastError = reason;
        transition(FeedConnectionState.ERROR, reason);
    }

    public synchronized void onDisconnected(String reason) {
        assignedPartitions = 0;
        transition(FeedConnectionState.DISCONNECTED, reason);
    }

    public synchronized FeedConnectionState getState() {
        return state;
    }

    public synchronized Instant getSince() {
        return since;
    }

    public synchronized String getLastError() {
        return lastError;
    }

    public synchronized int getAssignedPartitions() {
        return assignedPartitions;
    }

    private void transition(FeedConnectionState next, String detail) {
        if (state == next) {
            return;
        }
        FeedConnectionState previous = state;
        state = next;
        since = Instant.now();

        switch (next) {
            case SUBSCRIBED:
                log.info("Change feed subscribed ({})", detail);
                break;
            case ERROR:
                log.error("Change feed error: {}", detail);
                break;
            default:
                log.info("Change feed {} -> {}{}", previous, next, detail != null ? " (" + detail + ")" : "");
        }
    }
}
