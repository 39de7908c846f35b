package com.flagship.complaint_ledger.consumer;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.AdminClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.kafka.config.KafkaListenerEndpointRegistry;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.event.ConsumerStoppedEvent;
import org.springframework.kafka.event.NonResponsiveConsumerEvent;
import org.springframework.kafka.listener.MessageListenerContainer;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns the lifecycle of the change feed listener container.
 *
 * Phase 4: Change feed.
 *
 * - start(): starts the listener container (after backlog reconciliation)
 * - connection loss (non-responsive consumer, abnormal stop): ERROR, then a
 *   restart is scheduled with exponential backoff
 * - partition assignment: SUBSCRIBED, backoff reset
 * - stop() or context shutdown: no further reconnects
 */
@Component
@Slf4j
public class ChangeFeedSubscription {

    private final KafkaListenerEndpointRegistry endpointRegistry;
    private final KafkaAdmin kafkaAdmin;
    private final FeedConnectionMonitor monitor;
    private final TaskScheduler taskScheduler;
    private final BackOff reconnectBackOff;
    private final long brokerCheckTimeoutMs;

    private volatile boolean started;
    private volatile boolean shuttingDown;
    private BackOffExecution backOffExecution;
    private ScheduledFuture<?> pendingReconnect;

    public ChangeFeedSubscription(KafkaListenerEndpointRegistry endpointRegistry,
                                  KafkaAdmin kafkaAdmin,
                                  FeedConnectionMonitor monitor,
                                  @Qualifier("taskScheduler") TaskScheduler taskScheduler,
                                  @Value("${feed.reconnect.initial-interval-ms:1000}") long initialIntervalMs,
                                  @Value("${feed.reconnect.multiplier:2.0}") double multiplier,
                                  @Value("${feed.reconnect.max-interval-ms:60000}") long maxIntervalMs,
                                  @Value("${feed.reconnect.max-elapsed-ms:3600000}") long maxElapsedMs,
                                  @Value("${feed.broker-check-timeout-ms:10000}") long brokerCheckTimeoutMs) {
        this.endpointRegistry = endpointRegistry;
        this.kafkaAdmin = kafkaAdmin;
        this.monitor = monitor;
        this.taskScheduler = taskScheduler;
        this.brokerCheckTimeoutMs = brokerCheckTimeoutMs;

        ExponentialBackOff backOff = new ExponentialBackOff(initialIntervalMs, multiplier);
        backOff.setMaxInterval(maxIntervalMs);
        backOff.setMaxElapsedTime(maxElapsedMs);
        this.reconnectBackOff = backOff;
    }

    /**
     * Checks that the Kafka cluster answers a metadata request.
     *
     * @throws IllegalStateException if it does not within the timeout
     */
    public void verifyBrokerReachable() {
        try (AdminClient admin = AdminClient.create(kafkaAdmin.getConfigurationProperties())) {
            String clusterId = admin.describeCluster().clusterId().get(brokerCheckTimeoutMs, TimeUnit.MILLISECONDS);
            log.info("Kafka cluster {} reachable", clusterId);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Kafka cluster not reachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while checking the Kafka cluster", e);
        }
    }

    public synchronized void start() {
        shuttingDown = false;
        started = true;

        MessageListenerContainer container = container();
        if (container == null) {
            log.warn("Change feed listener is not registered (consumer.enabled=false); " +
                     "only backlog sweeps will mint complaints");
            return;
        }

        monitor.onConnecting();
        if (!container.isRunning()) {
            container.start();
        }
    }

    public synchronized void stop() {
        shuttingDown = true;
        started = false;
        cancelPendingReconnect();

        MessageListenerContainer container = container();
        if (container != null && container.isRunning()) {
            container.stop();
        }
        monitor.onDisconnected("stopped");
    }

    public boolean isStarted() {
        return started;
    }

    public FeedConnectionState getState() {
        return monitor.getState();
    }

    /**
     * Partitions were assigned: the subscription is live.
     */
    public synchronized void onSubscribed(int partitions) {
        backOffExecution = null;
        monitor.onSubscribed(partitions);
    }

    @EventListener
    public void onNonResponsiveConsumer(NonResponsiveConsumerEvent event) {
        if (isOurs(event.getContainer(MessageListenerContainer.class))) {
            handleConnectionLost("no poll for " + event.getTimeSinceLastPoll() + " ms");
        }
    }

    @EventListener
    public void onConsumerStopped(ConsumerStoppedEvent event) {
        if (isOurs(event.getContainer(MessageListenerContainer.class))
                && event.getReason() != ConsumerStoppedEvent.Reason.NORMAL) {
            handleConnectionLost("consumer stopped: " + event.getReason());
        }
    }

    @EventListener
    public void onContextClosed(ContextClosedEvent event) {
        shuttingDown = true;
    }

    synchronized void handleConnectionLost(String reason) {
        if (shuttingDown || !started) {
            return;
        }
        monitor.onError(reason);

        if (pendingReconnect != null && !pendingReconnect.isDone()) {
            return;
        }
        if (backOffExecution == null) {
            backOffExecution = reconnectBackOff.start();
        }

        long delayMs = backOffExecution.nextBackOff();
        if (delayMs == BackOffExecution.STOP) {
            log.error("Giving up reconnecting the change feed; restart the engine to resume live events");
            monitor.onDisconnected("reconnect attempts exhausted");
            return;
        }

        log.info("Reconnecting change feed in {} ms", delayMs);
        pendingReconnect = taskScheduler.schedule(this::reconnect, Instant.now().plusMillis(delayMs));
    }

    synchronized void reconnect() {
        pendingReconnect = null;
        if (shuttingDown || !started) {
            return;
        }

        MessageListenerContainer container = container();
        if (container == null) {
            return;
        }

        monitor.onConnecting();
        try {
            if (container.isRunning()) {
                container.stop();
            }
            container.start();
        } catch (RuntimeException e) {
            log.warn("Change feed restart failed: {}", e.getMessage());
            handleConnectionLost("restart failed: " + e.getMessage());
        }
    }

    private boolean isOurs(MessageListenerContainer container) {
        return container != null && ComplaintChangeListener.LISTENER_ID.equals(container.getListenerId());
    }

    private MessageListenerContainer container() {
        return endpointRegistry.getListenerContainer(ComplaintChangeListener.LISTENER_ID);
    }

    private void cancelPendingReconnect() {
        if (pendingReconnect != null) {
            pendingReconnect.cancel(false);
            pendingReconnect = null;
        }
    }
}
