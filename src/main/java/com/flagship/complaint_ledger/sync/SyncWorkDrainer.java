package com.flagship.complaint_ledger.sync;

import com.flagship.complaint_ledger.consumer.ChangeFeedSubscription;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Drains sync work on shutdown.
 *
 * Stops after the Kafka listener containers (lower phase), so intake has
 * already stopped when the pools are shut down:
 * 1. Stop the change feed and end any backlog pass after its current mint
 * 2. Shut down the housekeeping pool, which runs the backlog re-sweep
 * 3. Shut down the worker pool
 * Each pool waits for running and scheduled jobs up to its termination timeout.
 */
@Component
@Slf4j
public class SyncWorkDrainer implements SmartLifecycle {

    static final int PHASE = Integer.MAX_VALUE - 200;

    private final ChangeFeedSubscription feedSubscription;
    private final BacklogReconciler backlogReconciler;
    private final ThreadPoolTaskScheduler housekeepingScheduler;
    private final ThreadPoolTaskScheduler workerScheduler;
    private final InFlightRegistry inFlightRegistry;

    private volatile boolean running;

    public SyncWorkDrainer(ChangeFeedSubscription feedSubscription,
                           BacklogReconciler backlogReconciler,
                           @Qualifier("taskScheduler") ThreadPoolTaskScheduler housekeepingScheduler,
                           @Qualifier("syncWorkerScheduler") ThreadPoolTaskScheduler workerScheduler,
                           InFlightRegistry inFlightRegistry) {
        this.feedSubscription = feedSubscription;
        this.backlogReconciler = backlogReconciler;
        this.housekeepingScheduler = housekeepingScheduler;
        this.workerScheduler = workerScheduler;
        this.inFlightRegistry = inFlightRegistry;
    }

    @Override
    public void start() {
        running = true;
    }

    @Override
    public void stop() {
        feedSubscription.stop();
        backlogReconciler.requestStop();

        log.info("Draining sync work: {} operation(s) in flight", inFlightRegistry.size());
        housekeepingScheduler.shutdown();
        workerScheduler.shutdown();

        int remaining = inFlightRegistry.size();
        if (remaining > 0) {
            log.warn("Shutdown drain timed out with {} operation(s) still in flight", remaining);
        } else {
            log.info("Sync work drained");
        }
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
