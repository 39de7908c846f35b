package com.flagship.complaint_ledger.sync;

import com.flagship.complaint_ledger.config.SyncExecutorConfig;
import com.flagship.complaint_ledger.consumer.ChangeFeedSubscription;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Phase 4 Tests: Shutdown drain
 *
 * These tests verify that:
 * - Intake stops before any pool is shut down
 * - The housekeeping pool (backlog re-sweep) is drained as well as the worker pool
 * - A submission running on the housekeeping pool finishes uninterrupted
 */
class SyncWorkDrainerTest {

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Feed and backlog stop before the housekeeping and worker pools are drained")
    void testStopOrder() {
        ChangeFeedSubscription feedSubscription = mock(ChangeFeedSubscription.class);
        BacklogReconciler backlogReconciler = mock(BacklogReconciler.class);
        ThreadPoolTaskScheduler housekeeping = mock(ThreadPoolTaskScheduler.class);
        ThreadPoolTaskScheduler workers = mock(ThreadPoolTaskScheduler.class);

        SyncWorkDrainer drainer = new SyncWorkDrainer(
            feedSubscription, backlogReconciler, housekeeping, workers, new InFlightRegistry());
        drainer.start();
        drainer.stop();

        InOrder inOrder = inOrder(feedSubscription, backlogReconciler, housekeeping, workers);
        inOrder.verify(feedSubscription).stop();
        inOrder.verify(backlogReconciler).requestStop();
        inOrder.verify(housekeeping).shutdown();
        inOrder.verify(workers).shutdown();
        assertFalse(drainer.isRunning());
    }

    @Test
    @DisplayName("Both pools wait for running tasks on shutdown")
    void testPoolsWaitForTasks() {
        SyncExecutorConfig config = new SyncExecutorConfig();
        ThreadPoolTaskScheduler housekeeping = config.taskScheduler(150);
        ThreadPoolTaskScheduler workers = config.syncWorkerScheduler(4, 150);

        for (ThreadPoolTaskScheduler scheduler : new ThreadPoolTaskScheduler[] {housekeeping, workers}) {
            assertEquals(true, ReflectionTestUtils.getField(scheduler, "waitForTasksToCompleteOnShutdown"));
            assertEquals(150_000L, ReflectionTestUtils.getField(scheduler, "awaitTerminationMillis"));
        }
    }

    @Test
    @DisplayName("Re-sweep mint running on the housekeeping pool completes without interruption")
    void testHousekeepingTaskNotInterrupted() throws Exception {
        printTestHeader("Shutdown Drain - Housekeeping Task Completes");

        ThreadPoolTaskScheduler housekeeping = new SyncExecutorConfig().taskScheduler(5);
        housekeeping.initialize();
        ThreadPoolTaskScheduler workers = new SyncExecutorConfig().syncWorkerScheduler(1, 5);
        workers.initialize();

        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean(false);
        AtomicBoolean completed = new AtomicBoolean(false);
        housekeeping.execute(() -> {
            started.countDown();
            try {
                // Stands in for receipt polling
                Thread.sleep(300);
                completed.set(true);
            } catch (InterruptedException e) {
                interrupted.set(true);
                Thread.currentThread().interrupt();
            }
        });
        assertTrue(started.await(5, TimeUnit.SECONDS));

        SyncWorkDrainer drainer = new SyncWorkDrainer(
            mock(ChangeFeedSubscription.class), mock(BacklogReconciler.class),
            housekeeping, workers, new InFlightRegistry());
        drainer.stop();

        System.out.println("Completed: " + completed.get() + ", interrupted: " + interrupted.get());

        assertTrue(completed.get());
        assertFalse(interrupted.get());

        printSuccess("Running task finished before the drain returned");
    }
}
