package com.flagship.complaint_ledger.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools.
 *
 * - taskScheduler: housekeeping (metrics refresh, backlog re-sweep, feed reconnects)
 * - syncWorkerScheduler: mint and status sync jobs from the change feed
 *
 * Jobs block on the submission serializer, so a larger worker pool does not
 * increase ledger throughput; it only lets jobs queue without blocking intake.
 *
 * Both pools can be running a ledger submission (the re-sweep mints on the
 * housekeeping pool), so both wait for running tasks on shutdown. The drain
 * timeout should cover the receipt polling budget
 * (ledger.receipt.poll-interval-ms x ledger.receipt.attempts); a drain cut
 * short leaves a TIMEOUT marker for a transaction that may still confirm.
 */
@Configuration
@EnableScheduling
public class SyncExecutorConfig {

    @Bean
    public ThreadPoolTaskScheduler taskScheduler(
            @Value("${sync.shutdown.drain-timeout-seconds:150}") int drainTimeoutSeconds) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("sync-housekeeping-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(drainTimeoutSeconds);
        return scheduler;
    }

    @Bean
    public ThreadPoolTaskScheduler syncWorkerScheduler(
            @Value("${sync.workers.pool-size:4}") int poolSize,
            @Value("${sync.shutdown.drain-timeout-seconds:150}") int drainTimeoutSeconds) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("sync-worker-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(drainTimeoutSeconds);
        return scheduler;
    }
}
