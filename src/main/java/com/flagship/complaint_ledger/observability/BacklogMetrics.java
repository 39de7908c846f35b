package com.flagship.complaint_ledger.observability;

import com.flagship.complaint_ledger.complaint.ComplaintRecordStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Gauge for the number of complaints still waiting to be minted.
 *
 * The value is cached and refreshed on a schedule so that a metrics scrape
 * never hits the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BacklogMetrics {

    private final ComplaintRecordStore recordStore;
    private final MeterRegistry meterRegistry;

    private final AtomicLong backlogSize = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("sync.backlog.size", backlogSize, AtomicLong::get)
                .description("Complaints without a ledger receipt that are eligible for minting")
                .register(meterRegistry);
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refresh() {
        try {
            backlogSize.set(recordStore.countUnminted());
        } catch (Exception e) {
            log.warn("Failed to refresh backlog metrics: {}", e.getMessage());
        }
    }

    public long getBacklogSize() {
        return backlogSize.get();
    }
}
