package com.flagship.complaint_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for ledger synchronization.
 *
 * Phase 6: Observability
 *
 * Metrics exposed:
 * - ledger.mint: mint attempts by outcome
 * - ledger.status_update: status sync attempts by outcome
 * - ledger.write_back.failure: confirmed mints whose receipt could not be stored
 * - ledger.submission.duration: time spent in the submission serializer
 * - feed.events: change events received, by operation and whether they produced work
 * - sync.in_flight: operations currently holding an in-flight key
 *
 * Write-back failures get their own counter because they need an operator;
 * retrying them produces duplicate-mint rejections.
 */
@Component
public class SyncMetrics {

    private final MeterRegistry registry;
    private final Counter writeBackFailures;

    public SyncMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.writeBackFailures = Counter.builder("ledger.write_back.failure")
                .description("Mints confirmed on the ledger whose receipt could not be persisted")
                .register(registry);
    }

    public void recordMint(String outcome) {
        registry.counter("ledger.mint", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordStatusSync(String outcome) {
        registry.counter("ledger.status_update", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordWriteBackFailure() {
        writeBackFailures.increment();
    }

    /**
     * Records how long a submission held the serializer.
     */
    public void recordSubmission(String operation, String outcome, Duration duration) {
        registry.timer("ledger.submission.duration",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).record(duration);
    }

    public void recordFeedEvent(String operation, boolean handled) {
        registry.counter("feed.events",
                "operation", sanitizeTag(operation),
                "handled", String.valueOf(handled)
        ).increment();
    }

    /**
     * Registers a gauge for the number of in-flight operations.
     */
    public void registerInFlightGauge(Supplier<Number> supplier) {
        Gauge.builder("sync.in_flight", supplier, s -> s.get().doubleValue())
                .description("Ledger operations currently being submitted")
                .register(registry);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_").toLowerCase();
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
