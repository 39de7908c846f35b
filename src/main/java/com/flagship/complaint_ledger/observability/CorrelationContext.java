package com.flagship.complaint_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC helpers for tracing a change event through the engine.
 *
 * A correlation id is assigned when an event is received (or when the
 * backlog sweep starts) and travels with the job into the worker pool, so
 * every log line about one notification can be grepped together.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String COMPLAINT_ID_MDC_KEY = "complaintId";

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Generates a new correlation ID.
     * Uses a shorter format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Wraps a task so that it runs with the given correlation and complaint ids in the MDC.
     */
    public static Runnable wrap(String correlationId, Long complaintId, Runnable task) {
        return () -> {
            MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
            if (complaintId != null) {
                MDC.put(COMPLAINT_ID_MDC_KEY, complaintId.toString());
            }
            try {
                task.run();
            } finally {
                MDC.remove(CORRELATION_ID_MDC_KEY);
                MDC.remove(COMPLAINT_ID_MDC_KEY);
            }
        };
    }

    public static void putComplaintId(Long complaintId) {
        if (complaintId != null) {
            MDC.put(COMPLAINT_ID_MDC_KEY, complaintId.toString());
        }
    }

    public static void removeComplaintId() {
        MDC.remove(COMPLAINT_ID_MDC_KEY);
    }
}
