package com.flagship.complaint_ledger.ledger;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ledger kept in process memory, for local runs and tests.
 *
 * Behaves like the on-chain registry where the engine can observe it:
 * - a complaint id can be minted once; later mints are rejected
 * - status updates for an unknown id are rejected
 * - operations overlapping in time for the same sender are rejected as
 *   out-of-order, the way a node rejects a reused nonce
 *
 * Every accepted operation is assigned the next sequence number (nonce).
 */
@Slf4j
public class InMemoryLedgerClient implements LedgerClient {

    private final String identity;
    private final Map<Long, LedgerRecord> records = new ConcurrentHashMap<>();
    private final List<String> operationLog = Collections.synchronizedList(new ArrayList<>());
    private final AtomicLong nonce = new AtomicLong(0);
    private final AtomicLong blockNumber = new AtomicLong(0);
    private final AtomicBoolean submitting = new AtomicBoolean(false);

    public InMemoryLedgerClient(String identity) {
        this.identity = identity;
    }

    @Override
    public String senderIdentity() {
        return identity;
    }

    @Override
    public LedgerReceipt create(long complaintId, String city, String category) {
        beginSubmission("create", complaintId);
        try {
            LedgerRecord record = new LedgerRecord(
                complaintId, city, category, identity, Instant.now(), LedgerStatus.PENDING);
            if (records.putIfAbsent(complaintId, record) != null) {
                throw new LedgerRejectedException("Complaint " + complaintId + " already logged");
            }
            return confirm("create(" + complaintId + ")");
        } finally {
            submitting.set(false);
        }
    }

    @Override
    public LedgerReceipt updateStatus(long complaintId, LedgerStatus status) {
        beginSubmission("updateStatus", complaintId);
        try {
            LedgerRecord updated = records.computeIfPresent(complaintId, (id, existing) -> existing.withStatus(status));
            if (updated == null) {
                throw new LedgerRejectedException("Complaint " + complaintId + " does not exist");
            }
            return confirm("updateStatus(" + complaintId + "," + status.getCode() + ")");
        } finally {
            submitting.set(false);
        }
    }

    @Override
    public Optional<LedgerRecord> read(long complaintId) {
        return Optional.ofNullable(records.get(complaintId));
    }

    @Override
    public void verifyConnectivity() {
        // Always reachable
    }

    /**
     * Accepted operations in confirmation order, e.g. {@code create(7)}.
     */
    public List<String> getOperationLog() {
        synchronized (operationLog) {
            return List.copyOf(operationLog);
        }
    }

    /**
     * Number of operations accepted so far; equals the next nonce.
     */
    public long getConfirmedCount() {
        return nonce.get();
    }

    private void beginSubmission(String operation, long complaintId) {
        if (!submitting.compareAndSet(false, true)) {
            log.warn("Rejecting overlapping {} for complaint {} from {}", operation, complaintId, identity);
            throw new LedgerRejectedException("nonce too low: another submission from " + identity + " is pending");
        }
    }

    private LedgerReceipt confirm(String operation) {
        long sequence = nonce.getAndIncrement();
        operationLog.add(operation);
        String reference = "0x" + UUID.randomUUID().toString().replace("-", "");
        log.debug("In-memory ledger confirmed {} nonce={} tx={}", operation, sequence, reference);
        return LedgerReceipt.of(reference, blockNumber.incrementAndGet());
    }
}
