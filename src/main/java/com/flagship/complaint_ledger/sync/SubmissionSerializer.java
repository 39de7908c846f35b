package com.flagship.complaint_ledger.sync;

import com.flagship.complaint_ledger.ledger.LedgerClient;
import com.flagship.complaint_ledger.ledger.LedgerReceipt;
import com.flagship.complaint_ledger.ledger.LedgerRejectedException;
import com.flagship.complaint_ledger.ledger.LedgerTimeoutException;
import com.flagship.complaint_ledger.ledger.LedgerUnreachableException;
import com.flagship.complaint_ledger.observability.SyncMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single chokepoint for every ledger-mutating call.
 *
 * Phase 2: Submission ordering.
 *
 * The ledger rejects (it does not reorder) operations that arrive out of
 * sequence for the same sending identity. Submissions for one identity are
 * therefore executed one at a time: a submission is admitted only after the
 * previous one reached a terminal outcome (confirmed or failed).
 *
 * Admission uses a fair lock per identity, so waiting callers are admitted
 * in arrival order. Every admitted submission gets the next local sequence
 * number, which shows up in the logs for auditing.
 *
 * Failures are classified into a SubmissionResult and returned. Nothing is
 * retried here.
 */
@Component
@Slf4j
public class SubmissionSerializer {

    private final LedgerClient ledgerClient;
    private final SyncMetrics metrics;
    private final Duration admissionTimeout;

    private final Map<String, ReentrantLock> identityLocks = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();

    public SubmissionSerializer(LedgerClient ledgerClient,
                                SyncMetrics metrics,
                                @Value("${sync.serializer.admission-timeout-ms:600000}") long admissionTimeoutMs) {
        this.ledgerClient = ledgerClient;
        this.metrics = metrics;
        this.admissionTimeout = Duration.ofMillis(admissionTimeoutMs);
    }

    /**
     * Submits an operation and waits for its terminal outcome.
     *
     * If the operation cannot be admitted within the admission timeout it is
     * not sent at all and a TIMEOUT result is returned.
     */
    public SubmissionResult submit(LedgerOperation operation) {
        String identity = ledgerClient.senderIdentity();
        ReentrantLock lock = identityLocks.computeIfAbsent(identity, id -> new ReentrantLock(true));

        try {
            if (!lock.tryLock(admissionTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Submission {} not admitted within {} ({} waiting)",
                        operation.describe(), admissionTimeout, lock.getQueueLength());
                return record(operation, SubmissionResult.timeout(
                    "Not admitted within " + admissionTimeout, 0), Duration.ZERO);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return record(operation, SubmissionResult.timeout(
                "Interrupted while waiting for admission", 0), Duration.ZERO);
        }

        long sequence = sequences.computeIfAbsent(identity, id -> new AtomicLong()).incrementAndGet();
        long start = System.nanoTime();
        SubmissionResult result;

        try {
            log.info("Submitting #{} {} as {}", sequence, operation.describe(), identity);
            LedgerReceipt receipt = operation.execute(ledgerClient);
            result = SubmissionResult.confirmed(receipt, sequence);

        } catch (LedgerRejectedException e) {
            result = SubmissionResult.rejected(e.getMessage(), sequence);

        } catch (LedgerUnreachableException e) {
            result = SubmissionResult.unreachable(e.getMessage(), sequence);

        } catch (LedgerTimeoutException e) {
            result = SubmissionResult.timeout(e.getMessage(), sequence);

        } finally {
            lock.unlock();
        }

        return record(operation, result, Duration.ofNanos(System.nanoTime() - start));
    }

    /**
     * Submissions currently waiting for admission, across all identities.
     */
    public int queuedSubmissions() {
        return identityLocks.values().stream().mapToInt(ReentrantLock::getQueueLength).sum();
    }

    private SubmissionResult record(LedgerOperation operation, SubmissionResult result, Duration duration) {
        metrics.recordSubmission(operation.getType().name(), result.getOutcome().name(), duration);

        if (result.isConfirmed()) {
            log.info("Submission #{} confirmed: {} receipt={} block={} ({} ms)",
                    result.getSequence(), operation.describe(),
                    result.getReceipt().getReference(), result.getReceipt().getBlockNumber(),
                    duration.toMillis());
        } else {
            log.warn("Submission #{} {}: {} reason={}",
                    result.getSequence(), result.getOutcome(), operation.describe(), result.getReason());
        }
        return result;
    }
}
