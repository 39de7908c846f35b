package com.flagship.complaint_ledger.sync;

import com.flagship.complaint_ledger.ledger.InMemoryLedgerClient;
import com.flagship.complaint_ledger.ledger.LedgerClient;
import com.flagship.complaint_ledger.ledger.LedgerReceipt;
import com.flagship.complaint_ledger.ledger.LedgerRejectedException;
import com.flagship.complaint_ledger.ledger.LedgerStatus;
import com.flagship.complaint_ledger.ledger.LedgerTimeoutException;
import com.flagship.complaint_ledger.ledger.LedgerUnreachableException;
import com.flagship.complaint_ledger.observability.SyncMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Phase 2 Tests: Submission ordering
 *
 * These tests verify that:
 * - Concurrent submissions reach the ledger one at a time
 * - Every admitted submission gets a distinct sequence number
 * - Ledger failures are classified, not thrown
 * - Submissions that cannot be admitted in time are not sent
 */
class SubmissionSerializerTest {

    private static final String SENDER = "0x00000000000000000000000000000000000000aa";

    private SimpleMeterRegistry meterRegistry;
    private SyncMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new SyncMetrics(meterRegistry);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Concurrent submissions never overlap at the ledger")
    void testConcurrentSubmissionsAreSerialized() throws Exception {
        printTestHeader("Concurrent Submissions - Serialized");

        // The in-memory ledger rejects overlapping submissions from one sender
        InMemoryLedgerClient ledger = new InMemoryLedgerClient(SENDER);
        SubmissionSerializer serializer = new SubmissionSerializer(ledger, metrics, 10_000);

        int submissions = 20;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<SubmissionResult>> futures = new ArrayList<>();

        for (int i = 1; i <= submissions; i++) {
            long complaintId = i;
            futures.add(executor.submit(() -> {
                start.await();
                return serializer.submit(LedgerOperation.mint(complaintId, "City " + complaintId, "Roads"));
            }));
        }

        start.countDown();

        Set<Long> sequences = new HashSet<>();
        for (Future<SubmissionResult> future : futures) {
            SubmissionResult result = future.get(10, TimeUnit.SECONDS);
            assertTrue(result.isConfirmed(), "Submission should be confirmed: " + result.getReason());
            sequences.add(result.getSequence());
        }
        executor.shutdown();

        System.out.println("Confirmed: " + ledger.getConfirmedCount());
        System.out.println("Distinct sequences: " + sequences.size());

        assertEquals(submissions, ledger.getConfirmedCount());
        assertEquals(submissions, sequences.size());
        assertEquals(0, serializer.queuedSubmissions());

        printSuccess("All submissions confirmed without overlap");
    }

    @Test
    @DisplayName("Ledger rejection becomes a REJECTED result with the ledger's reason")
    void testRejectionClassified() {
        LedgerClient ledger = mock(LedgerClient.class);
        when(ledger.senderIdentity()).thenReturn(SENDER);
        when(ledger.create(anyLong(), anyString(), anyString()))
            .thenThrow(new LedgerRejectedException("Complaint 7 already logged"));

        SubmissionSerializer serializer = new SubmissionSerializer(ledger, metrics, 1_000);
        SubmissionResult result = serializer.submit(LedgerOperation.mint(7, "Springfield", "Roads"));

        assertEquals(SubmissionResult.Outcome.REJECTED, result.getOutcome());
        assertEquals("Complaint 7 already logged", result.getReason());
        assertNull(result.getReceipt());
        assertEquals(1, meterRegistry.get("ledger.submission.duration")
            .tag("operation", "mint").tag("outcome", "rejected").timer().count());
    }

    @Test
    @DisplayName("Transport failures and timeouts are classified")
    void testUnreachableAndTimeoutClassified() {
        LedgerClient ledger = mock(LedgerClient.class);
        when(ledger.senderIdentity()).thenReturn(SENDER);
        when(ledger.updateStatus(1, LedgerStatus.RESOLVED))
            .thenThrow(new LedgerUnreachableException("connection refused", null));
        when(ledger.updateStatus(2, LedgerStatus.RESOLVED))
            .thenThrow(new LedgerTimeoutException("no receipt"));

        SubmissionSerializer serializer = new SubmissionSerializer(ledger, metrics, 1_000);

        assertEquals(SubmissionResult.Outcome.UNREACHABLE,
            serializer.submit(LedgerOperation.statusUpdate(1, LedgerStatus.RESOLVED)).getOutcome());
        assertEquals(SubmissionResult.Outcome.TIMEOUT,
            serializer.submit(LedgerOperation.statusUpdate(2, LedgerStatus.RESOLVED)).getOutcome());
    }

    @Test
    @DisplayName("Failed submission releases admission for the next one")
    void testFailureReleasesAdmission() {
        LedgerClient ledger = mock(LedgerClient.class);
        when(ledger.senderIdentity()).thenReturn(SENDER);
        when(ledger.create(1, "A", "B")).thenThrow(new LedgerRejectedException("reverted"));
        when(ledger.create(2, "A", "B")).thenReturn(LedgerReceipt.of("0x2", 2L));

        SubmissionSerializer serializer = new SubmissionSerializer(ledger, metrics, 1_000);

        SubmissionResult first = serializer.submit(LedgerOperation.mint(1, "A", "B"));
        SubmissionResult second = serializer.submit(LedgerOperation.mint(2, "A", "B"));

        assertFalse(first.isConfirmed());
        assertTrue(second.isConfirmed());
        assertEquals(first.getSequence() + 1, second.getSequence());
    }

    @Test
    @DisplayName("Submission not admitted within the timeout is not sent")
    void testAdmissionTimeout() throws Exception {
        printTestHeader("Admission Timeout - Not Sent");

        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        LedgerClient ledger = mock(LedgerClient.class);
        when(ledger.senderIdentity()).thenReturn(SENDER);
        when(ledger.create(1, "A", "B")).thenAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return LedgerReceipt.of("0x1", 1L);
        });

        SubmissionSerializer serializer = new SubmissionSerializer(ledger, metrics, 100);

        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<SubmissionResult> blocking = executor.submit(() -> serializer.submit(LedgerOperation.mint(1, "A", "B")));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        SubmissionResult timedOut = serializer.submit(LedgerOperation.mint(2, "A", "B"));

        release.countDown();
        assertTrue(blocking.get(5, TimeUnit.SECONDS).isConfirmed());
        executor.shutdown();

        System.out.println("Second submission: " + timedOut.getOutcome() + " - " + timedOut.getReason());

        assertEquals(SubmissionResult.Outcome.TIMEOUT, timedOut.getOutcome());
        verify(ledger, never()).create(eq(2L), anyString(), anyString());

        printSuccess("Second submission timed out waiting for admission and was never sent");
    }
}
