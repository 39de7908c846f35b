package com.flagship.complaint_ledger.sync;

import com.flagship.complaint_ledger.complaint.ComplaintRecord;
import com.flagship.complaint_ledger.complaint.InMemoryComplaintRecordStore;
import com.flagship.complaint_ledger.complaint.MintFailure;
import com.flagship.complaint_ledger.ledger.InMemoryLedgerClient;
import com.flagship.complaint_ledger.ledger.LedgerClient;
import com.flagship.complaint_ledger.ledger.LedgerReceipt;
import com.flagship.complaint_ledger.ledger.LedgerRejectedException;
import com.flagship.complaint_ledger.observability.SyncMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Phase 4 Tests: Backlog reconciliation
 *
 * These tests verify that:
 * - Every unminted complaint is minted, in ascending id order
 * - Minted and non-retryable complaints are left alone
 * - One failing complaint does not stop the pass
 * - A shutdown ends the pass after the complaint being minted
 */
class BacklogReconcilerTest {

    private static final String SENDER = "0x00000000000000000000000000000000000000aa";

    private InMemoryComplaintRecordStore store;
    private SyncMetrics metrics;

    @BeforeEach
    void setUp() {
        store = new InMemoryComplaintRecordStore();
        metrics = new SyncMetrics(new SimpleMeterRegistry());
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private BacklogReconciler reconciler(LedgerClient ledger) {
        InFlightRegistry registry = new InFlightRegistry();
        SubmissionSerializer serializer = new SubmissionSerializer(ledger, metrics, 5_000);
        StatusSyncCoordinator statusSync = new StatusSyncCoordinator(registry, serializer, store, metrics);
        MintCoordinator mintCoordinator = new MintCoordinator(registry, serializer, store, statusSync, metrics);
        return new BacklogReconciler(store, mintCoordinator, 0);
    }

    @Test
    @DisplayName("Unminted complaints are minted in ascending id order")
    void testBacklogMintedInOrder() {
        printTestHeader("Backlog - Minted In Order");

        InMemoryLedgerClient ledger = new InMemoryLedgerClient(SENDER);
        store.add(30, "pending", "C", "Roads");
        store.add(10, "pending", "A", "Roads");
        store.add(20, "pending", "B", "Water");
        store.save(ComplaintRecord.builder().id(5L).status("pending").ledgerReceipt("0xold").build());

        BacklogReport report = reconciler(ledger).reconcileBacklog();

        System.out.println("Report: " + report.summary());
        System.out.println("Ledger operations: " + ledger.getOperationLog());

        assertEquals(3, report.getCandidates());
        assertEquals(3, report.count(MintOutcome.MINTED));
        assertEquals(List.of("create(10)", "create(20)", "create(30)"), ledger.getOperationLog());
        assertTrue(store.findUnminted().isEmpty());

        printSuccess("Backlog drained in id order; minted complaint untouched");
    }

    @Test
    @DisplayName("Rejected complaints are excluded from later passes")
    void testRejectedExcluded() {
        InMemoryLedgerClient ledger = new InMemoryLedgerClient(SENDER);
        store.add(10, "pending", "A", "Roads");
        store.add(11, "pending", "B", "Roads");
        store.recordMintFailure(MintFailure.rejected(11, "execution reverted"));

        BacklogReport report = reconciler(ledger).reconcileBacklog();

        assertEquals(1, report.getCandidates());
        assertEquals(List.of("create(10)"), ledger.getOperationLog());
    }

    @Test
    @DisplayName("One failing complaint does not stop the pass")
    void testFailureDoesNotStopPass() {
        printTestHeader("Backlog - Failure Isolated");

        LedgerClient ledger = mock(LedgerClient.class);
        when(ledger.senderIdentity()).thenReturn(SENDER);
        when(ledger.create(eq(1L), anyString(), anyString())).thenReturn(LedgerReceipt.of("0x1", 1L));
        when(ledger.create(eq(2L), anyString(), anyString())).thenThrow(new LedgerRejectedException("execution reverted"));
        when(ledger.create(eq(3L), anyString(), anyString())).thenReturn(LedgerReceipt.of("0x3", 2L));

        store.add(1, "pending", "A", "Roads");
        store.add(2, "pending", "B", "Roads");
        store.add(3, "pending", "C", "Roads");

        BacklogReport report = reconciler(ledger).reconcileBacklog();

        System.out.println("Report: " + report.summary());

        assertEquals(2, report.count(MintOutcome.MINTED));
        assertEquals(1, report.count(MintOutcome.FAILED));
        assertEquals("0x3", store.findById(3).orElseThrow().getLedgerReceipt());
        assertEquals(MintFailure.Kind.REJECTED, store.failure(2).orElseThrow().getKind());

        printSuccess("Failure attributed to complaint 2 only");
    }

    @Test
    @DisplayName("Empty backlog makes no ledger calls")
    void testEmptyBacklog() {
        LedgerClient ledger = mock(LedgerClient.class);
        when(ledger.senderIdentity()).thenReturn(SENDER);

        BacklogReport report = reconciler(ledger).reconcileBacklog();

        assertEquals(0, report.getCandidates());
        assertEquals("no complaints waiting", report.summary());
        verify(ledger, never()).create(anyLong(), anyString(), anyString());
    }

    @Test
    @DisplayName("Stop request ends the pass after the complaint being minted")
    void testStopEndsPassAfterCurrentMint() {
        printTestHeader("Backlog - Stopped For Shutdown");

        LedgerClient ledger = mock(LedgerClient.class);
        when(ledger.senderIdentity()).thenReturn(SENDER);
        BacklogReconciler reconciler = reconciler(ledger);
        when(ledger.create(eq(1L), anyString(), anyString())).thenAnswer(invocation -> {
            reconciler.requestStop();
            return LedgerReceipt.of("0x1", 1L);
        });

        store.add(1, "pending", "A", "Roads");
        store.add(2, "pending", "B", "Roads");

        BacklogReport report = reconciler.reconcileBacklog();

        System.out.println("Report: " + report.summary());

        assertEquals(1, report.count(MintOutcome.MINTED));
        assertEquals(1, report.processed());
        assertEquals("0x1", store.findById(1).orElseThrow().getLedgerReceipt());
        verify(ledger, never()).create(eq(2L), anyString(), anyString());

        // No new pass once stopped
        assertEquals(0, reconciler.reconcileBacklog().getCandidates());
        verify(ledger, times(1)).create(anyLong(), anyString(), anyString());

        printSuccess("Complaint 1 minted and stored; complaint 2 left for the next start");
    }
}
