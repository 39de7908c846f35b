package com.flagship.complaint_ledger.ledger;

import java.util.Optional;

/**
 * Operations the synchronization engine needs from the ledger.
 *
 * Mutating calls ({@link #create} and {@link #updateStatus}) block until the
 * operation reaches a terminal outcome and must only be invoked through the
 * {@code SubmissionSerializer}; the ledger rejects out-of-order submissions
 * from the same sender rather than reordering them.
 *
 * All failures are reported as unchecked {@link LedgerException}s.
 */
public interface LedgerClient {

    /**
     * Identity (wallet address) that signs mutating operations.
     * Submissions are serialized per identity.
     */
    String senderIdentity();

    /**
     * Mints the initial ledger record for a complaint.
     *
     * @return receipt of the confirmed operation
     * @throws LedgerRejectedException if the complaint was already minted or the ledger refused
     * @throws LedgerUnreachableException on transport failure
     * @throws LedgerTimeoutException if confirmation was not observed in time
     */
    LedgerReceipt create(long complaintId, String city, String category);

    /**
     * Records a status transition for an already minted complaint.
     */
    LedgerReceipt updateStatus(long complaintId, LedgerStatus status);

    /**
     * Reads a complaint from the ledger.
     *
     * @return the record, or empty if the ledger has no record for the id
     */
    Optional<LedgerRecord> read(long complaintId);

    /**
     * Cheap round-trip used by startup and health checks.
     *
     * @throws LedgerUnreachableException if the ledger cannot be reached
     */
    void verifyConnectivity();
}
