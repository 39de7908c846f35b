package com.flagship.complaint_ledger.sync;

import com.flagship.complaint_ledger.ledger.LedgerReceipt;
import lombok.Value;

/**
 * Terminal outcome of a submission.
 *
 * Either CONFIRMED with a receipt, or one of the failure outcomes with a
 * reason. The serializer never retries; what to do with a failure is the
 * caller's decision.
 */
@Value
public class SubmissionResult {
    Outcome outcome;
    LedgerReceipt receipt;
    String reason;
    long sequence;

    public enum Outcome {
        CONFIRMED,
        REJECTED,     // Ledger refused the operation
        UNREACHABLE,  // Transport or connectivity failure
        TIMEOUT       // No terminal outcome within the bounded wait
    }

    public static SubmissionResult confirmed(LedgerReceipt receipt, long sequence) {
        return new SubmissionResult(Outcome.CONFIRMED, receipt, null, sequence);
    }

    public static SubmissionResult rejected(String reason, long sequence) {
        return new SubmissionResult(Outcome.REJECTED, null, reason, sequence);
    }

    public static SubmissionResult unreachable(String reason, long sequence) {
        return new SubmissionResult(Outcome.UNREACHABLE, null, reason, sequence);
    }

    public static SubmissionResult timeout(String reason, long sequence) {
        return new SubmissionResult(Outcome.TIMEOUT, null, reason, sequence);
    }

    public boolean isConfirmed() {
        return outcome == Outcome.CONFIRMED;
    }
}
