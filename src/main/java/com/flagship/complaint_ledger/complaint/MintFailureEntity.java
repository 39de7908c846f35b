package com.flagship.complaint_ledger.complaint;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * JPA entity for mint failure markers.
 *
 * Maps to ledger_mint_failures, which the engine owns. One row per complaint:
 * a newer failure replaces the previous one and bumps the attempt count.
 */
@Entity
@Table(name = "ledger_mint_failures")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class MintFailureEntity {

    @Id
    @Column(name = "complaint_id", nullable = false, updatable = false)
    private Long complaintId;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_kind", nullable = false, length = 32)
    private MintFailure.Kind kind;

    @Column(name = "reason", columnDefinition = "TEXT")
    private String reason;

    @Column(name = "receipt", length = 100)
    private String receipt;

    @Column(name = "retryable", nullable = false)
    private boolean retryable;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    public static MintFailureEntity fromDomain(MintFailure failure) {
        return new MintFailureEntity(
            failure.getComplaintId(),
            failure.getKind(),
            failure.getReason(),
            failure.getReceipt(),
            failure.isRetryable(),
            failure.getAttempts(),
            failure.getRecordedAt()
        );
    }

    public MintFailure toDomain() {
        return new MintFailure(
            this.complaintId,
            this.kind,
            this.reason,
            this.receipt,
            this.attempts,
            this.recordedAt
        );
    }
}
