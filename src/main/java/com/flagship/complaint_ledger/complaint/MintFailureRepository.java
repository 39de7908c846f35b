package com.flagship.complaint_ledger.complaint;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for mint failure markers.
 */
@Repository
public interface MintFailureRepository extends JpaRepository<MintFailureEntity, Long> {

    /**
     * Failures an operator has to look at: rejections and lost receipts.
     */
    @Query("""
        SELECT f FROM MintFailureEntity f
        WHERE f.retryable = false
        ORDER BY f.recordedAt DESC
        """)
    List<MintFailureEntity> findNeedingAttention();

    long countByKind(MintFailure.Kind kind);
}
