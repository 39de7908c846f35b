package com.flagship.complaint_ledger.complaint;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Record store backed by the complaints table in PostgreSQL.
 *
 * The complaints table belongs to the reporting application, so it is read
 * and updated with plain JDBC against the columns the engine needs. Failure
 * markers live in the engine's own table and go through JPA.
 *
 * The receipt is written with a "tx_hash IS NULL" guard: a receipt, once
 * stored, is never overwritten.
 */
@Service
@Slf4j
public class JdbcComplaintRecordStore implements ComplaintRecordStore {

    private static final String SELECT_COLUMNS =
        "SELECT c.id, c.status, c.municipal_id, c.\"locationAB\", c.category_id, c.tx_hash FROM complaints c ";

    private final JdbcTemplate jdbcTemplate;
    private final MintFailureRepository failureRepository;

    public JdbcComplaintRecordStore(JdbcTemplate jdbcTemplate, MintFailureRepository failureRepository) {
        this.jdbcTemplate = jdbcTemplate;
        this.failureRepository = failureRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ComplaintRecord> findUnminted() {
        return jdbcTemplate.query(
            SELECT_COLUMNS +
            "LEFT JOIN ledger_mint_failures f ON f.complaint_id = c.id " +
            "WHERE c.tx_hash IS NULL AND (f.complaint_id IS NULL OR f.retryable = TRUE) " +
            "ORDER BY c.id ASC",
            complaintRowMapper()
        );
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ComplaintRecord> findById(long complaintId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE c.id = ?",
            complaintRowMapper(),
            complaintId
        ).stream().findFirst();
    }

    @Override
    public boolean writeReceipt(long complaintId, String receipt) {
        int updated = jdbcTemplate.update(
            "UPDATE complaints SET tx_hash = ? WHERE id = ? AND tx_hash IS NULL",
            receipt,
            complaintId
        );
        if (updated == 0) {
            log.warn("Receipt not stored for complaint {}: row missing or receipt already set", complaintId);
        }
        return updated > 0;
    }

    @Override
    @Transactional
    public void recordMintFailure(MintFailure failure) {
        int attempts = failureRepository.findById(failure.getComplaintId())
            .map(existing -> existing.getAttempts() + 1)
            .orElse(1);

        MintFailureEntity entity = MintFailureEntity.fromDomain(failure);
        entity.setAttempts(attempts);
        failureRepository.save(entity);
    }

    @Override
    @Transactional
    public void clearMintFailure(long complaintId) {
        if (failureRepository.existsById(complaintId)) {
            failureRepository.deleteById(complaintId);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public MintState mintState(long complaintId) {
        Optional<ComplaintRecord> record = findById(complaintId);
        if (record.isPresent() && record.get().hasReceipt()) {
            return MintState.minted(complaintId, record.get().getLedgerReceipt());
        }
        return failureRepository.findById(complaintId)
            .map(entity -> MintState.failed(complaintId, entity.toDomain()))
            .orElseGet(() -> MintState.unminted(complaintId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<MintFailure> findFailuresNeedingAttention() {
        return failureRepository.findNeedingAttention().stream()
            .map(MintFailureEntity::toDomain)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long countUnminted() {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM complaints c " +
            "LEFT JOIN ledger_mint_failures f ON f.complaint_id = c.id " +
            "WHERE c.tx_hash IS NULL AND (f.complaint_id IS NULL OR f.retryable = TRUE)",
            Long.class
        );
        return count != null ? count : 0L;
    }

    private RowMapper<ComplaintRecord> complaintRowMapper() {
        return (rs, rowNum) -> ComplaintRecord.builder()
            .id(rs.getLong("id"))
            .status(rs.getString("status"))
            .city(rs.getString("municipal_id"))
            .locationAddress(rs.getString("locationAB"))
            .category(rs.getString("category_id"))
            .ledgerReceipt(rs.getString("tx_hash"))
            .build();
    }
}
