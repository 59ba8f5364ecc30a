package com.flagship.finance_automation.transfer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable idempotency ledger for transfers.
 *
 * Every status change is a single conditional UPDATE (compare-and-set on the
 * current status), so the database serializes competing callers and the
 * application holds no locks. Statements run in their own auto-committed
 * transactions; a failed INSERT must not poison a surrounding transaction.
 *
 * This is the only component that changes the status of a transfer record.
 */
@Service
@Slf4j
public class TransferLedger {

    private static final int MAX_ERROR_LENGTH = 1000;
    private static final int MAX_REASON_LENGTH = 500;

    private static final String SELECT_COLUMNS =
            "SELECT idempotency_key, status, attempts, last_error, amount_minor_units, source, destination, " +
            "reason, external_transfer_id, created_at, updated_at, committed_at FROM transfer_records ";

    private static final RowMapper<TransferRecord> ROW_MAPPER = (rs, rowNum) -> new TransferRecord(
            rs.getString("idempotency_key"),
            TransferStatus.valueOf(rs.getString("status")),
            rs.getInt("attempts"),
            rs.getString("last_error"),
            rs.getLong("amount_minor_units"),
            TransferEndpoint.parse(rs.getString("source")),
            TransferEndpoint.parse(rs.getString("destination")),
            rs.getString("reason"),
            rs.getString("external_transfer_id"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at")),
            toInstant(rs.getTimestamp("committed_at"))
    );

    private final JdbcTemplate jdbcTemplate;
    private final CommittedKeyCache committedKeyCache;
    private final Clock clock;

    public TransferLedger(JdbcTemplate jdbcTemplate, CommittedKeyCache committedKeyCache, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.committedKeyCache = committedKeyCache;
        this.clock = clock;
    }

    /**
     * Claims the intent's key.
     *
     * A new key is inserted as RESERVED. A key whose record is FAILED or
     * ABANDONED is reset to RESERVED with a fresh attempt counter. Exactly one
     * concurrent caller succeeds.
     *
     * @return the RESERVED record
     * @throws DuplicateIntentException if the key is RESERVED or COMMITTED
     */
    public TransferRecord reserve(TransferIntent intent) {
        String key = intent.getIdempotencyKey();
        Timestamp now = now();
        try {
            jdbcTemplate.update(
                    "INSERT INTO transfer_records (idempotency_key, status, attempts, amount_minor_units, " +
                    "source, destination, reason, created_at, updated_at) VALUES (?, ?, 0, ?, ?, ?, ?, ?, ?)",
                    key,
                    TransferStatus.RESERVED.name(),
                    intent.getAmountMinorUnits(),
                    intent.getSource().toString(),
                    intent.getDestination().toString(),
                    truncate(intent.getReason(), MAX_REASON_LENGTH),
                    now,
                    now
            );
            log.debug("Reserved new transfer: key={}", key);
            return require(key);
        } catch (DuplicateKeyException e) {
            int updated = jdbcTemplate.update(
                    "UPDATE transfer_records SET status = ?, attempts = 0, last_error = NULL, " +
                    "amount_minor_units = ?, source = ?, destination = ?, reason = ?, " +
                    "external_transfer_id = NULL, committed_at = NULL, updated_at = ? " +
                    "WHERE idempotency_key = ? AND status IN (?, ?)",
                    TransferStatus.RESERVED.name(),
                    intent.getAmountMinorUnits(),
                    intent.getSource().toString(),
                    intent.getDestination().toString(),
                    truncate(intent.getReason(), MAX_REASON_LENGTH),
                    now,
                    key,
                    TransferStatus.FAILED.name(),
                    TransferStatus.ABANDONED.name()
            );
            TransferRecord existing = require(key);
            if (updated == 0) {
                throw new DuplicateIntentException(existing);
            }
            log.info("Re-reserved previously unsuccessful transfer: key={}", key);
            return existing;
        }
    }

    /**
     * RESERVED -> COMMITTED.
     *
     * @throws UnknownRecordException if no RESERVED record exists for the key
     */
    public TransferRecord commit(String key, String externalTransferId) {
        Timestamp now = now();
        int updated = jdbcTemplate.update(
                "UPDATE transfer_records SET status = ?, external_transfer_id = ?, committed_at = ?, updated_at = ? " +
                "WHERE idempotency_key = ? AND status = ?",
                TransferStatus.COMMITTED.name(), externalTransferId, now, now, key, TransferStatus.RESERVED.name());
        requireUpdated(updated, key, TransferStatus.RESERVED);
        committedKeyCache.markCommitted(key);
        return require(key);
    }

    /**
     * RESERVED -> FAILED.
     */
    public TransferRecord fail(String key, String error) {
        return finishReserved(key, TransferStatus.FAILED, error);
    }

    /**
     * RESERVED -> ABANDONED.
     */
    public TransferRecord abandon(String key, String error) {
        return finishReserved(key, TransferStatus.ABANDONED, error);
    }

    /**
     * Persists retry progress of a RESERVED record so it survives a crash.
     */
    public void recordAttempt(String key, int attempts, String error) {
        int updated = jdbcTemplate.update(
                "UPDATE transfer_records SET attempts = ?, last_error = ?, updated_at = ? " +
                "WHERE idempotency_key = ? AND status = ?",
                attempts, truncate(error, MAX_ERROR_LENGTH), now(), key, TransferStatus.RESERVED.name());
        requireUpdated(updated, key, TransferStatus.RESERVED);
    }

    /**
     * Manual reconciliation of an ABANDONED record once a human has checked the provider.
     *
     * @param outcome COMMITTED (the money moved) or FAILED (it did not)
     */
    public TransferRecord resolveAbandoned(String key, TransferStatus outcome, String resolutionNote) {
        if (outcome != TransferStatus.COMMITTED && outcome != TransferStatus.FAILED) {
            throw new IllegalArgumentException("Abandoned transfers resolve to COMMITTED or FAILED, not " + outcome);
        }
        Timestamp now = now();
        String note = truncate("Resolved manually: " + (resolutionNote == null ? "" : resolutionNote),
                MAX_ERROR_LENGTH);
        int updated;
        if (outcome == TransferStatus.COMMITTED) {
            updated = jdbcTemplate.update(
                    "UPDATE transfer_records SET status = ?, last_error = ?, committed_at = ?, updated_at = ? " +
                    "WHERE idempotency_key = ? AND status = ?",
                    outcome.name(), note, now, now, key, TransferStatus.ABANDONED.name());
        } else {
            updated = jdbcTemplate.update(
                    "UPDATE transfer_records SET status = ?, last_error = ?, committed_at = NULL, updated_at = ? " +
                    "WHERE idempotency_key = ? AND status = ?",
                    outcome.name(), note, now, key, TransferStatus.ABANDONED.name());
        }
        requireUpdated(updated, key, TransferStatus.ABANDONED);
        if (outcome == TransferStatus.COMMITTED) {
            committedKeyCache.markCommitted(key);
        }
        log.info("Abandoned transfer resolved: key={}, outcome={}", key, outcome);
        return require(key);
    }

    /**
     * Compare-and-set on {@code updated_at} so only one recovery pass re-drives a
     * stuck reservation.
     *
     * @return true if this caller now owns the reservation
     */
    public boolean claimStaleReservation(String key, Instant seenUpdatedAt) {
        int updated = jdbcTemplate.update(
                "UPDATE transfer_records SET updated_at = ? " +
                "WHERE idempotency_key = ? AND status = ? AND updated_at = ?",
                now(), key, TransferStatus.RESERVED.name(), Timestamp.from(seenUpdatedAt));
        return updated == 1;
    }

    public Optional<TransferRecord> find(String key) {
        List<TransferRecord> records = jdbcTemplate.query(
                SELECT_COLUMNS + "WHERE idempotency_key = ?", ROW_MAPPER, key);
        return records.stream().findFirst();
    }

    public List<TransferRecord> findByStatus(TransferStatus status) {
        return jdbcTemplate.query(
                SELECT_COLUMNS + "WHERE status = ? ORDER BY updated_at", ROW_MAPPER, status.name());
    }

    /**
     * Redis first, database on a miss or when Redis is unavailable.
     */
    public boolean isCommitted(String key) {
        if (committedKeyCache.isKnownCommitted(key)) {
            return true;
        }
        boolean committed = find(key).map(TransferRecord::isCommitted).orElse(false);
        if (committed) {
            committedKeyCache.markCommitted(key);
        }
        return committed;
    }

    /**
     * Latest COMMITTED transfer with the endpoint as source or destination.
     */
    public Optional<TransferRecord> findLatestCommittedInvolving(TransferEndpoint endpoint) {
        String text = endpoint.toString();
        List<TransferRecord> records = jdbcTemplate.query(
                SELECT_COLUMNS + "WHERE status = ? AND (destination = ? OR source = ?) " +
                "ORDER BY committed_at DESC LIMIT 1",
                ROW_MAPPER, TransferStatus.COMMITTED.name(), text, text);
        return records.stream().findFirst();
    }

    /**
     * Latest COMMITTED transfer whose key starts with the prefix.
     */
    public Optional<TransferRecord> findLatestCommittedWithKeyPrefix(String keyPrefix) {
        List<TransferRecord> records = jdbcTemplate.query(
                SELECT_COLUMNS + "WHERE status = ? AND LEFT(idempotency_key, ?) = ? " +
                "ORDER BY committed_at DESC LIMIT 1",
                ROW_MAPPER, TransferStatus.COMMITTED.name(), keyPrefix.length(), keyPrefix);
        return records.stream().findFirst();
    }

    public List<TransferRecord> findReservedOlderThan(Instant cutoff) {
        return jdbcTemplate.query(
                SELECT_COLUMNS + "WHERE status = ? AND updated_at < ? ORDER BY updated_at",
                ROW_MAPPER, TransferStatus.RESERVED.name(), Timestamp.from(cutoff));
    }

    public Map<TransferStatus, Long> countByStatus() {
        Map<TransferStatus, Long> counts = new EnumMap<>(TransferStatus.class);
        for (TransferStatus status : TransferStatus.values()) {
            counts.put(status, 0L);
        }
        jdbcTemplate.query("SELECT status, COUNT(*) AS total FROM transfer_records GROUP BY status",
                rs -> {
                    counts.put(TransferStatus.valueOf(rs.getString("status")), rs.getLong("total"));
                });
        return counts;
    }

    private TransferRecord finishReserved(String key, TransferStatus target, String error) {
        int updated = jdbcTemplate.update(
                "UPDATE transfer_records SET status = ?, last_error = ?, updated_at = ? " +
                "WHERE idempotency_key = ? AND status = ?",
                target.name(), truncate(error, MAX_ERROR_LENGTH), now(), key, TransferStatus.RESERVED.name());
        requireUpdated(updated, key, TransferStatus.RESERVED);
        return require(key);
    }

    private void requireUpdated(int updated, String key, TransferStatus required) {
        if (updated == 0) {
            TransferStatus actual = find(key)
                    .map(TransferRecord::getStatus)
                    .orElseThrow(() -> UnknownRecordException.notFound(key));
            throw UnknownRecordException.notInStatus(key, required, actual);
        }
    }

    private TransferRecord require(String key) {
        return find(key).orElseThrow(() -> UnknownRecordException.notFound(key));
    }

    private Timestamp now() {
        return Timestamp.from(clock.instant().truncatedTo(ChronoUnit.MICROS));
    }

    private static String truncate(String text, int maxLength) {
        if (text == null) {
            return null;
        }
        return text.length() > maxLength ? text.substring(0, maxLength) : text;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
