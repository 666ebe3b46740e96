package com.flagship.finance_ledger.periodlock;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Period lock store on the period_locks table.
 *
 * Plain JDBC rather than JPA so that each transition is exactly one conditional statement:
 * {@code INSERT ... ON CONFLICT DO NOTHING} for the first lock and
 * {@code UPDATE ... WHERE status = ? AND unlock_extension_count = ? AND version = ?} for the
 * rest. The affected-row count tells the caller whether it won.
 */
@Repository
public class JdbcPeriodLockStore implements PeriodLockStore {

    private static final String COLUMNS =
        "lock_id, organization_id, period, status, locked_by, locked_at, lock_reason, " +
        "unlocked_by, unlocked_at, unlock_reason, unlock_expires_at, unlock_extension_count, " +
        "version, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;

    public JdbcPeriodLockStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<PeriodLock> find(String organizationId, YearMonth period) {
        List<PeriodLock> rows = jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM period_locks WHERE organization_id = ? AND period = ?",
            rowMapper(),
            organizationId,
            Periods.format(period)
        );
        return rows.stream().findFirst();
    }

    @Override
    public List<PeriodLock> findByOrganization(String organizationId, Integer year) {
        if (year == null) {
            return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM period_locks WHERE organization_id = ? ORDER BY period",
                rowMapper(),
                organizationId
            );
        }
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM period_locks WHERE organization_id = ? AND period LIKE ? ORDER BY period",
            rowMapper(),
            organizationId,
            String.format("%04d-%%", year)
        );
    }

    @Override
    public List<PeriodLock> findExpiredAmendments(Instant now) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM period_locks " +
            "WHERE status = ? AND unlock_expires_at <= ? ORDER BY unlock_expires_at",
            rowMapper(),
            PeriodLockStatus.UNLOCKED_AMENDMENT.wireValue(),
            Timestamp.from(now)
        );
    }

    @Override
    public long countExpiredAmendments(Instant now) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM period_locks WHERE status = ? AND unlock_expires_at <= ?",
            Long.class,
            PeriodLockStatus.UNLOCKED_AMENDMENT.wireValue(),
            Timestamp.from(now)
        );
        return count == null ? 0 : count;
    }

    @Override
    public boolean insert(PeriodLock lock) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO period_locks (" + COLUMNS + ") " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT (organization_id, period) DO NOTHING",
            lock.getLockId(),
            lock.getOrganizationId(),
            Periods.format(lock.getPeriod()),
            lock.getStatus().wireValue(),
            lock.getLockedBy(),
            timestamp(lock.getLockedAt()),
            lock.getLockReason(),
            lock.getUnlockedBy(),
            timestamp(lock.getUnlockedAt()),
            lock.getUnlockReason(),
            timestamp(lock.getUnlockExpiresAt()),
            lock.getUnlockExtensionCount(),
            lock.getVersion(),
            timestamp(lock.getCreatedAt()),
            timestamp(lock.getUpdatedAt())
        );
        return inserted == 1;
    }

    @Override
    public boolean compareAndSet(PeriodLock expected, PeriodLock replacement) {
        int updated = jdbcTemplate.update(
            "UPDATE period_locks SET status = ?, locked_by = ?, locked_at = ?, lock_reason = ?, " +
            "unlocked_by = ?, unlocked_at = ?, unlock_reason = ?, unlock_expires_at = ?, " +
            "unlock_extension_count = ?, version = ?, updated_at = ? " +
            "WHERE organization_id = ? AND period = ? " +
            "AND status = ? AND unlock_extension_count = ? AND version = ?",
            replacement.getStatus().wireValue(),
            replacement.getLockedBy(),
            timestamp(replacement.getLockedAt()),
            replacement.getLockReason(),
            replacement.getUnlockedBy(),
            timestamp(replacement.getUnlockedAt()),
            replacement.getUnlockReason(),
            timestamp(replacement.getUnlockExpiresAt()),
            replacement.getUnlockExtensionCount(),
            replacement.getVersion(),
            timestamp(replacement.getUpdatedAt()),
            expected.getOrganizationId(),
            Periods.format(expected.getPeriod()),
            expected.getStatus().wireValue(),
            expected.getUnlockExtensionCount(),
            expected.getVersion()
        );
        return updated == 1;
    }

    private RowMapper<PeriodLock> rowMapper() {
        return (rs, rowNum) -> PeriodLock.builder()
            .lockId(rs.getObject("lock_id", UUID.class))
            .organizationId(rs.getString("organization_id"))
            .period(YearMonth.parse(rs.getString("period")))
            .status(PeriodLockStatus.fromWire(rs.getString("status")))
            .lockedBy(rs.getString("locked_by"))
            .lockedAt(instant(rs, "locked_at"))
            .lockReason(rs.getString("lock_reason"))
            .unlockedBy(rs.getString("unlocked_by"))
            .unlockedAt(instant(rs, "unlocked_at"))
            .unlockReason(rs.getString("unlock_reason"))
            .unlockExpiresAt(instant(rs, "unlock_expires_at"))
            .unlockExtensionCount(rs.getInt("unlock_extension_count"))
            .version(rs.getLong("version"))
            .createdAt(instant(rs, "created_at"))
            .updatedAt(instant(rs, "updated_at"))
            .build();
    }

    private static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp value = rs.getTimestamp(column);
        return value == null ? null : value.toInstant();
    }
}
