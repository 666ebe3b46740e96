package com.flagship.finance_ledger.journal;

import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Journal store on journal_entries and journal_lines.
 *
 * JDBC for the same reason as the period lock store: the idempotent insert is a single
 * {@code INSERT ... ON CONFLICT DO NOTHING} whose row count decides the race. A unique
 * violation would abort the surrounding PostgreSQL transaction and make it impossible to read
 * the winning row afterwards.
 *
 * The database backs the application checks: a deferred constraint trigger rejects an
 * unbalanced entry at commit, and UPDATE or DELETE on either table is refused.
 */
@Repository
public class JdbcJournalEntryStore implements JournalEntryStore {

    private static final String ENTRY_COLUMNS =
        "entry_id, organization_id, entry_date, reference_number, description, entry_type, " +
        "source_document_type, source_document_id, created_by, reversal_of, created_at";

    private final JdbcTemplate jdbcTemplate;

    public JdbcJournalEntryStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<JournalEntry> findById(String organizationId, UUID entryId) {
        return queryOne(
            "SELECT " + ENTRY_COLUMNS + " FROM journal_entries WHERE organization_id = ? AND entry_id = ?",
            organizationId, entryId);
    }

    @Override
    public Optional<JournalEntry> findBySource(String organizationId, SourceDocumentType sourceType, String sourceId) {
        return queryOne(
            "SELECT " + ENTRY_COLUMNS + " FROM journal_entries " +
            "WHERE organization_id = ? AND source_document_type = ? AND source_document_id = ?",
            organizationId, sourceType.wireValue(), sourceId);
    }

    @Override
    public List<JournalEntry> list(String organizationId, JournalEntryFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT " + ENTRY_COLUMNS + " FROM journal_entries WHERE organization_id = ?");
        List<Object> args = new ArrayList<>();
        args.add(organizationId);

        if (filter.getFrom() != null) {
            sql.append(" AND entry_date >= ?");
            args.add(Date.valueOf(filter.getFrom()));
        }
        if (filter.getTo() != null) {
            sql.append(" AND entry_date <= ?");
            args.add(Date.valueOf(filter.getTo()));
        }
        if (filter.getEntryType() != null) {
            sql.append(" AND entry_type = ?");
            args.add(filter.getEntryType().name());
        }
        sql.append(" ORDER BY entry_date DESC, reference_number DESC LIMIT ? OFFSET ?");
        args.add(filter.getSize());
        args.add(filter.offset());

        return jdbcTemplate.query(sql.toString(), headerMapper(), args.toArray())
            .stream()
            .map(this::withLines)
            .toList();
    }

    @Override
    public boolean insert(JournalEntry entry) {
        int inserted = jdbcTemplate.update(
            "INSERT INTO journal_entries (" + ENTRY_COLUMNS + ") " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT (organization_id, source_document_type, source_document_id) DO NOTHING",
            entry.getEntryId(),
            entry.getOrganizationId(),
            Date.valueOf(entry.getEntryDate()),
            entry.getReferenceNumber(),
            entry.getDescription(),
            entry.getEntryType().name(),
            entry.getSourceDocumentType().wireValue(),
            entry.getSourceDocumentId(),
            entry.getCreatedBy(),
            entry.getReversalOf(),
            Timestamp.from(entry.getCreatedAt())
        );
        if (inserted == 0) {
            return false;
        }

        List<JournalLine> lines = entry.getLines();
        jdbcTemplate.batchUpdate(
            "INSERT INTO journal_lines (line_id, entry_id, line_number, account_code, account_name, " +
            "debit, credit, description) VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
            new BatchPreparedStatementSetter() {
                @Override
                public void setValues(PreparedStatement ps, int i) throws SQLException {
                    JournalLine line = lines.get(i);
                    ps.setObject(1, UUID.randomUUID());
                    ps.setObject(2, entry.getEntryId());
                    ps.setInt(3, i + 1);
                    ps.setString(4, line.getAccountCode());
                    ps.setString(5, line.getAccountName());
                    ps.setBigDecimal(6, line.getDebit());
                    ps.setBigDecimal(7, line.getCredit());
                    ps.setString(8, line.getDescription());
                }

                @Override
                public int getBatchSize() {
                    return lines.size();
                }
            }
        );
        return true;
    }

    @Override
    public String nextReferenceNumber(String organizationId, EntryType entryType, YearMonth period) {
        Long sequence = jdbcTemplate.queryForObject(
            "INSERT INTO journal_reference_sequences (organization_id, prefix, period, last_value) " +
            "VALUES (?, ?, ?, 1) " +
            "ON CONFLICT (organization_id, prefix, period) " +
            "DO UPDATE SET last_value = journal_reference_sequences.last_value + 1 " +
            "RETURNING last_value",
            Long.class,
            organizationId,
            entryType.getReferencePrefix(),
            period.toString()
        );
        return entryType.referenceNumber(period, sequence == null ? 1 : sequence);
    }

    private Optional<JournalEntry> queryOne(String sql, Object... args) {
        return jdbcTemplate.query(sql, headerMapper(), args)
            .stream()
            .findFirst()
            .map(this::withLines);
    }

    private JournalEntry withLines(JournalEntry header) {
        List<JournalLine> lines = jdbcTemplate.query(
            "SELECT account_code, account_name, debit, credit, description FROM journal_lines " +
            "WHERE entry_id = ? ORDER BY line_number",
            (rs, rowNum) -> JournalLine.of(
                rs.getString("account_code"),
                rs.getString("account_name"),
                rs.getBigDecimal("debit"),
                rs.getBigDecimal("credit"),
                rs.getString("description")),
            header.getEntryId()
        );
        return header.toBuilder().lines(lines).build();
    }

    private RowMapper<JournalEntry> headerMapper() {
        return (rs, rowNum) -> JournalEntry.builder()
            .entryId(rs.getObject("entry_id", UUID.class))
            .organizationId(rs.getString("organization_id"))
            .entryDate(rs.getDate("entry_date").toLocalDate())
            .referenceNumber(rs.getString("reference_number"))
            .description(rs.getString("description"))
            .entryType(EntryType.valueOf(rs.getString("entry_type")))
            .sourceDocumentType(SourceDocumentType.fromWire(rs.getString("source_document_type")))
            .sourceDocumentId(rs.getString("source_document_id"))
            .createdBy(rs.getString("created_by"))
            .reversalOf(rs.getObject("reversal_of", UUID.class))
            .createdAt(instant(rs, "created_at"))
            .build();
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp value = rs.getTimestamp(column);
        return value == null ? null : value.toInstant();
    }
}
