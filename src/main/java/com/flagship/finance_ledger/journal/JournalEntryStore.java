package com.flagship.finance_ledger.journal;

import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only persistence for journal entries. There is no update or delete.
 */
public interface JournalEntryStore {

    Optional<JournalEntry> findById(String organizationId, UUID entryId);

    Optional<JournalEntry> findBySource(String organizationId, SourceDocumentType sourceType, String sourceId);

    /**
     * Entries ordered by date then reference number, newest first.
     */
    List<JournalEntry> list(String organizationId, JournalEntryFilter filter);

    /**
     * Writes the entry and its lines.
     *
     * @return false if an entry for the same (organization, source type, source id) already exists
     */
    boolean insert(JournalEntry entry);

    /**
     * Allocates the next reference number for an organization, entry type and month.
     */
    String nextReferenceNumber(String organizationId, EntryType entryType, YearMonth period);
}
