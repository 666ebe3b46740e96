package com.flagship.finance_ledger.journal;

import java.time.YearMonth;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Map-backed store with the source-document uniqueness of the JDBC store.
 */
class InMemoryJournalEntryStore implements JournalEntryStore {

    private final Map<UUID, JournalEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, UUID> bySource = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();

    @Override
    public Optional<JournalEntry> findById(String organizationId, UUID entryId) {
        return Optional.ofNullable(entries.get(entryId))
                .filter(e -> e.getOrganizationId().equals(organizationId));
    }

    @Override
    public Optional<JournalEntry> findBySource(String organizationId, SourceDocumentType sourceType, String sourceId) {
        return Optional.ofNullable(bySource.get(sourceKey(organizationId, sourceType, sourceId)))
                .map(entries::get);
    }

    @Override
    public List<JournalEntry> list(String organizationId, JournalEntryFilter filter) {
        return entries.values().stream()
                .filter(e -> e.getOrganizationId().equals(organizationId))
                .filter(e -> filter.getFrom() == null || !e.getEntryDate().isBefore(filter.getFrom()))
                .filter(e -> filter.getTo() == null || !e.getEntryDate().isAfter(filter.getTo()))
                .filter(e -> filter.getEntryType() == null || e.getEntryType() == filter.getEntryType())
                .sorted(Comparator.comparing(JournalEntry::getEntryDate)
                        .thenComparing(JournalEntry::getReferenceNumber)
                        .reversed())
                .skip(filter.offset())
                .limit(filter.getSize())
                .toList();
    }

    @Override
    public boolean insert(JournalEntry entry) {
        String key = sourceKey(entry.getOrganizationId(), entry.getSourceDocumentType(), entry.getSourceDocumentId());
        if (bySource.putIfAbsent(key, entry.getEntryId()) != null) {
            return false;
        }
        entries.put(entry.getEntryId(), entry);
        return true;
    }

    @Override
    public String nextReferenceNumber(String organizationId, EntryType entryType, YearMonth period) {
        long next = sequences.computeIfAbsent(organizationId + "|" + entryType + "|" + period, k -> new AtomicLong())
                .incrementAndGet();
        return entryType.referenceNumber(period, next);
    }

    int size() {
        return entries.size();
    }

    private static String sourceKey(String organizationId, SourceDocumentType sourceType, String sourceId) {
        return organizationId + "|" + sourceType + "|" + sourceId;
    }
}
