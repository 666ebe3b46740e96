package com.flagship.finance_ledger.journal.event;

import com.flagship.finance_ledger.journal.JournalEntry;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published for every new journal entry; a reversal also carries the id of the entry it undoes.
 */
@Value
public class JournalEntryEvent {
    UUID eventId;
    String eventType;
    String organizationId;
    UUID entryId;
    String referenceNumber;
    String entryType;
    LocalDate entryDate;
    String sourceDocumentType;
    String sourceDocumentId;
    UUID reversalOf;
    BigDecimal amount;
    String actorUserId;
    Instant occurredAt;

    public static JournalEntryEvent of(JournalEntryEventType type, JournalEntry entry, String actorUserId,
                                       Instant now) {
        return new JournalEntryEvent(
            UUID.randomUUID(),
            type.eventName(),
            entry.getOrganizationId(),
            entry.getEntryId(),
            entry.getReferenceNumber(),
            entry.getEntryType().name(),
            entry.getEntryDate(),
            entry.getSourceDocumentType().wireValue(),
            entry.getSourceDocumentId(),
            entry.getReversalOf(),
            entry.totalDebit(),
            actorUserId,
            now
        );
    }
}
