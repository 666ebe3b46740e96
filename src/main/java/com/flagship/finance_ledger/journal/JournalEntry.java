package com.flagship.finance_ledger.journal;

import com.flagship.finance_ledger.tax.Money;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * A posted double-entry journal entry.
 *
 * Never updated after it is written. A correction is a second entry with every line swapped,
 * pointing back through {@code reversalOf}.
 */
@Value
@Builder(toBuilder = true)
public class JournalEntry {
    UUID entryId;
    String organizationId;
    LocalDate entryDate;
    String referenceNumber;
    String description;
    EntryType entryType;
    SourceDocumentType sourceDocumentType;
    String sourceDocumentId;
    String createdBy;
    UUID reversalOf;
    @Singular
    List<JournalLine> lines;
    Instant createdAt;

    public BigDecimal totalDebit() {
        return Money.sum(lines.stream().map(JournalLine::getDebit).toList());
    }

    public BigDecimal totalCredit() {
        return Money.sum(lines.stream().map(JournalLine::getCredit).toList());
    }
}
