package com.flagship.finance_ledger.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_ledger.journal.JournalEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class JournalEntryResponse {

    @JsonProperty("entry_id")
    UUID entryId;

    @JsonProperty("reference_number")
    String referenceNumber;

    @JsonProperty("entry_date")
    LocalDate entryDate;

    @JsonProperty("entry_type")
    String entryType;

    @JsonProperty("description")
    String description;

    @JsonProperty("source_document_type")
    String sourceDocumentType;

    @JsonProperty("source_document_id")
    String sourceDocumentId;

    @JsonProperty("reversal_of")
    UUID reversalOf;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("total_debit")
    BigDecimal totalDebit;

    @JsonProperty("total_credit")
    BigDecimal totalCredit;

    @JsonProperty("lines")
    List<JournalLineResponse> lines;

    public static JournalEntryResponse from(JournalEntry entry) {
        return JournalEntryResponse.builder()
            .entryId(entry.getEntryId())
            .referenceNumber(entry.getReferenceNumber())
            .entryDate(entry.getEntryDate())
            .entryType(entry.getEntryType().name())
            .description(entry.getDescription())
            .sourceDocumentType(entry.getSourceDocumentType().wireValue())
            .sourceDocumentId(entry.getSourceDocumentId())
            .reversalOf(entry.getReversalOf())
            .createdBy(entry.getCreatedBy())
            .createdAt(entry.getCreatedAt())
            .totalDebit(entry.totalDebit())
            .totalCredit(entry.totalCredit())
            .lines(entry.getLines().stream().map(JournalLineResponse::from).toList())
            .build();
    }
}
