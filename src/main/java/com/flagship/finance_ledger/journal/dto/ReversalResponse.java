package com.flagship.finance_ledger.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class ReversalResponse {

    @JsonProperty("message")
    String message;

    @JsonProperty("reversal_entry")
    JournalEntryResponse reversalEntry;
}
