package com.flagship.finance_ledger.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
public class JournalEntryPageResponse {

    @JsonProperty("entries")
    List<JournalEntryResponse> entries;

    @JsonProperty("page")
    int page;

    @JsonProperty("size")
    int size;
}
