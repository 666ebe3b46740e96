package com.flagship.finance_ledger.journal;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Optional criteria for listing journal entries; null fields do not filter.
 */
@Value
@Builder
public class JournalEntryFilter {
    LocalDate from;
    LocalDate to;
    EntryType entryType;
    int page;
    int size;

    public int offset() {
        return page * size;
    }
}
