package com.flagship.finance_ledger.journal.posting;

import com.flagship.finance_ledger.journal.EntryType;
import com.flagship.finance_ledger.journal.JournalLine;
import lombok.Value;

import java.util.List;

/**
 * Lines and header fields the posting rules derive from one event, before a reference number
 * and id are assigned.
 */
@Value
public class PostingDraft {
    EntryType entryType;
    String description;
    List<JournalLine> lines;
}
