package com.flagship.finance_ledger.journal;

import lombok.Value;

/**
 * Outcome of a posting. {@code ok=false} only for failures the caller's business operation
 * should survive; locked periods and invalid payloads are thrown instead.
 */
@Value
public class PostingResult {

    public static final String MESSAGE_POSTED = "Journal entry posted";
    public static final String MESSAGE_DUPLICATE = "Journal entry already exists";
    public static final String MESSAGE_FAILED = "Ledger posting failed";

    boolean ok;
    boolean duplicate;
    String message;
    JournalEntry entry;

    public static PostingResult posted(JournalEntry entry) {
        return new PostingResult(true, false, MESSAGE_POSTED, entry);
    }

    public static PostingResult duplicate(JournalEntry entry) {
        return new PostingResult(true, true, MESSAGE_DUPLICATE, entry);
    }

    public static PostingResult failed(String message) {
        return new PostingResult(false, false, message, null);
    }
}
