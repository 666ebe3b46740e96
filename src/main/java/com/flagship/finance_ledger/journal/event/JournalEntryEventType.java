package com.flagship.finance_ledger.journal.event;

public enum JournalEntryEventType {
    JOURNAL_ENTRY_POSTED("JournalEntryPosted"),
    JOURNAL_ENTRY_REVERSED("JournalEntryReversed");

    private final String eventName;

    JournalEntryEventType(String eventName) {
        this.eventName = eventName;
    }

    public String eventName() {
        return eventName;
    }
}
