package com.flagship.finance_ledger.outbox;

/**
 * Aggregates that publish through the outbox. The publisher routes each to its own topic.
 */
public enum OutboxAggregate {
    PERIOD_LOCK("PeriodLock"),
    JOURNAL_ENTRY("JournalEntry");

    private final String typeName;

    OutboxAggregate(String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }

    public static OutboxAggregate fromTypeName(String typeName) {
        for (OutboxAggregate aggregate : values()) {
            if (aggregate.typeName.equals(typeName)) {
                return aggregate;
            }
        }
        throw new IllegalArgumentException("Unknown outbox aggregate type: " + typeName);
    }
}
