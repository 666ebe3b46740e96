package com.flagship.finance_ledger.periodlock.event;

public enum PeriodLockEventType {
    PERIOD_LOCKED("PeriodLocked"),
    PERIOD_UNLOCKED("PeriodUnlocked"),
    PERIOD_UNLOCK_EXTENDED("PeriodUnlockExtended"),
    PERIOD_AUTO_RELOCKED("PeriodAutoRelocked");

    private final String eventName;

    PeriodLockEventType(String eventName) {
        this.eventName = eventName;
    }

    public String eventName() {
        return eventName;
    }
}
