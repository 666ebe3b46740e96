package com.flagship.finance_ledger.periodlock;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Lock record states. A period with no record is open.
 *
 * <pre>
 * no record -> LOCKED <-> UNLOCKED_AMENDMENT
 * </pre>
 */
public enum PeriodLockStatus {
    LOCKED("locked"),
    UNLOCKED_AMENDMENT("unlocked_amendment");

    private final String wireValue;

    PeriodLockStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public static PeriodLockStatus fromWire(String value) {
        return Arrays.stream(values())
                .filter(status -> status.wireValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown period lock status: " + value));
    }
}
