package com.flagship.finance_ledger.periodlock;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import java.util.Locale;

/**
 * Outcome for one period of a fiscal-year close.
 */
@Value
public class FiscalYearLockResult {

    public enum Outcome {
        LOCKED,
        SKIPPED,
        FAILED;

        @JsonValue
        public String wireValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    String period;
    Outcome status;
    String reason;

    static FiscalYearLockResult locked(String period, String reason) {
        return new FiscalYearLockResult(period, Outcome.LOCKED, reason);
    }

    static FiscalYearLockResult skipped(String period, String reason) {
        return new FiscalYearLockResult(period, Outcome.SKIPPED, reason);
    }

    static FiscalYearLockResult failed(String period, String reason) {
        return new FiscalYearLockResult(period, Outcome.FAILED, reason);
    }
}
