package com.flagship.finance_ledger.exception;

import java.time.Instant;

/**
 * A financial write targets a closed accounting period.
 *
 * Distinct from {@link ConflictException}: the caller can act on it by unlocking the period
 * or choosing a date in an open one, so the lock details travel with the exception.
 */
public class PeriodLockedException extends FinanceException {

    public static final String ERROR_CODE = "PERIOD_LOCKED";

    private final String period;
    private final String lockedBy;
    private final Instant lockedAt;

    public PeriodLockedException(String period, String lockedBy, Instant lockedAt) {
        super(ERROR_CODE, String.format(
                "Period %s is locked for this organization. Unlock the period or use a date in an open period.",
                period));
        this.period = period;
        this.lockedBy = lockedBy;
        this.lockedAt = lockedAt;
    }

    public String getPeriod() {
        return period;
    }

    public String getLockedBy() {
        return lockedBy;
    }

    public Instant getLockedAt() {
        return lockedAt;
    }
}
