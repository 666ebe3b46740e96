package com.flagship.finance_ledger.periodlock;

/**
 * What a period lock check does when the organization or effective date is absent.
 */
public enum MissingContextPolicy {
    /** Missing context is a validation error. The default for every caller. */
    REJECT,
    /**
     * Skip the check, logging a warning and counting the bypass. Only for system-triggered
     * postings that legitimately carry no document date.
     */
    SKIP_AND_LOG
}
