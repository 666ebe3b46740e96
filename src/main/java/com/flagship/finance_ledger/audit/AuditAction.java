package com.flagship.finance_ledger.audit;

/**
 * Audited operations. Stored by name.
 */
public enum AuditAction {
    LOCK_PERIOD,
    UNLOCK_PERIOD,
    EXTEND_UNLOCK,
    AUTO_RELOCK_PERIOD,
    POST_JOURNAL_ENTRY,
    REVERSE_JOURNAL_ENTRY
}
