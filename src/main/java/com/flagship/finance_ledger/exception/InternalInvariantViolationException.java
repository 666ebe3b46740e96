package com.flagship.finance_ledger.exception;

/**
 * A ledger invariant failed inside the engine, e.g. an entry whose debits and credits differ.
 *
 * Always a bug. The message is for logs only and is never returned to an end user.
 */
public class InternalInvariantViolationException extends FinanceException {

    public InternalInvariantViolationException(String message) {
        super("INTERNAL_INVARIANT_VIOLATION", message);
    }
}
