package com.flagship.finance_ledger.exception;

/**
 * The target is in the wrong state for the requested transition, or a concurrent caller
 * changed it first.
 */
public class ConflictException extends FinanceException {

    public ConflictException(String message) {
        super("CONFLICT", message);
    }
}
