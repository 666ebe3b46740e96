package com.flagship.finance_ledger.exception;

/**
 * The journal entry could not be persisted.
 */
public class PostingFailedException extends FinanceException {

    public PostingFailedException(String message, Throwable cause) {
        super("POSTING_FAILED", message, cause);
    }
}
