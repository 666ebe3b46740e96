package com.flagship.finance_ledger.exception;

/**
 * Root of the ledger's error taxonomy.
 *
 * Each subclass carries a stable error code that the web layer returns verbatim, so callers
 * can branch on it without parsing messages.
 */
public abstract class FinanceException extends RuntimeException {

    private final String errorCode;

    protected FinanceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected FinanceException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
