package com.flagship.finance_ledger.exception;

/**
 * Malformed input: bad period, short reason, negative amount, unparseable date.
 */
public class ValidationException extends FinanceException {

    public static final String ERROR_CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(ERROR_CODE, message);
    }
}
