package com.flagship.finance_ledger.exception;

public class ForbiddenException extends FinanceException {

    public ForbiddenException(String message) {
        super("FORBIDDEN", message);
    }
}
