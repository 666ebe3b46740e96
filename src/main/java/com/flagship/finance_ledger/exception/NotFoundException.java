package com.flagship.finance_ledger.exception;

public class NotFoundException extends FinanceException {

    public NotFoundException(String message) {
        super("NOT_FOUND", message);
    }
}
