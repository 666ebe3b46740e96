package com.flagship.finance_ledger.journal;

import com.flagship.finance_ledger.exception.ValidationException;

/**
 * Account a journal line posts to, by code and display name. Either a {@link LedgerAccount}
 * or an organization-defined account supplied with the document.
 */
public record AccountRef(String code, String name) {

    public AccountRef {
        if (code == null || code.isBlank()) {
            throw new ValidationException("Account code is required");
        }
        if (name == null || name.isBlank()) {
            name = LedgerAccount.fromCode(code)
                    .map(LedgerAccount::getAccountName)
                    .orElseThrow(() -> new ValidationException("Account name is required for custom account " + code));
        }
    }
}
