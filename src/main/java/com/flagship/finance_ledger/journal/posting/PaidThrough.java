package com.flagship.finance_ledger.journal.posting;

import java.util.Locale;
import java.util.Set;

/**
 * Funding side of an expense.
 */
public enum PaidThrough {
    BANK,
    CASH,
    ACCOUNTS_PAYABLE;

    private static final Set<String> PAYABLE_ALIASES = Set.of("accounts payable", "accounts_payable", "payable", "credit");

    /**
     * Lenient parse of document values; unrecognized values settle through the bank.
     */
    public static PaidThrough fromString(String value) {
        if (value == null) {
            return BANK;
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        if ("cash".equals(normalized)) {
            return CASH;
        }
        if (PAYABLE_ALIASES.contains(normalized)) {
            return ACCOUNTS_PAYABLE;
        }
        return BANK;
    }
}
