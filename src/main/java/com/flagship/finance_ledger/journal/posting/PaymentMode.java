package com.flagship.finance_ledger.journal.posting;

import java.util.Locale;

/**
 * How money moved. Anything other than cash settles through the bank account.
 */
public enum PaymentMode {
    CASH,
    BANK;

    public static PaymentMode fromString(String mode) {
        if (mode != null && "cash".equals(mode.strip().toLowerCase(Locale.ROOT))) {
            return CASH;
        }
        return BANK;
    }
}
