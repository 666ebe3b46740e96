package com.flagship.finance_ledger.journal;

import com.flagship.finance_ledger.tax.Money;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One side of a journal entry. Exactly one of {@code debit} and {@code credit} is positive.
 */
@Value
public class JournalLine {
    String accountCode;
    String accountName;
    BigDecimal debit;
    BigDecimal credit;
    String description;

    public static JournalLine debit(AccountRef account, BigDecimal amount, String description) {
        return new JournalLine(account.code(), account.name(), Money.round(amount), Money.zero(), description);
    }

    public static JournalLine credit(AccountRef account, BigDecimal amount, String description) {
        return new JournalLine(account.code(), account.name(), Money.zero(), Money.round(amount), description);
    }

    public static JournalLine of(String accountCode, String accountName, BigDecimal debit, BigDecimal credit,
                                 String description) {
        return new JournalLine(accountCode, accountName, Money.orZero(debit), Money.orZero(credit), description);
    }

    /**
     * Same account and amount on the opposite side.
     */
    public JournalLine swapped() {
        return new JournalLine(accountCode, accountName, credit, debit, description);
    }

    public boolean isZero() {
        return debit.signum() == 0 && credit.signum() == 0;
    }
}
