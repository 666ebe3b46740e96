package com.flagship.finance_ledger.journal;

import com.flagship.finance_ledger.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LedgerAccountTest {

    @Test
    @DisplayName("Account type follows the leading digit of the code")
    void typeMatchesCodeRange() {
        for (LedgerAccount account : LedgerAccount.values()) {
            AccountType expected = switch (account.getCode().charAt(0)) {
                case '1' -> AccountType.ASSET;
                case '2' -> AccountType.LIABILITY;
                case '3' -> AccountType.EQUITY;
                case '4' -> AccountType.INCOME;
                default -> AccountType.EXPENSE;
            };
            assertEquals(expected, account.getType(), account.name());
        }
    }

    @Test
    @DisplayName("Lookup by code")
    void fromCode() {
        assertEquals(LedgerAccount.GST_PAYABLE_IGST, LedgerAccount.fromCode("2230").orElseThrow());
        assertTrue(LedgerAccount.fromCode("9999").isEmpty());
        assertTrue(LedgerAccount.fromCode(null).isEmpty());
    }

    @Test
    @DisplayName("Custom account needs a name, a system account code fills it in")
    void accountRefName() {
        assertEquals("Bank Account", new AccountRef("1200", null).name());
        assertEquals("Tyre Disposal", new AccountRef("6810", "Tyre Disposal").name());
        assertThrows(ValidationException.class, () -> new AccountRef("6810", " "));
    }
}
