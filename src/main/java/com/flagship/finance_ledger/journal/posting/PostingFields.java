package com.flagship.finance_ledger.journal.posting;

import com.flagship.finance_ledger.exception.ValidationException;
import com.flagship.finance_ledger.tax.Money;
import com.flagship.finance_ledger.tax.TaxSplit;

import java.math.BigDecimal;

/**
 * Payload checks shared by the posting records. Failures are caller errors.
 */
final class PostingFields {

    private PostingFields() {
        // Utility class
    }

    static String requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        return value;
    }

    static <T> T require(String field, T value) {
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        return value;
    }

    /**
     * Missing amounts count as zero; the result is rounded to paise.
     */
    static BigDecimal nonNegative(String field, BigDecimal value) {
        if (Money.isNegative(value)) {
            throw new ValidationException(field + " must not be negative: " + value);
        }
        return Money.orZero(value);
    }

    static BigDecimal positive(String field, BigDecimal value) {
        BigDecimal amount = nonNegative(field, value);
        if (amount.signum() == 0) {
            throw new ValidationException(field + " must be greater than zero");
        }
        return amount;
    }

    static TaxSplit taxes(TaxSplit taxes) {
        if (taxes == null) {
            return TaxSplit.none();
        }
        return new TaxSplit(
            nonNegative("CGST", taxes.getCgst()),
            nonNegative("SGST", taxes.getSgst()),
            nonNegative("IGST", taxes.getIgst()));
    }

    static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
