package com.flagship.finance_ledger.journal;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Kind of business document a journal entry was posted from. Together with the document id it
 * identifies the posting uniquely within an organization.
 */
public enum SourceDocumentType {
    INVOICE,
    PAYMENT_RECEIVED,
    BILL,
    BILL_PAYMENT,
    EXPENSE,
    PAYROLL_RUN,
    REVERSAL;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SourceDocumentType fromWire(String value) {
        return Arrays.stream(values())
                .filter(t -> t.wireValue().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown source document type: " + value));
    }
}
