package com.flagship.finance_ledger.journal;

import java.time.YearMonth;
import java.util.Locale;

/**
 * Journal entry classification; the prefix appears in reference numbers (JE-SLS-202506-00001).
 */
public enum EntryType {
    SALES("SLS"),
    PURCHASE("PUR"),
    PAYMENT("PAY"),
    RECEIPT("RCP"),
    EXPENSE("EXP"),
    JOURNAL("JNL"),
    PAYROLL("PRL"),
    DEPRECIATION("DEP"),
    OPENING("OPN"),
    ADJUSTMENT("ADJ");

    private final String referencePrefix;

    EntryType(String referencePrefix) {
        this.referencePrefix = referencePrefix;
    }

    public String getReferencePrefix() {
        return referencePrefix;
    }

    /**
     * JE-{prefix}-{yyyyMM}-{5-digit sequence}.
     */
    public String referenceNumber(YearMonth period, long sequence) {
        return String.format("JE-%s-%04d%02d-%05d", referencePrefix, period.getYear(), period.getMonthValue(), sequence);
    }

    public static EntryType fromString(String value) {
        return valueOf(value.strip().toUpperCase(Locale.ROOT));
    }
}
