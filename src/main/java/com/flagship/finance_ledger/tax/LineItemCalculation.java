package com.flagship.finance_ledger.tax;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of pricing one invoice or bill line.
 */
@Value
@Builder
public class LineItemCalculation {
    BigDecimal amount;
    BigDecimal discountAmount;
    BigDecimal taxableAmount;
    BigDecimal taxRate;
    BigDecimal taxAmount;
    BigDecimal cgstAmount;
    BigDecimal sgstAmount;
    BigDecimal igstAmount;
    BigDecimal itemTotal;

    public TaxSplit taxSplit() {
        return new TaxSplit(cgstAmount, sgstAmount, igstAmount);
    }
}
