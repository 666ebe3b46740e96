package com.flagship.finance_ledger.tax;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Document-level totals derived from priced line items.
 */
@Value
@Builder
public class InvoiceTotals {
    BigDecimal subTotal;
    BigDecimal discountTotal;
    BigDecimal taxableTotal;
    BigDecimal taxTotal;
    BigDecimal cgstTotal;
    BigDecimal sgstTotal;
    BigDecimal igstTotal;
    BigDecimal shippingCharge;
    BigDecimal adjustment;
    BigDecimal grandTotal;
    BigDecimal amountPaid;
    BigDecimal balanceDue;

    public TaxSplit taxSplit() {
        return new TaxSplit(cgstTotal, sgstTotal, igstTotal);
    }
}
