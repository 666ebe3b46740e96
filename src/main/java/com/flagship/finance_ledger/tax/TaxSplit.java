package com.flagship.finance_ledger.tax;

import lombok.Value;

import java.math.BigDecimal;

/**
 * GST amounts for one taxable value.
 *
 * Intra-state supply carries CGST and SGST in equal halves; inter-state supply carries
 * IGST only.
 */
@Value
public class TaxSplit {
    BigDecimal cgst;
    BigDecimal sgst;
    BigDecimal igst;

    public static TaxSplit none() {
        return new TaxSplit(Money.zero(), Money.zero(), Money.zero());
    }

    public static TaxSplit intraState(BigDecimal cgst, BigDecimal sgst) {
        return new TaxSplit(Money.round(cgst), Money.round(sgst), Money.zero());
    }

    public static TaxSplit interState(BigDecimal igst) {
        return new TaxSplit(Money.zero(), Money.zero(), Money.round(igst));
    }

    /**
     * Splits an already computed tax total. Intra-state CGST is the rounded half and SGST the remainder.
     */
    public static TaxSplit ofTotal(BigDecimal taxTotal, boolean interState) {
        BigDecimal total = Money.round(taxTotal);
        if (interState) {
            return interState(total);
        }
        BigDecimal cgst = Money.divide(total, BigDecimal.valueOf(2));
        return intraState(cgst, total.subtract(cgst));
    }

    public BigDecimal total() {
        return Money.round(cgst.add(sgst).add(igst));
    }

    public boolean isInterState() {
        return igst.signum() > 0;
    }

    public TaxSplit plus(TaxSplit other) {
        return new TaxSplit(
            Money.round(cgst.add(other.cgst)),
            Money.round(sgst.add(other.sgst)),
            Money.round(igst.add(other.igst))
        );
    }
}
