package com.flagship.finance_ledger.tax;

import java.math.BigDecimal;
import java.util.List;

/**
 * GST arithmetic for line items and document totals.
 *
 * Pure functions over {@link BigDecimal}; all results are rounded through {@link Money}.
 *
 * Order of operations for a line:
 * <ol>
 *   <li>amount = qty * rate</li>
 *   <li>discount (percentage of amount, or a fixed amount)</li>
 *   <li>taxable value: amount - discount, or back-computed when the rate is tax inclusive</li>
 *   <li>tax: intra-state applies half the rate to CGST and half to SGST, inter-state applies
 *       the full rate to IGST</li>
 * </ol>
 */
public final class TaxCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private TaxCalculator() {
        // Utility class
    }

    public static LineItemCalculation lineItem(BigDecimal quantity, BigDecimal rate, BigDecimal taxRate,
                                               BigDecimal discountPercent, boolean igst, boolean inclusive) {
        return lineItem(quantity, rate, taxRate, discountPercent, BigDecimal.ZERO, igst, inclusive);
    }

    /**
     * Prices one line.
     *
     * @param discountPercent percentage discount; takes precedence over {@code discountAmount}
     * @param discountAmount fixed discount, used only when no percentage is given
     * @param igst true for inter-state supply
     * @param inclusive true when {@code rate} already includes tax
     */
    public static LineItemCalculation lineItem(BigDecimal quantity, BigDecimal rate, BigDecimal taxRate,
                                               BigDecimal discountPercent, BigDecimal discountAmount,
                                               boolean igst, boolean inclusive) {
        requireNonNegative(quantity, "quantity");
        requireNonNegative(rate, "rate");
        requireNonNegative(taxRate, "taxRate");

        BigDecimal amount = Money.round(quantity.multiply(rate));

        BigDecimal discount;
        if (Money.isPositive(discountPercent)) {
            discount = Money.percentOf(amount, discountPercent);
        } else if (Money.isPositive(discountAmount)) {
            discount = Money.round(discountAmount);
        } else {
            discount = Money.zero();
        }
        if (discount.compareTo(amount) > 0) {
            throw new IllegalArgumentException(
                String.format("Discount %s exceeds line amount %s", discount, amount));
        }

        BigDecimal net = Money.round(amount.subtract(discount));
        BigDecimal taxable = inclusive
                ? Money.divide(net, BigDecimal.ONE.add(taxRate.divide(HUNDRED, Money.DIVISION_SCALE, Money.ROUNDING)))
                : net;

        TaxSplit split = taxOn(taxable, taxRate, igst);
        BigDecimal tax = split.total();

        return LineItemCalculation.builder()
                .amount(amount)
                .discountAmount(discount)
                .taxableAmount(taxable)
                .taxRate(taxRate)
                .taxAmount(tax)
                .cgstAmount(split.getCgst())
                .sgstAmount(split.getSgst())
                .igstAmount(split.getIgst())
                .itemTotal(Money.round(taxable.add(tax)))
                .build();
    }

    /**
     * Tax on a taxable value. Intra-state computes CGST and SGST each on half the rate, so the
     * two halves are always equal.
     */
    public static TaxSplit taxOn(BigDecimal taxable, BigDecimal taxRate, boolean igst) {
        if (taxRate == null || taxRate.signum() == 0) {
            return TaxSplit.none();
        }
        if (igst) {
            return TaxSplit.interState(Money.percentOf(taxable, taxRate));
        }
        BigDecimal half = Money.percentOf(taxable, taxRate.divide(TWO, Money.DIVISION_SCALE, Money.ROUNDING));
        return TaxSplit.intraState(half, half);
    }

    public static InvoiceTotals invoiceTotals(List<LineItemCalculation> lineItems, BigDecimal discount,
                                              BigDecimal shipping, BigDecimal adjustment) {
        return invoiceTotals(lineItems, Discount.amount(Money.orZero(discount)), shipping, adjustment,
                BigDecimal.ZERO, false);
    }

    /**
     * Document totals: {@code grand_total = subtotal - discount + tax + shipping + adjustment}.
     *
     * When {@code roundOff} is set the grand total is rounded to the nearest rupee and the
     * difference is folded into the adjustment.
     */
    public static InvoiceTotals invoiceTotals(List<LineItemCalculation> lineItems, Discount discount,
                                              BigDecimal shipping, BigDecimal adjustment,
                                              BigDecimal amountPaid, boolean roundOff) {
        BigDecimal subTotal = Money.zero();
        BigDecimal lineDiscounts = Money.zero();
        TaxSplit taxes = TaxSplit.none();
        for (LineItemCalculation item : lineItems) {
            subTotal = subTotal.add(item.getTaxableAmount());
            lineDiscounts = lineDiscounts.add(item.getDiscountAmount());
            taxes = taxes.plus(item.taxSplit());
        }

        BigDecimal invoiceDiscount = (discount == null ? Discount.none() : discount).applyTo(subTotal);
        BigDecimal taxableTotal = Money.round(subTotal.subtract(invoiceDiscount));
        BigDecimal taxTotal = taxes.total();
        BigDecimal ship = Money.orZero(shipping);
        BigDecimal adj = Money.orZero(adjustment);

        BigDecimal grandTotal = Money.round(taxableTotal.add(taxTotal).add(ship).add(adj));
        if (roundOff) {
            BigDecimal rounded = Money.roundToNearest(grandTotal, 1);
            adj = Money.round(adj.add(rounded.subtract(grandTotal)));
            grandTotal = rounded;
        }

        BigDecimal paid = Money.orZero(amountPaid);

        return InvoiceTotals.builder()
                .subTotal(Money.round(subTotal))
                .discountTotal(Money.round(lineDiscounts.add(invoiceDiscount)))
                .taxableTotal(taxableTotal)
                .taxTotal(taxTotal)
                .cgstTotal(taxes.getCgst())
                .sgstTotal(taxes.getSgst())
                .igstTotal(taxes.getIgst())
                .shippingCharge(ship)
                .adjustment(adj)
                .grandTotal(grandTotal)
                .amountPaid(paid)
                .balanceDue(Money.round(grandTotal.subtract(paid)))
                .build();
    }

    private static void requireNonNegative(BigDecimal value, String field) {
        if (value == null) {
            throw new IllegalArgumentException(field + " is required");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException(field + " cannot be negative: " + value);
        }
    }
}
