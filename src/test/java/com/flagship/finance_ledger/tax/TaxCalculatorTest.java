package com.flagship.finance_ledger.tax;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaxCalculatorTest {

    private static BigDecimal bd(String value) {
        return new BigDecimal(value);
    }

    @Nested
    @DisplayName("Line items")
    class LineItems {

        @Test
        @DisplayName("Intra-state supply splits the rate equally between CGST and SGST")
        void intraStateSplitsEvenly() {
            LineItemCalculation line = TaxCalculator.lineItem(bd("2"), bd("500"), bd("18"), BigDecimal.ZERO,
                    false, false);

            assertEquals(bd("1000.00"), line.getAmount());
            assertEquals(bd("1000.00"), line.getTaxableAmount());
            assertEquals(bd("90.00"), line.getCgstAmount());
            assertEquals(bd("90.00"), line.getSgstAmount());
            assertEquals(bd("0.00"), line.getIgstAmount());
            assertEquals(bd("180.00"), line.getTaxAmount());
            assertEquals(bd("1180.00"), line.getItemTotal());
        }

        @Test
        @DisplayName("Inter-state supply puts the full rate on IGST")
        void interStateUsesIgst() {
            LineItemCalculation line = TaxCalculator.lineItem(bd("2"), bd("500"), bd("18"), BigDecimal.ZERO,
                    true, false);

            assertEquals(bd("180.00"), line.getIgstAmount());
            assertEquals(bd("0.00"), line.getCgstAmount());
            assertEquals(bd("0.00"), line.getSgstAmount());
            assertEquals(bd("1180.00"), line.getItemTotal());
        }

        @Test
        @DisplayName("Percentage discount reduces the taxable value before tax")
        void percentageDiscount() {
            LineItemCalculation line = TaxCalculator.lineItem(bd("1"), bd("1000"), bd("18"), bd("10"),
                    false, false);

            assertEquals(bd("100.00"), line.getDiscountAmount());
            assertEquals(bd("900.00"), line.getTaxableAmount());
            assertEquals(bd("162.00"), line.getTaxAmount());
            assertEquals(bd("1062.00"), line.getItemTotal());
        }

        @Test
        @DisplayName("Tax-inclusive rate is back-computed to the taxable value")
        void inclusiveRate() {
            LineItemCalculation line = TaxCalculator.lineItem(bd("1"), bd("1180"), bd("18"), BigDecimal.ZERO,
                    false, true);

            assertEquals(bd("1000.00"), line.getTaxableAmount());
            assertEquals(bd("90.00"), line.getCgstAmount());
            assertEquals(bd("90.00"), line.getSgstAmount());
            assertEquals(bd("1180.00"), line.getItemTotal());
        }

        @Test
        @DisplayName("Halves are rounded half-up, never half-even")
        void roundsHalfUp() {
            // 0.10 at 5% is 0.005 per half
            LineItemCalculation line = TaxCalculator.lineItem(bd("1"), bd("0.10"), bd("10"), BigDecimal.ZERO,
                    false, false);

            assertEquals(bd("0.01"), line.getCgstAmount());
            assertEquals(bd("0.01"), line.getSgstAmount());
            assertEquals(bd("0.02"), line.getTaxAmount());
            assertEquals(bd("0.12"), line.getItemTotal());
        }

        @Test
        @DisplayName("CGST and SGST stay equal when the full-rate tax has an odd paisa")
        void halvesStayEqual() {
            LineItemCalculation line = TaxCalculator.lineItem(bd("1"), bd("333.33"), bd("18"), BigDecimal.ZERO,
                    false, false);

            assertEquals(line.getCgstAmount(), line.getSgstAmount());
            assertEquals(bd("30.00"), line.getCgstAmount());
            assertEquals(bd("60.00"), line.getTaxAmount());
        }

        @Test
        @DisplayName("Zero tax rate yields no tax")
        void zeroRate() {
            LineItemCalculation line = TaxCalculator.lineItem(bd("3"), bd("99.99"), BigDecimal.ZERO,
                    BigDecimal.ZERO, false, false);

            assertEquals(bd("299.97"), line.getAmount());
            assertEquals(bd("0.00"), line.getTaxAmount());
            assertEquals(bd("299.97"), line.getItemTotal());
        }

        @Test
        @DisplayName("Discount larger than the line amount is rejected")
        void discountExceedsAmount() {
            assertThrows(IllegalArgumentException.class, () -> TaxCalculator.lineItem(bd("1"), bd("100"),
                    bd("18"), BigDecimal.ZERO, bd("200"), false, false));
        }

        @Test
        @DisplayName("Negative quantity is rejected")
        void negativeQuantity() {
            assertThrows(IllegalArgumentException.class, () -> TaxCalculator.lineItem(bd("-1"), bd("100"),
                    bd("18"), BigDecimal.ZERO, false, false));
        }
    }

    @Nested
    @DisplayName("Invoice totals")
    class Totals {

        private final List<LineItemCalculation> lines = List.of(
                TaxCalculator.lineItem(bd("2"), bd("500"), bd("18"), BigDecimal.ZERO, false, false),
                TaxCalculator.lineItem(bd("1"), bd("250"), bd("5"), BigDecimal.ZERO, false, false));

        @Test
        @DisplayName("Grand total is taxable + tax + shipping + adjustment")
        void grandTotal() {
            InvoiceTotals totals = TaxCalculator.invoiceTotals(lines, BigDecimal.ZERO, bd("50"), BigDecimal.ZERO);

            assertEquals(bd("1250.00"), totals.getSubTotal());
            assertEquals(bd("1250.00"), totals.getTaxableTotal());
            assertEquals(bd("96.25"), totals.getCgstTotal());
            assertEquals(bd("96.25"), totals.getSgstTotal());
            assertEquals(bd("192.50"), totals.getTaxTotal());
            assertEquals(bd("1492.50"), totals.getGrandTotal());
            assertEquals(bd("1492.50"), totals.getBalanceDue());
        }

        @Test
        @DisplayName("Round-off moves the grand total to the nearest rupee through the adjustment")
        void roundOff() {
            InvoiceTotals totals = TaxCalculator.invoiceTotals(lines, Discount.none(), bd("50"), BigDecimal.ZERO,
                    bd("500"), true);

            assertEquals(bd("1493.00"), totals.getGrandTotal());
            assertEquals(bd("0.50"), totals.getAdjustment());
            assertEquals(bd("993.00"), totals.getBalanceDue());
        }

        @Test
        @DisplayName("Invoice-level discount lowers the taxable total")
        void invoiceDiscount() {
            InvoiceTotals totals = TaxCalculator.invoiceTotals(lines, Discount.percentage(bd("10")),
                    BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, false);

            assertEquals(bd("125.00"), totals.getDiscountTotal());
            assertEquals(bd("1125.00"), totals.getTaxableTotal());
        }
    }

    @Test
    @DisplayName("A precomputed tax total splits with the rounded half on CGST")
    void splitsPrecomputedTotal() {
        TaxSplit split = TaxSplit.ofTotal(bd("180.01"), false);

        assertEquals(bd("90.01"), split.getCgst());
        assertEquals(bd("90.00"), split.getSgst());
        assertEquals(bd("180.01"), split.total());
        assertFalse(split.isInterState());

        assertTrue(TaxSplit.ofTotal(bd("180.01"), true).isInterState());
    }

    @Test
    @DisplayName("Money rounding is half-up at two decimals")
    void moneyRounding() {
        assertEquals(bd("2.35"), Money.round(bd("2.345")));
        assertEquals(bd("2.34"), Money.round(bd("2.3449")));
        assertEquals(bd("0.00"), Money.round(null));
        assertEquals(bd("1500.00"), Money.roundToNearest(bd("1497.50"), 10));
    }
}
