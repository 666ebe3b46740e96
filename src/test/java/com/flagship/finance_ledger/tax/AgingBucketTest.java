package com.flagship.finance_ledger.tax;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AgingBucketTest {

    private static final LocalDate DUE = LocalDate.of(2025, 6, 1);

    @Test
    @DisplayName("Bucket edges are inclusive of their upper bound")
    void bucketEdges() {
        assertEquals(AgingBucket.CURRENT, AgingBucket.of(DUE, DUE.minusDays(5)));
        assertEquals(AgingBucket.CURRENT, AgingBucket.of(DUE, DUE));
        assertEquals(AgingBucket.DAYS_1_30, AgingBucket.of(DUE, DUE.plusDays(1)));
        assertEquals(AgingBucket.DAYS_1_30, AgingBucket.of(DUE, DUE.plusDays(30)));
        assertEquals(AgingBucket.DAYS_31_60, AgingBucket.of(DUE, DUE.plusDays(31)));
        assertEquals(AgingBucket.DAYS_61_90, AgingBucket.of(DUE, DUE.plusDays(90)));
        assertEquals(AgingBucket.DAYS_90_PLUS, AgingBucket.of(DUE, DUE.plusDays(91)));
    }

    @Test
    @DisplayName("Summary counts open balances per bucket and ignores settled invoices")
    void summary() {
        LocalDate asOf = DUE.plusDays(45);
        List<OutstandingInvoice> invoices = List.of(
                open("1", DUE, "1000.00"),
                open("2", DUE, "250.50"),
                open("3", asOf.plusDays(10), "300.00"),
                open("4", DUE.minusDays(100), "0.00"));

        Map<AgingBucket, AgingBucket.Summary> summary = AgingBucket.summarize(invoices, asOf);

        assertEquals(5, summary.size());
        assertEquals(2, summary.get(AgingBucket.DAYS_31_60).count());
        assertEquals(new BigDecimal("1250.50"), summary.get(AgingBucket.DAYS_31_60).amount());
        assertEquals(1, summary.get(AgingBucket.CURRENT).count());
        assertEquals(0, summary.get(AgingBucket.DAYS_90_PLUS).count());
        assertEquals(new BigDecimal("0.00"), summary.get(AgingBucket.DAYS_90_PLUS).amount());
    }

    private static OutstandingInvoice open(String id, LocalDate dueDate, String balance) {
        return OutstandingInvoice.builder()
                .invoiceId(id)
                .dueDate(dueDate)
                .balanceDue(new BigDecimal(balance))
                .build();
    }
}
