package com.flagship.finance_ledger.tax;

import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Receivable aging buckets by days overdue.
 *
 * Each bucket includes its upper edge: 30 days overdue is {@code 1-30}, 31 is {@code 31-60}.
 */
public enum AgingBucket {
    CURRENT("current", Long.MIN_VALUE, 0),
    DAYS_1_30("1-30", 1, 30),
    DAYS_31_60("31-60", 31, 60),
    DAYS_61_90("61-90", 61, 90),
    DAYS_90_PLUS("90+", 91, Long.MAX_VALUE);

    private final String label;
    private final long minDaysOverdue;
    private final long maxDaysOverdue;

    AgingBucket(String label, long minDaysOverdue, long maxDaysOverdue) {
        this.label = label;
        this.minDaysOverdue = minDaysOverdue;
        this.maxDaysOverdue = maxDaysOverdue;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static AgingBucket of(LocalDate dueDate, LocalDate asOf) {
        if (dueDate == null || asOf == null) {
            throw new IllegalArgumentException("dueDate and asOf are required");
        }
        long daysOverdue = ChronoUnit.DAYS.between(dueDate, asOf);
        for (AgingBucket bucket : values()) {
            if (daysOverdue >= bucket.minDaysOverdue && daysOverdue <= bucket.maxDaysOverdue) {
                return bucket;
            }
        }
        throw new IllegalStateException("No aging bucket for " + daysOverdue + " days overdue");
    }

    /**
     * Count and outstanding amount per bucket. Invoices without a positive balance are ignored;
     * every bucket is present in the result, in bucket order.
     */
    public static Map<AgingBucket, Summary> summarize(Collection<OutstandingInvoice> invoices, LocalDate asOf) {
        Map<AgingBucket, Summary> summary = new EnumMap<>(AgingBucket.class);
        for (AgingBucket bucket : values()) {
            summary.put(bucket, new Summary(0, Money.zero()));
        }
        for (OutstandingInvoice invoice : invoices) {
            if (!Money.isPositive(invoice.getBalanceDue()) || invoice.getDueDate() == null) {
                continue;
            }
            AgingBucket bucket = of(invoice.getDueDate(), asOf);
            summary.put(bucket, summary.get(bucket).add(invoice.getBalanceDue()));
        }
        return summary;
    }

    public record Summary(int count, BigDecimal amount) {
        Summary add(BigDecimal balance) {
            return new Summary(count + 1, Money.round(amount.add(balance)));
        }
    }
}
