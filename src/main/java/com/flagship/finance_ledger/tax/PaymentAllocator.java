package com.flagship.finance_ledger.tax;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Spreads a received payment across open invoices.
 *
 * One allocation is returned per invoice, including zero allocations, so callers can line
 * results up with their input. The sum of allocations never exceeds the payment amount and
 * no invoice receives more than its balance.
 */
public final class PaymentAllocator {

    public enum Strategy {
        /** Oldest invoice date first, filling each balance before moving on. */
        OLDEST_FIRST,
        /** Each invoice receives its share of the total outstanding balance. */
        PROPORTIONAL
    }

    @Value
    public static class Allocation {
        String invoiceId;
        String invoiceNumber;
        BigDecimal allocatedAmount;
        BigDecimal balanceBefore;
        BigDecimal balanceAfter;

        static Allocation of(OutstandingInvoice invoice, BigDecimal balance, BigDecimal allocated) {
            return new Allocation(invoice.getInvoiceId(), invoice.getInvoiceNumber(),
                    allocated, balance, Money.round(balance.subtract(allocated)));
        }
    }

    private PaymentAllocator() {
        // Utility class
    }

    public static List<Allocation> allocate(BigDecimal amount, List<OutstandingInvoice> invoices, Strategy strategy) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Payment amount must be zero or positive");
        }
        BigDecimal payment = Money.round(amount);
        return switch (strategy) {
            case OLDEST_FIRST -> oldestFirst(payment, invoices);
            case PROPORTIONAL -> proportional(payment, invoices);
        };
    }

    private static List<Allocation> oldestFirst(BigDecimal payment, List<OutstandingInvoice> invoices) {
        List<OutstandingInvoice> sorted = new ArrayList<>(invoices);
        sorted.sort(Comparator.comparing(OutstandingInvoice::getInvoiceDate,
                Comparator.nullsLast(Comparator.<LocalDate>naturalOrder())));

        List<Allocation> allocations = new ArrayList<>(sorted.size());
        BigDecimal remaining = payment;
        for (OutstandingInvoice invoice : sorted) {
            BigDecimal balance = positiveBalance(invoice);
            BigDecimal allocated = remaining.min(balance);
            allocations.add(Allocation.of(invoice, balance, allocated));
            remaining = Money.round(remaining.subtract(allocated));
        }
        return allocations;
    }

    private static List<Allocation> proportional(BigDecimal payment, List<OutstandingInvoice> invoices) {
        BigDecimal totalBalance = Money.sum(invoices.stream().map(PaymentAllocator::positiveBalance).toList());

        List<BigDecimal> balances = new ArrayList<>(invoices.size());
        List<BigDecimal> amounts = new ArrayList<>(invoices.size());
        for (OutstandingInvoice invoice : invoices) {
            BigDecimal balance = positiveBalance(invoice);
            BigDecimal share = totalBalance.signum() == 0
                    ? Money.zero()
                    : Money.divide(payment.multiply(balance), totalBalance).min(balance);
            balances.add(balance);
            amounts.add(share);
        }

        // Rounding can leave the total a few paise off target; the largest allocation absorbs it.
        BigDecimal target = payment.min(totalBalance);
        BigDecimal remainder = Money.round(target.subtract(Money.sum(amounts)));
        if (remainder.signum() != 0 && !amounts.isEmpty()) {
            int largest = 0;
            for (int i = 1; i < amounts.size(); i++) {
                if (amounts.get(i).compareTo(amounts.get(largest)) > 0) {
                    largest = i;
                }
            }
            BigDecimal adjusted = Money.round(amounts.get(largest).add(remainder));
            if (adjusted.signum() >= 0 && adjusted.compareTo(balances.get(largest)) <= 0) {
                amounts.set(largest, adjusted);
            }
        }

        List<Allocation> allocations = new ArrayList<>(invoices.size());
        for (int i = 0; i < invoices.size(); i++) {
            allocations.add(Allocation.of(invoices.get(i), balances.get(i), amounts.get(i)));
        }
        return allocations;
    }

    private static BigDecimal positiveBalance(OutstandingInvoice invoice) {
        BigDecimal balance = Money.orZero(invoice.getBalanceDue());
        return balance.signum() > 0 ? balance : Money.zero();
    }
}
