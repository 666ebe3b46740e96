package com.flagship.finance_ledger.tax;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * The single rounding primitive for currency values.
 *
 * Every amount the ledger stores or compares goes through {@link #round(BigDecimal)}:
 * half-up to two decimals. BigDecimal's default HALF_EVEN is never used for money.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    /** Scale used for intermediate divisions before the final rounding step. */
    static final int DIVISION_SCALE = 10;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Money() {
        // Utility class
    }

    public static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(SCALE, ROUNDING);
    }

    /**
     * Rounds to currency precision. A null amount is treated as zero.
     */
    public static BigDecimal round(BigDecimal amount) {
        if (amount == null) {
            return zero();
        }
        return amount.setScale(SCALE, ROUNDING);
    }

    public static BigDecimal of(String amount) {
        return round(new BigDecimal(amount));
    }

    /**
     * Rounds to the nearest multiple of {@code nearest} whole units (1 = nearest rupee).
     */
    public static BigDecimal roundToNearest(BigDecimal amount, int nearest) {
        if (nearest <= 1) {
            return round(amount.setScale(0, ROUNDING));
        }
        BigDecimal factor = BigDecimal.valueOf(nearest);
        return round(amount.divide(factor, 0, ROUNDING).multiply(factor));
    }

    /**
     * Returns {@code amount * percent / 100}, rounded.
     */
    public static BigDecimal percentOf(BigDecimal amount, BigDecimal percent) {
        return round(amount.multiply(percent).divide(HUNDRED, DIVISION_SCALE, ROUNDING));
    }

    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        return round(dividend.divide(divisor, DIVISION_SCALE, ROUNDING));
    }

    public static BigDecimal sum(Collection<BigDecimal> amounts) {
        return round(amounts.stream()
                .map(Money::round)
                .reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    public static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }

    public static boolean isNegative(BigDecimal amount) {
        return amount != null && amount.signum() < 0;
    }

    public static BigDecimal orZero(BigDecimal amount) {
        return amount == null ? zero() : round(amount);
    }
}
