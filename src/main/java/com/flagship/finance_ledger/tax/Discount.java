package com.flagship.finance_ledger.tax;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Invoice-level discount, either a percentage of the subtotal or a fixed amount.
 */
@Value
public class Discount {

    public enum Type {
        PERCENTAGE,
        AMOUNT
    }

    Type type;
    BigDecimal value;

    public static Discount none() {
        return new Discount(Type.AMOUNT, BigDecimal.ZERO);
    }

    public static Discount percentage(BigDecimal percent) {
        return new Discount(Type.PERCENTAGE, percent);
    }

    public static Discount amount(BigDecimal amount) {
        return new Discount(Type.AMOUNT, amount);
    }

    BigDecimal applyTo(BigDecimal subTotal) {
        if (value == null || value.signum() <= 0) {
            return Money.zero();
        }
        return type == Type.PERCENTAGE ? Money.percentOf(subTotal, value) : Money.round(value);
    }
}
