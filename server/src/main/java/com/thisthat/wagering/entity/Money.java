package com.thisthat.wagering.entity;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-precision credit amount.
 *
 * Credits are whole cents: every value is held at scale 2 with HALF_EVEN rounding.
 * Never use double/float for balances, stakes or payouts.
 *
 * Instances are immutable.
 */
public final class Money implements Comparable<Money> {

    /**
     * Fixed scale for all credit values.
     */
    public static final int SCALE = 2;

    /**
     * Rounding mode for all operations: HALF_EVEN (banker's rounding).
     */
    public static final RoundingMode ROUNDING_MODE = RoundingMode.HALF_EVEN;

    /**
     * Scale used for intermediate ratios (odds quotients) before rounding back to credits.
     */
    private static final int RATIO_SCALE = 10;

    public static final Money ZERO = new Money(BigDecimal.ZERO);

    private final BigDecimal amount;

    private Money(BigDecimal amount) {
        this.amount = amount.setScale(SCALE, ROUNDING_MODE);
    }

    public static Money of(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Credit amount is required");
        }
        return new Money(amount);
    }

    /** Whole credits. */
    public static Money of(long amount) {
        return new Money(BigDecimal.valueOf(amount));
    }

    /**
     * Parse a decimal string such as "12.50".
     */
    public static Money of(String amount) {
        if (amount == null || amount.isBlank()) {
            throw new IllegalArgumentException("Credit amount is required");
        }
        try {
            return new Money(new BigDecimal(amount.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a credit amount: " + amount, e);
        }
    }

    public Money add(Money other) {
        return new Money(this.amount.add(other.amount));
    }

    public Money subtract(Money other) {
        return new Money(this.amount.subtract(other.amount));
    }

    /**
     * Divide by a ratio such as implied odds.
     */
    public Money divide(BigDecimal divisor) {
        if (divisor.compareTo(BigDecimal.ZERO) == 0) {
            throw new ArithmeticException("Cannot divide by zero");
        }
        return new Money(this.amount.divide(divisor, RATIO_SCALE, ROUNDING_MODE));
    }

    /**
     * Scale by {@code numerator / denominator} without rounding the intermediate quotient to cents.
     */
    public Money scale(BigDecimal numerator, BigDecimal denominator) {
        if (denominator.compareTo(BigDecimal.ZERO) == 0) {
            throw new ArithmeticException("Cannot divide by zero");
        }
        return new Money(this.amount.multiply(numerator).divide(denominator, RATIO_SCALE, ROUNDING_MODE));
    }

    public Money negate() {
        return new Money(this.amount.negate());
    }

    public Money max(Money other) {
        return this.compareTo(other) >= 0 ? this : other;
    }

    public boolean isPositive() {
        return this.amount.compareTo(BigDecimal.ZERO) > 0;
    }

    /**
     * Underlying BigDecimal (for persistence only).
     */
    public BigDecimal toBigDecimal() {
        return amount;
    }

    @Override
    public int compareTo(Money other) {
        return this.amount.compareTo(other.amount);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Money other && amount.compareTo(other.amount) == 0;
    }

    @Override
    public int hashCode() {
        return amount.hashCode();
    }

    @Override
    public String toString() {
        return amount.toPlainString();
    }
}
