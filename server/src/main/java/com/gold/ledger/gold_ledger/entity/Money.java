package com.gold.ledger.gold_ledger.entity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Fixed-precision rupee amount used for gold prices and trade totals.
 *
 * Prices are quoted in INR per gram and trades are sized in grams with up to
 * three decimals, so a total can carry more precision than a plain paise
 * amount. Values are kept at {@link #SCALE} decimals.
 *
 * Immutable and thread-safe.
 */
public final class Money implements Comparable<Money> {

    /**
     * Fixed scale for all rupee values (4 decimal places).
     */
    public static final int SCALE = 4;

    /**
     * HALF_EVEN (banker's rounding) for every operation.
     */
    public static final RoundingMode ROUNDING_MODE = RoundingMode.HALF_EVEN;

    private final BigDecimal amount;

    public static final Money ZERO = new Money(BigDecimal.ZERO);

    private Money(BigDecimal amount) {
        this.amount = amount.setScale(SCALE, ROUNDING_MODE);
    }

    public static Money of(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        return new Money(amount);
    }

    /**
     * Create Money from String (safest for parsing user input).
     */
    public static Money of(String amount) {
        if (amount == null || amount.trim().isEmpty()) {
            throw new IllegalArgumentException("Amount string cannot be null or empty");
        }
        try {
            return new Money(new BigDecimal(amount));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid amount format: " + amount, e);
        }
    }

    public Money add(Money other) {
        return new Money(this.amount.add(other.amount));
    }

    /**
     * Price a quantity of gold. The exact product is rounded once, so the
     * per-gram rate is never rounded on its own.
     */
    public static Money total(BigDecimal pricePerGram, BigDecimal grams) {
        if (pricePerGram == null || grams == null) {
            throw new IllegalArgumentException("Price and quantity cannot be null");
        }
        return new Money(pricePerGram.multiply(grams));
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
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Money money = (Money) obj;
        return amount.compareTo(money.amount) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount);
    }

    @Override
    public String toString() {
        return amount.toPlainString();
    }
}
