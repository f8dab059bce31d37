package com.flagship.payments_engine.ledger;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A decimal amount that is strictly greater than zero.
 *
 * Instances can only be obtained through {@link #of(BigDecimal)} or {@link #parse(String)},
 * so every deposit and withdrawal reaching the ledger already carries a valid sign.
 * The wrapped value is never exposed for mutation (BigDecimal is immutable).
 * Values are limited to {@value #MAX_DIGITS} integer digits and {@value #MAX_DIGITS}
 * fractional digits, so ledger arithmetic on them always stays in range.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PositiveDecimal {

    public static final int MAX_DIGITS = 28;

    BigDecimal value;

    /**
     * Wraps a decimal after checking it is positive and non-zero.
     *
     * @throws InvalidAmountException if the value is null, zero or negative
     */
    public static PositiveDecimal of(BigDecimal value) {
        if (value == null) {
            throw new InvalidAmountException("Amount is required");
        }
        if (value.signum() <= 0) {
            throw new InvalidAmountException("Amount must be positive and non-zero: " + value);
        }
        BigDecimal normalized = value.stripTrailingZeros();
        int fractionDigits = Math.max(normalized.scale(), 0);
        long integerDigits = (long) normalized.precision() - normalized.scale();
        if (integerDigits > MAX_DIGITS || fractionDigits > MAX_DIGITS) {
            throw new InvalidAmountException(
                String.format("Amount out of range, at most %d integer and %d fractional digits: %s",
                    MAX_DIGITS, MAX_DIGITS, value));
        }
        return new PositiveDecimal(value);
    }

    /**
     * Parses a textual amount such as {@code "123.45"}.
     *
     * @throws InvalidAmountException if the text is blank, not a number, zero or negative
     */
    public static PositiveDecimal parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidAmountException("Amount is required");
        }
        BigDecimal value;
        try {
            value = new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            throw new InvalidAmountException("Amount is not a number: " + text, e);
        }
        return of(value);
    }

    @Override
    public String toString() {
        return value.toPlainString();
    }
}
