package com.flagship.bookkeeping.amount;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Converts decimal amounts to and from the numerator/denominator pair persisted on splits.
 *
 * The denominator is always a power of ten chosen from the amount's own scale,
 * clamped to [minScale, maxScale]. Amounts carrying more than maxScale digits are
 * rounded half-up.
 */
public final class AmountCodec {

    public static final int DEFAULT_MIN_SCALE = 2;
    public static final int DEFAULT_MAX_SCALE = 6;

    private AmountCodec() {
    }

    public static Fraction toFraction(BigDecimal amount) {
        return toFraction(amount, DEFAULT_MIN_SCALE, DEFAULT_MAX_SCALE);
    }

    public static Fraction toFraction(BigDecimal amount, int minScale, int maxScale) {
        Objects.requireNonNull(amount, "amount");
        if (minScale < 0 || maxScale < minScale) {
            throw new IllegalArgumentException(
                String.format("Invalid scale bounds: min=%d, max=%d", minScale, maxScale));
        }
        int scale = Math.min(Math.max(amount.scale(), minScale), maxScale);
        long denominator = BigInteger.TEN.pow(scale).longValueExact();
        long numerator = amount.movePointRight(scale)
            .setScale(0, RoundingMode.HALF_UP)
            .longValueExact();
        return Fraction.of(numerator, denominator);
    }

    public static BigDecimal fromFraction(Fraction fraction) {
        return fromFraction(fraction.getNumerator(), fraction.getDenominator());
    }

    public static BigDecimal fromFraction(long numerator, Long denominator) {
        long denom = (denominator == null || denominator == 0L) ? 1L : denominator;
        int powerOfTen = powerOfTen(denom);
        if (powerOfTen >= 0) {
            return BigDecimal.valueOf(numerator, powerOfTen);
        }
        BigDecimal dividend = BigDecimal.valueOf(numerator);
        BigDecimal divisor = BigDecimal.valueOf(denom);
        try {
            return dividend.divide(divisor);
        } catch (ArithmeticException nonTerminating) {
            return dividend.divide(divisor, MathContext.DECIMAL128);
        }
    }

    /**
     * Rounds an amount to what {@link #toFraction(BigDecimal)} would store.
     */
    public static BigDecimal normalize(BigDecimal amount) {
        return fromFraction(toFraction(amount));
    }

    // -1 when value is not a positive power of ten
    private static int powerOfTen(long value) {
        if (value <= 0) {
            return -1;
        }
        int exponent = 0;
        long remaining = value;
        while (remaining % 10 == 0) {
            remaining /= 10;
            exponent++;
        }
        return remaining == 1 ? exponent : -1;
    }
}
