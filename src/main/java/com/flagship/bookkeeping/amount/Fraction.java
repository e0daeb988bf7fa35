package com.flagship.bookkeeping.amount;

import lombok.Value;

/**
 * Exact rational form of a monetary amount, as stored on a split.
 */
@Value
public class Fraction {
    long numerator;
    long denominator;

    public static Fraction of(long numerator, long denominator) {
        return new Fraction(numerator, denominator);
    }
}
