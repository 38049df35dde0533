package com.perpclear.core.math;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Fixed-point helpers for 1e18-scaled integers ("wads").
 *
 * Every division takes an explicit rounding direction. Callers round up when the
 * venue collects (fees, margin requirements, debits) and down when it pays out.
 */
public final class Wad {

    public static final BigInteger ONE = BigInteger.TEN.pow(18);
    public static final BigInteger BPS = BigInteger.valueOf(10_000);
    public static final int DECIMALS = 18;

    private Wad() {}

    public static BigInteger of(long units) {
        return BigInteger.valueOf(units).multiply(ONE);
    }

    /**
     * Parse a human decimal string ("2000", "0.25", "-1.5") into a wad.
     * Digits beyond 18 decimals are truncated towards zero.
     */
    public static BigInteger parse(String decimal) {
        if (decimal == null || decimal.isBlank()) {
            return BigInteger.ZERO;
        }
        return new BigDecimal(decimal.trim())
                .setScale(DECIMALS, RoundingMode.DOWN)
                .unscaledValue();
    }

    public static BigDecimal toDecimal(BigInteger wad) {
        return new BigDecimal(wad, DECIMALS).stripTrailingZeros();
    }

    public static String format(BigInteger wad) {
        return toDecimal(wad).toPlainString();
    }

    /** a * b / 1e18, rounded down (towards negative infinity for negative products). */
    public static BigInteger mulDown(BigInteger a, BigInteger b) {
        return mulDiv(a, b, ONE, false);
    }

    /** a * b / 1e18, rounded up (away from zero for positive products). */
    public static BigInteger mulUp(BigInteger a, BigInteger b) {
        return mulDiv(a, b, ONE, true);
    }

    public static BigInteger divDown(BigInteger a, BigInteger b) {
        return mulDiv(a, ONE, b, false);
    }

    public static BigInteger divUp(BigInteger a, BigInteger b) {
        return mulDiv(a, ONE, b, true);
    }

    /**
     * a * b / denominator with floor (roundUp=false) or ceiling (roundUp=true) semantics.
     */
    public static BigInteger mulDiv(BigInteger a, BigInteger b, BigInteger denominator, boolean roundUp) {
        if (denominator.signum() == 0) {
            throw new ArithmeticException("division by zero");
        }
        BigInteger product = a.multiply(b);
        BigInteger[] qr = product.divideAndRemainder(denominator);
        BigInteger q = qr[0];
        if (qr[1].signum() != 0) {
            boolean positive = product.signum() == denominator.signum();
            if (roundUp && positive) {
                q = q.add(BigInteger.ONE);
            } else if (!roundUp && !positive) {
                q = q.subtract(BigInteger.ONE);
            }
        }
        return q;
    }

    /** value * bps / 10000, rounded as requested. */
    public static BigInteger bps(BigInteger value, int bps, boolean roundUp) {
        return mulDiv(value, BigInteger.valueOf(bps), BPS, roundUp);
    }

    /** Magnitude rounded away from zero, keeping the sign. Used for signed debits. */
    public static BigInteger mulDivAwayFromZero(BigInteger a, BigInteger b, BigInteger denominator) {
        BigInteger magnitude = mulDiv(a.abs(), b.abs(), denominator.abs(), true);
        int sign = a.signum() * b.signum() * denominator.signum();
        return sign < 0 ? magnitude.negate() : magnitude;
    }

    /** Magnitude rounded towards zero, keeping the sign. Used for signed credits. */
    public static BigInteger mulDivTowardZero(BigInteger a, BigInteger b, BigInteger denominator) {
        BigInteger magnitude = mulDiv(a.abs(), b.abs(), denominator.abs(), false);
        int sign = a.signum() * b.signum() * denominator.signum();
        return sign < 0 ? magnitude.negate() : magnitude;
    }

    /**
     * Convert a wad amount into a token's native units. Collections round up, payouts round down.
     */
    public static BigInteger toTokenUnits(BigInteger wad, BigInteger baseUnit, boolean roundUp) {
        return mulDiv(wad, baseUnit, ONE, roundUp);
    }

    /** Convert native token units into a wad (exact for base units dividing 1e18). */
    public static BigInteger fromTokenUnits(BigInteger amount, BigInteger baseUnit) {
        return mulDiv(amount, ONE, baseUnit, false);
    }

    public static BigInteger min(BigInteger a, BigInteger b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static BigInteger max(BigInteger a, BigInteger b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static boolean isPositive(BigInteger value) {
        return value.signum() > 0;
    }
}
