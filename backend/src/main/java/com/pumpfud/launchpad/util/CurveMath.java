package com.pumpfud.launchpad.util;

import com.pumpfud.launchpad.constants.LaunchpadConstants;

import java.math.BigInteger;

/**
 * Integer helpers shared by the curve, fee and graduation code.
 *
 * All operands are non-negative base-unit amounts; every helper rounds toward zero unless its
 * name says otherwise.
 */
public final class CurveMath {

    private CurveMath() {
        // Utility class
    }

    /**
     * {@code floor(a * b / denominator)}.
     */
    public static BigInteger mulDiv(final BigInteger a, final BigInteger b, final BigInteger denominator) {
        if (denominator.signum() <= 0) {
            throw new ArithmeticException("denominator must be positive: " + denominator);
        }
        return a.multiply(b).divide(denominator);
    }

    /**
     * {@code ceil(numerator / denominator)} for non-negative numerators.
     */
    public static BigInteger ceilDiv(final BigInteger numerator, final BigInteger denominator) {
        if (denominator.signum() <= 0) {
            throw new ArithmeticException("denominator must be positive: " + denominator);
        }
        BigInteger[] qr = numerator.divideAndRemainder(denominator);
        return qr[1].signum() == 0 ? qr[0] : qr[0].add(BigInteger.ONE);
    }

    /**
     * {@code floor(amount * bps / 10000)}.
     */
    public static BigInteger bps(final BigInteger amount, final int bps) {
        return mulDiv(amount, BigInteger.valueOf(bps), LaunchpadConstants.BPS_DENOMINATOR);
    }

    /**
     * Scales a whole-unit amount to base units, e.g. {@code units(5, 18)} is 5e18.
     */
    public static BigInteger units(final long wholeUnits, final int decimals) {
        return BigInteger.valueOf(wholeUnits).multiply(BigInteger.TEN.pow(decimals));
    }

    public static boolean isPositive(final BigInteger value) {
        return value != null && value.signum() > 0;
    }
}
