package com.pumpfud.launchpad.model;

import java.math.BigInteger;

/**
 * Raw curve movement for one trade, before any fee handling.
 */
public record CurveQuote(
        BigInteger amountIn,
        BigInteger amountOut,
        BigInteger priceBefore,
        BigInteger priceAfter
) {
}
