package com.pumpfud.launchpad.model;

import java.math.BigInteger;

/**
 * Fee-inclusive quote as the trader would see it.
 */
public record TradeQuote(
        long tokenId,
        TradeSide side,
        BigInteger amountIn,
        BigInteger fee,
        BigInteger amountOut,
        BigInteger priceBefore,
        BigInteger priceAfter
) {
}
