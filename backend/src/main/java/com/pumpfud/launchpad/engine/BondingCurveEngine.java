// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.engine;

import com.pumpfud.launchpad.common.DomainError;
import com.pumpfud.launchpad.common.Result;
import com.pumpfud.launchpad.common.errors.InsufficientLiquidityError;
import com.pumpfud.launchpad.common.errors.ZeroAmountError;
import com.pumpfud.launchpad.constants.LaunchpadConstants;
import com.pumpfud.launchpad.model.CurveQuote;
import com.pumpfud.launchpad.model.TokenRecord;
import com.pumpfud.launchpad.util.CurveMath;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Constant-product pricing with virtual reserves.
 *
 * CURVE:
 * - x = virtualBase + realReserve
 * - y = virtualTokens - tokensSold
 * - k = x * y before the trade; equal to virtualBase * virtualTokens until the first burn
 *
 * Buy: tokensOut = y - floor(k / (x + netIn)).
 * Sell: baseOut = x - ceil(k / (y + tokensIn)), clamped to [0, realReserve].
 * Only trades move the curve; a burn redemption shrinks x and therefore k.
 */
@Component
public class BondingCurveEngine {

    /**
     * Spot price scaled by {@link LaunchpadConstants#PRICE_SCALE}.
     */
    public BigInteger price(final TokenRecord token) {
        return CurveMath.mulDiv(token.effectiveBaseReserve(), LaunchpadConstants.PRICE_SCALE, token.effectiveTokenReserve());
    }

    public Result<CurveQuote, DomainError> quoteBuy(final TokenRecord token, final BigInteger netBaseIn) {
        if (!CurveMath.isPositive(netBaseIn)) {
            return Result.err(new ZeroAmountError("Buy amount after fees must be positive"));
        }
        BigInteger x = token.effectiveBaseReserve();
        BigInteger y = token.effectiveTokenReserve();
        BigInteger newX = x.add(netBaseIn);
        BigInteger newY = x.multiply(y).divide(newX);
        if (newY.signum() <= 0) {
            return Result.err(new InsufficientLiquidityError("Buy would drain the virtual token reserve"));
        }
        BigInteger tokensOut = y.subtract(newY);
        if (tokensOut.signum() <= 0) {
            return Result.err(new ZeroAmountError("Buy of " + netBaseIn + " yields no tokens"));
        }
        BigInteger soldAfter = token.getTokensSold().add(tokensOut);
        if (soldAfter.compareTo(token.getBondingSupply()) > 0) {
            return Result.err(new InsufficientLiquidityError("Buy of " + tokensOut + " tokens exceeds curve supply; "
                    + token.getBondingSupply().subtract(token.getTokensSold()) + " remaining"));
        }
        BigInteger priceAfter = CurveMath.mulDiv(newX, LaunchpadConstants.PRICE_SCALE, newY);
        return Result.ok(new CurveQuote(netBaseIn, tokensOut, price(token), priceAfter));
    }

    /**
     * Gross base released by returning {@code tokensIn} to the curve, before the sell fee.
     */
    public Result<CurveQuote, DomainError> quoteSell(final TokenRecord token, final BigInteger tokensIn) {
        if (!CurveMath.isPositive(tokensIn)) {
            return Result.err(new ZeroAmountError("Sell amount must be positive"));
        }
        if (tokensIn.compareTo(token.getTokensSold()) > 0) {
            return Result.err(new InsufficientLiquidityError("Cannot sell " + tokensIn + " tokens; only "
                    + token.getTokensSold() + " were sold by the curve"));
        }
        BigInteger x = token.effectiveBaseReserve();
        BigInteger y = token.effectiveTokenReserve();
        BigInteger newY = y.add(tokensIn);
        BigInteger newX = CurveMath.ceilDiv(x.multiply(y), newY);
        BigInteger baseOut = x.subtract(newX).max(BigInteger.ZERO).min(token.getRealReserve());
        if (baseOut.signum() <= 0) {
            return Result.err(new ZeroAmountError("Sell of " + tokensIn + " tokens yields no base"));
        }
        BigInteger priceAfter = CurveMath.mulDiv(x.subtract(baseOut), LaunchpadConstants.PRICE_SCALE, newY);
        return Result.ok(new CurveQuote(tokensIn, baseOut, price(token), priceAfter));
    }

    void applyBuy(final EngineTransaction tx, final CurveQuote quote, final BigInteger grossVolume) {
        TokenRecord token = tx.record();
        token.setRealReserve(token.getRealReserve().add(quote.amountIn()));
        token.setTokensSold(token.getTokensSold().add(quote.amountOut()));
        recordTrade(token, grossVolume);
    }

    void applySell(final EngineTransaction tx, final CurveQuote quote) {
        TokenRecord token = tx.record();
        token.setRealReserve(token.getRealReserve().subtract(quote.amountOut()));
        token.setTokensSold(token.getTokensSold().subtract(quote.amountIn()));
        recordTrade(token, quote.amountOut());
    }

    static void recordTrade(final TokenRecord token, final BigInteger volume) {
        token.setTradingVolume(token.getTradingVolume().add(volume));
        token.setTradeCount(token.getTradeCount() + 1);
    }
}
