// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.engine;

import com.pumpfud.launchpad.common.DomainError;
import com.pumpfud.launchpad.common.ErrorKind;
import com.pumpfud.launchpad.common.Result;
import com.pumpfud.launchpad.model.CurveParameters;
import com.pumpfud.launchpad.model.CurveQuote;
import com.pumpfud.launchpad.model.TokenRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;

import static com.pumpfud.launchpad.engine.LaunchpadFixture.CURVE;
import static com.pumpfud.launchpad.engine.LaunchpadFixture.bi;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for the constant-product curve with virtual reserves.
 */
@DisplayName("Bonding Curve Tests")
class BondingCurveEngineTest {

    private final BondingCurveEngine curve = new BondingCurveEngine();

    private static TokenRecord freshToken() {
        return TokenRecord.launch(1, "creator", "Test Token", "TEST", "", "", CURVE, Instant.EPOCH);
    }

    private void buy(TokenRecord token, long netIn) {
        CurveQuote quote = curve.quoteBuy(token, bi(netIn)).getValueUnsafe();
        token.setRealReserve(token.getRealReserve().add(quote.amountIn()));
        token.setTokensSold(token.getTokensSold().add(quote.amountOut()));
    }

    private void sell(TokenRecord token, long tokensIn) {
        CurveQuote quote = curve.quoteSell(token, bi(tokensIn)).getValueUnsafe();
        token.setRealReserve(token.getRealReserve().subtract(quote.amountOut()));
        token.setTokensSold(token.getTokensSold().subtract(quote.amountIn()));
    }

    private static BigInteger product(TokenRecord token) {
        return token.effectiveBaseReserve().multiply(token.effectiveTokenReserve());
    }

    @Test
    @DisplayName("Scenario A: 9.9M net buy follows the floored constant-product formula")
    void testScenarioA() {
        // Arrange
        TokenRecord token = freshToken();
        BigInteger k = bi(12_500_000).multiply(bi(250_000_000));
        BigInteger expected = bi(250_000_000).subtract(k.divide(bi(12_500_000 + 9_900_000)));

        // Act
        Result<CurveQuote, DomainError> quote = curve.quoteBuy(token, bi(9_900_000));

        // Assert
        assertTrue(quote.isOk());
        assertEquals(expected, quote.getValueUnsafe().amountOut());
        assertEquals(bi(110_491_072), quote.getValueUnsafe().amountOut());
        assertTrue(quote.getValueUnsafe().priceAfter().compareTo(quote.getValueUnsafe().priceBefore()) > 0);
    }

    @Test
    @DisplayName("Initial price is virtualBase / virtualTokens scaled by 1e18")
    void testInitialPrice() {
        TokenRecord token = freshToken();

        // 12.5M / 250M = 0.05
        assertEquals(new BigInteger("50000000000000000"), curve.price(token));
    }

    @Test
    @DisplayName("Price strictly increases after every buy and decreases after every sell")
    void testPriceMonotonicity() {
        TokenRecord token = freshToken();
        long[] buys = {1_000, 250_000, 3_000_000, 9_900_000, 17};

        for (long netIn : buys) {
            BigInteger before = curve.price(token);
            buy(token, netIn);
            assertTrue(curve.price(token).compareTo(before) > 0, "price must rise after buying " + netIn);
        }

        long[] sells = {5_000_000, 1_000_000, 40_000};
        for (long tokensIn : sells) {
            BigInteger before = curve.price(token);
            sell(token, tokensIn);
            assertTrue(curve.price(token).compareTo(before) < 0, "price must fall after selling " + tokensIn);
        }
    }

    @Test
    @DisplayName("Reserve product stays within rounding tolerance across trades")
    void testKConservation() {
        TokenRecord token = freshToken();
        long[][] trades = {{1, 9_900_000}, {1, 123_456}, {0, 7_000_000}, {1, 42_000_000}, {0, 100_000_000}, {0, 3_000}};

        for (long[] trade : trades) {
            BigInteger before = product(token);
            if (trade[0] == 1) {
                buy(token, trade[1]);
            } else {
                sell(token, trade[1]);
            }
            BigInteger after = product(token);
            BigInteger tolerance = token.effectiveBaseReserve().max(token.effectiveTokenReserve());
            assertTrue(after.subtract(before).abs().compareTo(tolerance) <= 0,
                "k drifted beyond rounding: before=" + before + ", after=" + after);
        }
    }

    @Test
    @DisplayName("Buy rounding never pushes the product above its pre-trade value; sell rounding never below")
    void testRoundingFavoursProtocol() {
        TokenRecord token = freshToken();

        BigInteger beforeBuy = product(token);
        buy(token, 1_234_567);
        assertTrue(product(token).compareTo(beforeBuy) <= 0);

        BigInteger beforeSell = product(token);
        sell(token, 777_777);
        assertTrue(product(token).compareTo(beforeSell) >= 0);
    }

    @Test
    @DisplayName("Zero or negative amounts are rejected with ZeroAmount")
    void testZeroAmounts() {
        TokenRecord token = freshToken();

        assertEquals(ErrorKind.ZERO_AMOUNT, curve.quoteBuy(token, BigInteger.ZERO).getErrorUnsafe().kind());
        assertEquals(ErrorKind.ZERO_AMOUNT, curve.quoteBuy(token, bi(-5)).getErrorUnsafe().kind());
        assertEquals(ErrorKind.ZERO_AMOUNT, curve.quoteSell(token, BigInteger.ZERO).getErrorUnsafe().kind());
    }

    @Test
    @DisplayName("Selling more than the curve sold is InsufficientLiquidity")
    void testSellBeyondSold() {
        TokenRecord token = freshToken();
        buy(token, 1_000_000);

        Result<CurveQuote, DomainError> quote = curve.quoteSell(token, token.getTokensSold().add(BigInteger.ONE));

        assertEquals(ErrorKind.INSUFFICIENT_LIQUIDITY, quote.getErrorUnsafe().kind());
    }

    @Test
    @DisplayName("Buying past the bonding supply cap is InsufficientLiquidity")
    void testBondingSupplyCap() {
        // Arrange - a curve that may sell only 100 tokens
        TokenRecord wide = TokenRecord.launch(2, "creator", "Wide", "WIDE", "", "",
            new CurveParameters(bi(1_000), bi(1_000_000_000), bi(50_000_000), bi(10_000),
                bi(1_000_000_000), bi(100)), Instant.EPOCH);

        Result<CurveQuote, DomainError> quote = curve.quoteBuy(wide, bi(1_000));

        assertEquals(ErrorKind.INSUFFICIENT_LIQUIDITY, quote.getErrorUnsafe().kind());
    }

    @Test
    @DisplayName("Sell output never exceeds the real reserve")
    void testSellClampedToRealReserve() {
        TokenRecord token = freshToken();
        buy(token, 5_000_000);
        BigInteger sold = token.getTokensSold();

        CurveQuote quote = curve.quoteSell(token, sold).getValueUnsafe();

        assertTrue(quote.amountOut().compareTo(token.getRealReserve()) <= 0);
        assertTrue(quote.amountOut().signum() > 0);
    }
}
