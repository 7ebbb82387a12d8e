// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.engine;

import com.pumpfud.launchpad.common.DomainError;
import com.pumpfud.launchpad.common.ErrorKind;
import com.pumpfud.launchpad.common.Result;
import com.pumpfud.launchpad.constants.LaunchpadConstants;
import com.pumpfud.launchpad.model.GraduationAllocation;
import com.pumpfud.launchpad.model.TokenRecord;
import com.pumpfud.launchpad.model.TokenStatus;
import com.pumpfud.launchpad.model.TradeReceipt;
import com.pumpfud.launchpad.venue.LiquidityReceipt;
import com.pumpfud.launchpad.venue.LiquidityRequest;
import com.pumpfud.launchpad.venue.LiquidityVenue;
import com.pumpfud.launchpad.venue.LiquidityVenueException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigInteger;

import static com.pumpfud.launchpad.engine.LaunchpadFixture.OWNER;
import static com.pumpfud.launchpad.engine.LaunchpadFixture.as;
import static com.pumpfud.launchpad.engine.LaunchpadFixture.bi;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Graduation allocation and the venue hand-off, including rollback when the venue fails.
 */
@DisplayName("Graduation Coordinator Tests")
class GraduationCoordinatorTest {

    private static final BigInteger TEN_MILLION = bi(10_000_000);

    @Test
    @DisplayName("Allocation splits the threshold and prices liquidity tokens at the final curve price")
    void testAllocation() {
        // Arrange
        LaunchpadFixture fx = new LaunchpadFixture();
        long tokenId = fx.launch("creator");
        fx.fund("alice", 60_000_000);
        buy(fx, tokenId, "alice", 5);
        TokenRecord due = fx.token(tokenId);
        due.setRealReserve(bi(59_400_000));
        due.setTokensSold(bi(206_536_859));

        // Act
        GraduationAllocation allocation = fx.graduation.allocate(due, LaunchpadFixture.FEES);

        // Assert
        assertEquals(bi(5_000_000), allocation.burnAmount());
        assertEquals(bi(40_000_000), allocation.liquidityBaseAmount());
        assertEquals(bi(24_179_772), allocation.liquidityTokenAmount());
        assertEquals(bi(2_500_000), allocation.creatorReward());
        assertEquals(bi(11_900_000), allocation.remainder());
        assertTrue(fx.graduation.isDue(due));
        assertFalse(fx.graduation.isDue(fx.token(tokenId)));
    }

    @Test
    @DisplayName("Venue receives the allocation with slippage minimums, recipient and deadline")
    void testVenueRequest() throws Exception {
        // Arrange
        LiquidityVenue venue = stubVenue("recording");
        when(venue.addLiquidity(any())).thenReturn(new LiquidityReceipt("ext-42", bi(31_096_514)));
        LaunchpadFixture fx = new LaunchpadFixture(venue);
        fx.admin.setLiquidityVenue(as(OWNER), "recording").getValueUnsafe();
        fx.admin.setLpRecipient(as(OWNER), "LP-Wallet").getValueUnsafe();
        long tokenId = fx.launch("creator");
        fx.fund("alice", 60_000_000);

        // Act
        buy(fx, tokenId, "alice", 6);

        // Assert
        ArgumentCaptor<LiquidityRequest> captor = ArgumentCaptor.forClass(LiquidityRequest.class);
        verify(venue, times(1)).addLiquidity(captor.capture());
        LiquidityRequest request = captor.getValue();
        assertThat(request.tokenId()).isEqualTo(tokenId);
        assertThat(request.tokenSymbol()).isEqualTo("TEST");
        assertThat(request.tokenAmount()).isEqualTo(bi(24_179_772));
        assertThat(request.baseAmount()).isEqualTo(bi(40_000_000));
        assertThat(request.minToken()).isEqualTo(bi(23_937_974));
        assertThat(request.minBase()).isEqualTo(bi(39_600_000));
        assertThat(request.recipient()).isEqualTo("lp-wallet");
        assertThat(request.deadline()).isEqualTo(fx.clock.instant().getEpochSecond() + 600);

        assertEquals("ext-42", fx.token(tokenId).getLiquidityPoolRef());
        assertEquals(bi(40_000_000), fx.base("venue:recording"));
    }

    @Test
    @DisplayName("A failing venue rolls back the whole graduating buy")
    void testVenueFailureRollsBack() throws Exception {
        // Arrange
        LiquidityVenue venue = stubVenue("failing");
        when(venue.addLiquidity(any())).thenThrow(new LiquidityVenueException("pool factory offline"));
        LaunchpadFixture fx = new LaunchpadFixture(venue);
        fx.admin.setLiquidityVenue(as(OWNER), "failing").getValueUnsafe();
        long tokenId = fx.launch("creator");
        fx.fund("alice", 60_000_000);
        buy(fx, tokenId, "alice", 5);
        TokenRecord before = fx.token(tokenId);
        BigInteger aliceTokens = fx.tokens(tokenId, "alice");
        BigInteger treasury = fx.base(LaunchpadFixture.TREASURY);

        // Act
        Result<TradeReceipt, DomainError> result =
            fx.trading.buy(as("alice"), tokenId, TEN_MILLION, null, null);

        // Assert
        assertEquals(ErrorKind.EXTERNAL_TRANSFER_FAILED, result.getErrorUnsafe().kind());
        TokenRecord after = fx.token(tokenId);
        assertEquals(TokenStatus.ACTIVE, after.getStatus());
        assertEquals(before.getRealReserve(), after.getRealReserve());
        assertEquals(before.getTokensSold(), after.getTokensSold());
        assertEquals(BigInteger.ZERO, after.getLiquidityTokensMinted());
        assertNull(after.getGraduatedAt());
        assertEquals(TEN_MILLION, fx.base("alice"));
        assertEquals(aliceTokens, fx.tokens(tokenId, "alice"));
        assertEquals(BigInteger.ZERO, fx.base("creator"));
        assertEquals(BigInteger.ZERO, fx.base(LaunchpadConstants.BURN_ADDRESS));
        assertEquals(BigInteger.ZERO, fx.base("venue:failing"));
        assertEquals(treasury, fx.base(LaunchpadFixture.TREASURY));
        assertTrue(fx.supplyConserved(tokenId));

        // Switching to a working venue lets the same buy graduate
        fx.admin.setLiquidityVenue(as(OWNER), fx.venue.name()).getValueUnsafe();
        assertTrue(fx.trading.buy(as("alice"), tokenId, TEN_MILLION, null, null).getValueUnsafe().graduated());
    }

    @Test
    @DisplayName("Graduation runs exactly once")
    void testGraduatesOnce() throws Exception {
        LiquidityVenue venue = stubVenue("counting");
        when(venue.addLiquidity(any())).thenReturn(new LiquidityReceipt("p", BigInteger.ONE));
        LaunchpadFixture fx = new LaunchpadFixture(venue);
        fx.admin.setLiquidityVenue(as(OWNER), "counting").getValueUnsafe();
        long tokenId = fx.launch("creator");
        fx.fund("alice", 80_000_000);

        buy(fx, tokenId, "alice", 6);
        Result<TradeReceipt, DomainError> afterwards = fx.trading.buy(as("alice"), tokenId, TEN_MILLION, null, null);

        assertEquals(ErrorKind.ALREADY_GRADUATED, afterwards.getErrorUnsafe().kind());
        verify(venue, times(1)).addLiquidity(any());
        assertEquals(1.0, fx.meterRegistry.counter("launchpad.token.graduated.total").count());
    }

    @Test
    @DisplayName("Trades below the threshold never reach the venue")
    void testNoVenueCallBelowThreshold() throws Exception {
        LiquidityVenue venue = stubVenue("idle");
        LaunchpadFixture fx = new LaunchpadFixture(venue);
        fx.admin.setLiquidityVenue(as(OWNER), "idle").getValueUnsafe();
        long tokenId = fx.launch("creator");
        fx.fund("alice", 50_000_000);

        buy(fx, tokenId, "alice", 5);

        verify(venue, never()).addLiquidity(any());
    }

    @Test
    @DisplayName("Test tokens graduate at the reduced threshold")
    void testTestTokenThreshold() {
        // Arrange
        LaunchpadFixture fx = new LaunchpadFixture();
        long tokenId = fx.launch("creator");
        fx.registry.setTestToken(as(OWNER), tokenId, true).getValueUnsafe();
        fx.fund("alice", 1_000_000);

        // Act
        TradeReceipt receipt = fx.trading.buy(as("alice"), tokenId, bi(1_000_000), null, null).getValueUnsafe();

        // Assert
        TokenRecord token = fx.token(tokenId);
        assertTrue(receipt.graduated());
        assertTrue(token.isTestToken());
        assertEquals(bi(10_000), token.getGraduationThreshold());
        assertEquals(bi(980_500), token.getRealReserve());
        assertEquals(bi(137_377), token.getLiquidityTokensMinted());
        assertEquals(bi(500), fx.base("creator"));
        assertEquals(bi(1_000), fx.base(LaunchpadConstants.BURN_ADDRESS));
        assertTrue(fx.supplyConserved(tokenId));
    }

    private static LiquidityVenue stubVenue(final String name) {
        LiquidityVenue venue = mock(LiquidityVenue.class);
        when(venue.name()).thenReturn(name);
        when(venue.custodyAccount()).thenReturn("venue:" + name);
        return venue;
    }

    private static void buy(final LaunchpadFixture fx, final long tokenId, final String trader, final int times) {
        for (int i = 0; i < times; i++) {
            fx.trading.buy(as(trader), tokenId, TEN_MILLION, null, null).getValueUnsafe();
        }
    }
}
