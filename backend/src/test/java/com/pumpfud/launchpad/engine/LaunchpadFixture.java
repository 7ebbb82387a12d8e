// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.engine;

import com.pumpfud.launchpad.constants.LaunchpadConstants;
import com.pumpfud.launchpad.metrics.LaunchpadMetrics;
import com.pumpfud.launchpad.model.CallerContext;
import com.pumpfud.launchpad.model.CurveParameters;
import com.pumpfud.launchpad.model.FeeSchedule;
import com.pumpfud.launchpad.model.ProtocolSettings;
import com.pumpfud.launchpad.model.TokenRecord;
import com.pumpfud.launchpad.service.TradeHistoryService;
import com.pumpfud.launchpad.service.TraderStatsService;
import com.pumpfud.launchpad.venue.InMemoryLiquidityVenue;
import com.pumpfud.launchpad.venue.LiquidityVenue;
import com.pumpfud.launchpad.venue.LiquidityVenueRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires the engine by hand with base units equal to whole units (no decimal scaling), so the
 * numbers in tests read like the curve parameters themselves.
 */
final class LaunchpadFixture {

    static final String OWNER = "owner";
    static final String TREASURY = "treasury";
    static final String CREATOR = "creator";

    static final CurveParameters CURVE = new CurveParameters(
            bi(12_500_000),
            bi(250_000_000),
            bi(50_000_000),
            bi(10_000),
            bi(1_000_000_000),
            bi(800_000_000));

    static final FeeSchedule FEES = new FeeSchedule(100, 100, 500, 1000, 8000);

    static final BigInteger CREATION_FEE = bi(100);

    final Clock clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
    final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    final TokenStore store = new TokenStore();
    final TokenLocks locks = new TokenLocks();
    final TokenBalanceBook balances = new TokenBalanceBook();
    final BaseLedger baseLedger = new BaseLedger();
    final TokenTransactions transactions = new TokenTransactions(store, locks, balances, baseLedger);

    final InMemoryLiquidityVenue venue = new InMemoryLiquidityVenue(clock);
    final LiquidityVenueRegistry venues;
    final AdminControls admin;
    final FeeDistributor fees;
    final BondingCurveEngine curve = new BondingCurveEngine();
    final TokenLedger ledger = new TokenLedger(transactions, balances, locks);
    final GraduationCoordinator graduation;
    final TradeHistoryService history = new TradeHistoryService();
    final TraderStatsService stats = new TraderStatsService();
    final LaunchpadMetrics metrics = new LaunchpadMetrics(meterRegistry);
    final TokenRegistry registry;
    final TradingService trading;

    LaunchpadFixture(final LiquidityVenue... extraVenues) {
        List<LiquidityVenue> all = new ArrayList<>();
        all.add(venue);
        all.addAll(List.of(extraVenues));
        venues = new LiquidityVenueRegistry(all);
        admin = new AdminControls(FEES,
                new ProtocolSettings(OWNER, TREASURY, LaunchpadConstants.BURN_ADDRESS, CREATION_FEE, 5000, InMemoryLiquidityVenue.NAME),
                venues);
        fees = new FeeDistributor(admin);
        graduation = new GraduationCoordinator(admin, ledger, fees, clock, 100, 600);
        registry = new TokenRegistry(store, transactions, admin, fees, CURVE, clock, metrics);
        trading = new TradingService(transactions, curve, fees, graduation, ledger, admin, history, stats, metrics, clock);
    }

    static BigInteger bi(final long value) {
        return BigInteger.valueOf(value);
    }

    static CallerContext as(final String account) {
        return CallerContext.of(account);
    }

    void fund(final String account, final long amount) {
        baseLedger.deposit(account, bi(amount));
    }

    /**
     * Funds the creator with exactly the creation fee and launches a token.
     */
    long launch(final String creator) {
        fund(creator, CREATION_FEE.longValueExact());
        return registry.createToken(as(creator), "Test Token", "TEST", "", "", CREATION_FEE)
                .getValueUnsafe()
                .getId();
    }

    TokenRecord token(final long tokenId) {
        return registry.getToken(tokenId).getValueUnsafe();
    }

    BigInteger base(final String account) {
        return baseLedger.balanceOf(account);
    }

    BigInteger tokens(final long tokenId, final String account) {
        return ledger.balanceOf(tokenId, account);
    }

    /**
     * sum(balances) == tokensSold + liquidityTokensMinted - totalBurned
     */
    boolean supplyConserved(final long tokenId) {
        return ledger.totalBalances(tokenId).equals(token(tokenId).circulatingSupply());
    }
}
