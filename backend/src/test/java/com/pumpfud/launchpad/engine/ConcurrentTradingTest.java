// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.engine;

import com.pumpfud.launchpad.common.DomainError;
import com.pumpfud.launchpad.common.ErrorKind;
import com.pumpfud.launchpad.common.Result;
import com.pumpfud.launchpad.model.TokenRecord;
import com.pumpfud.launchpad.model.TradeReceipt;
import com.pumpfud.launchpad.service.TradeHistoryService.TradeHistoryEntry;
import com.pumpfud.launchpad.venue.LiquidityReceipt;
import com.pumpfud.launchpad.venue.LiquidityRequest;
import com.pumpfud.launchpad.venue.LiquidityVenue;
import com.pumpfud.launchpad.venue.LiquidityVenueException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.pumpfud.launchpad.engine.LaunchpadFixture.CREATION_FEE;
import static com.pumpfud.launchpad.engine.LaunchpadFixture.OWNER;
import static com.pumpfud.launchpad.engine.LaunchpadFixture.as;
import static com.pumpfud.launchpad.engine.LaunchpadFixture.bi;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Many traders hitting the engine at once. Checks that every committed trade is accounted for
 * and that supply and base are conserved afterwards.
 */
@DisplayName("Concurrent Trading Tests")
class ConcurrentTradingTest {

    private static final int THREADS = 8;
    private static final int TRADES_PER_THREAD = 25;

    private LaunchpadFixture fx;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        fx = new LaunchpadFixture();
        executor = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Concurrent buys and sells on one token conserve supply and base")
    void testSingleTokenContention() throws Exception {
        // Arrange
        long tokenId = fx.launch("creator");
        BigInteger deposits = LaunchpadFixture.CREATION_FEE;
        for (int t = 0; t < THREADS; t++) {
            fx.fund("trader" + t, 1_000_000);
            deposits = deposits.add(bi(1_000_000));
        }

        // Act
        List<Future<Integer>> futures = runAll(t -> () -> {
            String trader = "trader" + t;
            int committed = 0;
            for (int i = 0; i < TRADES_PER_THREAD; i++) {
                Result<TradeReceipt, DomainError> result = i % 3 == 2
                    ? fx.trading.sell(as(trader), tokenId, bi(1_000), null, null)
                    : fx.trading.buy(as(trader), tokenId, bi(10_000), null, null);
                if (result.isOk()) {
                    committed++;
                }
            }
            return committed;
        });
        int committed = 0;
        for (Future<Integer> future : futures) {
            committed += future.get(30, TimeUnit.SECONDS);
        }

        // Assert
        TokenRecord token = fx.token(tokenId);
        assertEquals(committed, token.getTradeCount());
        assertTrue(fx.supplyConserved(tokenId));
        assertEquals(deposits, fx.baseLedger.totalBalance().add(token.getRealReserve()));
        assertTrue(token.getTokensSold().signum() > 0);
    }

    @Test
    @DisplayName("Traders on distinct tokens do not interfere")
    void testDistinctTokens() throws Exception {
        // Arrange
        long[] tokenIds = new long[THREADS];
        for (int t = 0; t < THREADS; t++) {
            tokenIds[t] = fx.launch("creator" + t);
            fx.fund("trader" + t, 100_000);
        }

        // Act
        List<Future<Integer>> futures = runAll(t -> () -> {
            for (int i = 0; i < TRADES_PER_THREAD; i++) {
                fx.trading.buy(as("trader" + t), tokenIds[t], bi(1_000), null, null).getValueUnsafe();
            }
            return TRADES_PER_THREAD;
        });
        for (Future<Integer> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }

        // Assert - every token saw the same sequence of trades
        TokenRecord first = fx.token(tokenIds[0]);
        for (long tokenId : tokenIds) {
            TokenRecord token = fx.token(tokenId);
            assertEquals(TRADES_PER_THREAD, token.getTradeCount());
            assertEquals(first.getTokensSold(), token.getTokensSold());
            assertEquals(first.getRealReserve(), token.getRealReserve());
            assertTrue(fx.supplyConserved(tokenId));
        }
    }

    @Test
    @DisplayName("Concurrent creations get unique sequential ids")
    void testConcurrentCreation() throws Exception {
        for (int t = 0; t < THREADS; t++) {
            fx.fund("creator" + t, LaunchpadFixture.CREATION_FEE.longValueExact() * TRADES_PER_THREAD);
        }

        List<Future<Integer>> futures = runAll(t -> () -> {
            int created = 0;
            for (int i = 0; i < TRADES_PER_THREAD; i++) {
                if (fx.registry.createToken(as("creator" + t), "Token", "TKN", "", "",
                        LaunchpadFixture.CREATION_FEE).isOk()) {
                    created++;
                }
            }
            return created;
        });
        int created = 0;
        for (Future<Integer> future : futures) {
            created += future.get(30, TimeUnit.SECONDS);
        }

        assertEquals(THREADS * TRADES_PER_THREAD, created);
        List<TokenRecord> all = fx.registry.listTokens(0, THREADS * TRADES_PER_THREAD);
        for (int i = 0; i < all.size(); i++) {
            assertEquals(i + 1, all.get(i).getId());
        }
    }

    @Test
    @DisplayName("Only one of many racing buys graduates the token")
    void testGraduationRace() throws Exception {
        long tokenId = fx.launch("creator");
        for (int t = 0; t < THREADS; t++) {
            fx.fund("trader" + t, 10_000_000);
        }

        List<Future<Integer>> futures = runAll(t -> () -> {
            Result<TradeReceipt, DomainError> result =
                fx.trading.buy(as("trader" + t), tokenId, bi(10_000_000), null, null);
            if (result.isErr()) {
                assertEquals(ErrorKind.ALREADY_GRADUATED, result.getErrorUnsafe().kind());
                return 0;
            }
            return result.getValueUnsafe().graduated() ? 1 : 0;
        });
        int graduations = 0;
        for (Future<Integer> future : futures) {
            graduations += future.get(30, TimeUnit.SECONDS);
        }

        assertEquals(1, graduations);
        assertEquals(6, fx.token(tokenId).getTradeCount());
        assertTrue(fx.supplyConserved(tokenId));
    }

    @Test
    @DisplayName("A slow venue call holds only its own token while other tokens keep trading")
    void testSlowVenueDoesNotBlockOtherTokens() throws Exception {
        // Arrange
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        LaunchpadFixture slowFx = new LaunchpadFixture(new BlockingVenue("slow", entered, release));
        slowFx.admin.setLiquidityVenue(as(OWNER), "slow").getValueUnsafe();
        long graduating = slowFx.launch("creator");
        long other = slowFx.launch("creator");
        slowFx.registry.setTestToken(as(OWNER), graduating, true).getValueUnsafe();
        slowFx.fund("alice", 20_000);
        slowFx.fund("bob", 1_000);
        BigInteger deposits = CREATION_FEE.multiply(bi(2)).add(bi(21_000));

        // Act
        Future<Result<TradeReceipt, DomainError>> graduatingBuy =
            executor.submit(() -> slowFx.trading.buy(as("alice"), graduating, bi(20_000), null, null));
        assertTrue(entered.await(10, TimeUnit.SECONDS));
        Result<TradeReceipt, DomainError> otherBuy = assertTimeoutPreemptively(Duration.ofSeconds(5),
            () -> slowFx.trading.buy(as("bob"), other, bi(1_000), null, null));
        BigInteger aliceWhileHeld = slowFx.base("alice");
        BigInteger accountsWhileHeld = slowFx.baseLedger.totalBalance();
        BigInteger otherReserve = slowFx.token(other).getRealReserve();
        release.countDown();
        Result<TradeReceipt, DomainError> graduated = graduatingBuy.get(10, TimeUnit.SECONDS);

        // Assert
        assertTrue(otherBuy.isOk());
        assertEquals(BigInteger.ZERO, aliceWhileHeld);
        assertEquals(deposits, accountsWhileHeld.add(otherReserve));

        assertTrue(graduated.getValueUnsafe().graduated());
        assertEquals("slow-pool", slowFx.token(graduating).getLiquidityPoolRef());
        assertEquals(deposits, slowFx.baseLedger.totalBalance()
            .add(slowFx.token(graduating).getRealReserve())
            .add(slowFx.token(other).getRealReserve()));
    }

    @Test
    @DisplayName("Concurrent buys appear in the trade feed in commit order")
    void testFeedFollowsCommitOrder() throws Exception {
        // Arrange
        long tokenId = fx.launch("creator");
        for (int t = 0; t < THREADS; t++) {
            fx.fund("trader" + t, 250_000);
        }

        // Act
        List<Future<Integer>> futures = runAll(t -> () -> {
            int committed = 0;
            for (int i = 0; i < TRADES_PER_THREAD; i++) {
                if (fx.trading.buy(as("trader" + t), tokenId, bi(10_000), null, null).isOk()) {
                    committed++;
                }
            }
            return committed;
        });
        int committed = 0;
        for (Future<Integer> future : futures) {
            committed += future.get(30, TimeUnit.SECONDS);
        }

        // Assert: every buy raises the price, so newest first means strictly falling prices
        List<TradeHistoryEntry> feed = fx.history.getRecent(tokenId, THREADS * TRADES_PER_THREAD);
        assertEquals(THREADS * TRADES_PER_THREAD, committed);
        assertEquals(committed, feed.size());
        for (int i = 1; i < feed.size(); i++) {
            BigInteger newer = new BigInteger(feed.get(i - 1).priceAfter);
            BigInteger older = new BigInteger(feed.get(i).priceAfter);
            assertTrue(newer.compareTo(older) > 0, "feed out of commit order at position " + i);
        }
    }

    private List<Future<Integer>> runAll(final TaskFactory factory) throws InterruptedException {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        for (int t = 0; t < THREADS; t++) {
            Callable<Integer> task = factory.create(t);
            futures.add(executor.submit(() -> {
                start.await();
                return task.call();
            }));
        }
        start.countDown();
        return futures;
    }

    /**
     * Venue that parks the calling thread until released.
     */
    private static final class BlockingVenue implements LiquidityVenue {
        private final String name;
        private final CountDownLatch entered;
        private final CountDownLatch release;

        BlockingVenue(final String name, final CountDownLatch entered, final CountDownLatch release) {
            this.name = name;
            this.entered = entered;
            this.release = release;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String custodyAccount() {
            return "venue:" + name;
        }

        @Override
        public LiquidityReceipt addLiquidity(final LiquidityRequest request) throws LiquidityVenueException {
            entered.countDown();
            try {
                if (!release.await(10, TimeUnit.SECONDS)) {
                    throw new LiquidityVenueException("venue was never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LiquidityVenueException("interrupted while seeding pool");
            }
            return new LiquidityReceipt(name + "-pool", request.baseAmount());
        }
    }

    @FunctionalInterface
    private interface TaskFactory {
        Callable<Integer> create(int thread);
    }
}
