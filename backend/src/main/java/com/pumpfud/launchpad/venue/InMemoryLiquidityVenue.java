// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.venue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Venue that records pools in memory. Assets stay in its custody account on the base and token
 * ledgers.
 *
 * LP amount is {@code sqrt(tokenAmount * baseAmount)}, the usual first-deposit mint of a
 * constant-product pool.
 */
@Component
public class InMemoryLiquidityVenue implements LiquidityVenue {

    public static final String NAME = "in-memory";

    private static final Logger logger = LoggerFactory.getLogger(InMemoryLiquidityVenue.class);

    private final Map<String, Pool> pools = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryLiquidityVenue(final Clock clock) {
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String custodyAccount() {
        return "venue:" + NAME;
    }

    @Override
    public LiquidityReceipt addLiquidity(final LiquidityRequest request) throws LiquidityVenueException {
        if (request.deadline() < clock.instant().getEpochSecond()) {
            throw new LiquidityVenueException("Deadline " + request.deadline() + " has passed");
        }
        if (request.tokenAmount().signum() <= 0 || request.baseAmount().signum() <= 0) {
            throw new LiquidityVenueException("Both sides of the deposit must be positive");
        }
        if (request.tokenAmount().compareTo(request.minToken()) < 0
                || request.baseAmount().compareTo(request.minBase()) < 0) {
            throw new LiquidityVenueException("Deposit below the requested minimums");
        }
        String poolRef = "pool-" + request.tokenId();
        if (pools.containsKey(poolRef)) {
            throw new LiquidityVenueException("Pool already seeded for token " + request.tokenId());
        }
        BigInteger lpAmount = request.tokenAmount().multiply(request.baseAmount()).sqrt();
        pools.put(poolRef, new Pool(request.tokenId(), request.tokenAmount(), request.baseAmount(), lpAmount, request.recipient()));
        logger.info("[Venue:{}] pool={} token={} tokenAmount={} baseAmount={} lp={} recipient={}",
                NAME, poolRef, request.tokenSymbol(), request.tokenAmount(), request.baseAmount(), lpAmount, request.recipient());
        return new LiquidityReceipt(poolRef, lpAmount);
    }

    public Optional<Pool> pool(final String poolRef) {
        return Optional.ofNullable(pools.get(poolRef));
    }

    public record Pool(long tokenId, BigInteger tokenReserve, BigInteger baseReserve, BigInteger lpSupply, String lpHolder) {
    }
}
