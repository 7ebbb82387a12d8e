// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.engine;

import com.pumpfud.launchpad.common.DomainError;
import com.pumpfud.launchpad.common.Result;
import com.pumpfud.launchpad.common.errors.InvalidParameterError;
import com.pumpfud.launchpad.common.errors.PausedError;
import com.pumpfud.launchpad.common.errors.UnauthorizedError;
import com.pumpfud.launchpad.constants.LaunchpadConstants;
import com.pumpfud.launchpad.model.CallerContext;
import com.pumpfud.launchpad.model.FeeSchedule;
import com.pumpfud.launchpad.model.ProtocolSettings;
import com.pumpfud.launchpad.venue.LiquidityVenue;
import com.pumpfud.launchpad.venue.LiquidityVenueRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owner-gated protocol parameters: fee rates, graduation split, pause flag, liquidity venue,
 * treasury, LP recipient, creation fee and fee exemptions.
 *
 * Single writer, many readers. Writers synchronize on this instance and publish immutable
 * snapshots through volatile fields, so trading code reads a consistent schedule without locking.
 */
@Component
public class AdminControls {

    private static final Logger logger = LoggerFactory.getLogger(AdminControls.class);

    private final LiquidityVenueRegistry venues;
    private final Set<String> feeExempt = ConcurrentHashMap.newKeySet();

    private volatile FeeSchedule fees;
    private volatile ProtocolSettings settings;
    private volatile boolean paused;

    public AdminControls(final FeeSchedule fees,
                         final ProtocolSettings settings,
                         final LiquidityVenueRegistry venues) {
        this.venues = venues;
        this.fees = fees;
        this.settings = settings;
        Result<FeeSchedule, DomainError> valid = validateFees(fees.buyFeeBps(), fees.sellFeeBps(),
                fees.creatorBps(), fees.burnBps(), fees.liquidityBps());
        if (valid.isErr()) {
            throw new IllegalStateException("Invalid configured fee schedule: " + valid.getErrorUnsafe().message());
        }
        if (!venues.contains(settings.activeVenue())) {
            throw new IllegalStateException("Configured liquidity venue '" + settings.activeVenue()
                    + "' is not registered; available " + venues.names());
        }
    }

    // ========================================
    // READS
    // ========================================

    public FeeSchedule fees() {
        return fees;
    }

    public ProtocolSettings settings() {
        return settings;
    }

    public boolean isPaused() {
        return paused;
    }

    public boolean isFeeExempt(final String account) {
        return account != null && feeExempt.contains(CallerContext.normalize(account));
    }

    public Set<String> feeExemptAccounts() {
        return new TreeSet<>(feeExempt);
    }

    public Optional<LiquidityVenue> activeVenue() {
        return venues.find(settings.activeVenue());
    }

    public Result<Void, DomainError> requireNotPaused(final String operation) {
        if (paused) {
            return Result.err(new PausedError("Protocol is paused; " + operation + " rejected"));
        }
        return Result.ok(null);
    }

    public Result<Void, DomainError> requireOwner(final CallerContext ctx) {
        String owner = settings.owner();
        if (owner == null || owner.isBlank() || !ctx.is(owner)) {
            return Result.err(new UnauthorizedError("Account " + ctx.account() + " is not the protocol owner"));
        }
        return Result.ok(null);
    }

    // ========================================
    // OWNER OPERATIONS
    // ========================================

    public synchronized Result<FeeSchedule, DomainError> setFees(final CallerContext ctx,
                                                                 final int buyFeeBps,
                                                                 final int sellFeeBps,
                                                                 final int creatorBps,
                                                                 final int burnBps,
                                                                 final int liquidityBps) {
        return requireOwner(ctx)
                .flatMap(ok -> validateFees(buyFeeBps, sellFeeBps, creatorBps, burnBps, liquidityBps))
                .map(schedule -> {
                    fees = schedule;
                    logger.info("[Admin] setFees by={} buy={} sell={} creator={} burn={} liquidity={}",
                            ctx.account(), buyFeeBps, sellFeeBps, creatorBps, burnBps, liquidityBps);
                    return schedule;
                });
    }

    public synchronized Result<Boolean, DomainError> setPaused(final CallerContext ctx, final boolean pause) {
        return requireOwner(ctx).map(ok -> {
            paused = pause;
            logger.info("[Admin] setPaused by={} paused={}", ctx.account(), pause);
            return pause;
        });
    }

    public synchronized Result<String, DomainError> setLiquidityVenue(final CallerContext ctx, final String venueName) {
        return requireOwner(ctx).<String>flatMap(ok -> {
            if (!venues.contains(venueName)) {
                return Result.err(new InvalidParameterError(
                        "Unknown liquidity venue '" + venueName + "'; available " + venues.names()));
            }
            settings = settings.withActiveVenue(venueName);
            logger.info("[Admin] setLiquidityVenue by={} venue={}", ctx.account(), venueName);
            return Result.ok(venueName);
        });
    }

    public synchronized Result<String, DomainError> setTreasury(final CallerContext ctx, final String treasury) {
        return requireOwner(ctx)
                .flatMap(ok -> validAccount("treasury", treasury))
                .map(account -> {
                    settings = settings.withTreasury(account);
                    logger.info("[Admin] setTreasury by={} treasury={}", ctx.account(), account);
                    return account;
                });
    }

    public synchronized Result<String, DomainError> setLpRecipient(final CallerContext ctx, final String lpRecipient) {
        return requireOwner(ctx)
                .flatMap(ok -> validAccount("lpRecipient", lpRecipient))
                .map(account -> {
                    settings = settings.withLpRecipient(account);
                    logger.info("[Admin] setLpRecipient by={} lpRecipient={}", ctx.account(), account);
                    return account;
                });
    }

    public synchronized Result<BigInteger, DomainError> setCreationFee(final CallerContext ctx, final BigInteger creationFee) {
        return requireOwner(ctx).<BigInteger>flatMap(ok -> {
            if (creationFee == null || creationFee.signum() < 0) {
                return Result.err(new InvalidParameterError("Creation fee must be zero or positive"));
            }
            settings = settings.withCreationFee(creationFee);
            logger.info("[Admin] setCreationFee by={} fee={}", ctx.account(), creationFee);
            return Result.ok(creationFee);
        });
    }

    public synchronized Result<Boolean, DomainError> setFeeExempt(final CallerContext ctx,
                                                                  final String account,
                                                                  final boolean exempt) {
        return requireOwner(ctx)
                .flatMap(ok -> validAccount("account", account))
                .map(normalized -> {
                    if (exempt) {
                        feeExempt.add(normalized);
                    } else {
                        feeExempt.remove(normalized);
                    }
                    logger.info("[Admin] setFeeExempt by={} account={} exempt={}", ctx.account(), normalized, exempt);
                    return exempt;
                });
    }

    public synchronized Result<String, DomainError> transferOwnership(final CallerContext ctx, final String newOwner) {
        return requireOwner(ctx)
                .flatMap(ok -> validAccount("owner", newOwner))
                .map(account -> {
                    settings = settings.withOwner(account);
                    logger.info("[Admin] transferOwnership from={} to={}", ctx.account(), account);
                    return account;
                });
    }

    // ========================================
    // VALIDATION
    // ========================================

    static Result<FeeSchedule, DomainError> validateFees(final int buyFeeBps,
                                                         final int sellFeeBps,
                                                         final int creatorBps,
                                                         final int burnBps,
                                                         final int liquidityBps) {
        if (buyFeeBps < 0 || buyFeeBps > LaunchpadConstants.MAX_TRADE_FEE_BPS) {
            return Result.err(new InvalidParameterError("Buy fee must be within [0, "
                    + LaunchpadConstants.MAX_TRADE_FEE_BPS + "] bps, got " + buyFeeBps));
        }
        if (sellFeeBps < 0 || sellFeeBps > LaunchpadConstants.MAX_TRADE_FEE_BPS) {
            return Result.err(new InvalidParameterError("Sell fee must be within [0, "
                    + LaunchpadConstants.MAX_TRADE_FEE_BPS + "] bps, got " + sellFeeBps));
        }
        if (creatorBps < 0 || burnBps < 0 || liquidityBps < 0) {
            return Result.err(new InvalidParameterError("Graduation allocations must not be negative"));
        }
        int allocation = creatorBps + burnBps + liquidityBps;
        if (allocation > LaunchpadConstants.BPS_100_PERCENT) {
            return Result.err(new InvalidParameterError("Graduation allocations sum to " + allocation
                    + " bps, above " + LaunchpadConstants.BPS_100_PERCENT));
        }
        return Result.ok(new FeeSchedule(buyFeeBps, sellFeeBps, creatorBps, burnBps, liquidityBps));
    }

    private static Result<String, DomainError> validAccount(final String field, final String account) {
        if (account == null || account.isBlank()) {
            return Result.err(new InvalidParameterError(field + " must not be blank"));
        }
        if (account.length() > LaunchpadConstants.MAX_ACCOUNT_LENGTH) {
            return Result.err(new InvalidParameterError(field + " exceeds " + LaunchpadConstants.MAX_ACCOUNT_LENGTH + " characters"));
        }
        return Result.ok(CallerContext.normalize(account));
    }
}
