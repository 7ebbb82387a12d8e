// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.engine;

import com.pumpfud.launchpad.common.DomainError;
import com.pumpfud.launchpad.common.Result;
import com.pumpfud.launchpad.common.errors.ExternalTransferFailedError;
import com.pumpfud.launchpad.constants.LaunchpadConstants;
import com.pumpfud.launchpad.model.FeeSchedule;
import com.pumpfud.launchpad.model.GraduationAllocation;
import com.pumpfud.launchpad.model.TokenRecord;
import com.pumpfud.launchpad.model.TokenStatus;
import com.pumpfud.launchpad.util.CurveMath;
import com.pumpfud.launchpad.venue.LiquidityReceipt;
import com.pumpfud.launchpad.venue.LiquidityRequest;
import com.pumpfud.launchpad.venue.LiquidityVenue;
import com.pumpfud.launchpad.venue.LiquidityVenueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Graduates a token inside the buy that pushes its real reserve to the threshold.
 *
 * ALLOCATION (T = graduation threshold):
 * - burn: T * burnBps, sent to the burn address
 * - liquidity: T * liquidityBps of base, plus tokens minted at the final curve price, handed to
 *   the active venue
 * - creator: T * creatorBps, paid to the token's creator
 * - remainder: stays in the real reserve
 *
 * The venue call runs as a pre-commit hook of the triggering buy. If it fails the buy fails with
 * it and nothing is persisted.
 */
@Component
public class GraduationCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(GraduationCoordinator.class);

    private final AdminControls admin;
    private final TokenLedger ledger;
    private final FeeDistributor fees;
    private final Clock clock;
    private final int liquiditySlippageBps;
    private final long deadlineSeconds;

    public GraduationCoordinator(final AdminControls admin,
                                 final TokenLedger ledger,
                                 final FeeDistributor fees,
                                 final Clock clock,
                                 @Value("${launchpad.graduation.liquidity-slippage-bps:100}") final int liquiditySlippageBps,
                                 @Value("${launchpad.graduation.deadline-seconds:600}") final long deadlineSeconds) {
        if (liquiditySlippageBps < 0 || liquiditySlippageBps > LaunchpadConstants.BPS_100_PERCENT) {
            throw new IllegalArgumentException("liquiditySlippageBps out of range: " + liquiditySlippageBps);
        }
        this.admin = admin;
        this.ledger = ledger;
        this.fees = fees;
        this.clock = clock;
        this.liquiditySlippageBps = liquiditySlippageBps;
        this.deadlineSeconds = deadlineSeconds;
    }

    public boolean isDue(final TokenRecord token) {
        return !token.isGraduated() && token.getRealReserve().compareTo(token.getGraduationThreshold()) >= 0;
    }

    /**
     * Allocation the token would receive if it graduated now.
     */
    public GraduationAllocation allocate(final TokenRecord token, final FeeSchedule schedule) {
        BigInteger threshold = token.getGraduationThreshold();
        BigInteger burn = CurveMath.bps(threshold, schedule.burnBps());
        BigInteger liquidityBase = CurveMath.bps(threshold, schedule.liquidityBps());
        BigInteger creator = CurveMath.bps(threshold, schedule.creatorBps());

        BigInteger headroom = token.getMaxSupply()
                .subtract(token.getTokensSold())
                .subtract(token.getLiquidityTokensMinted())
                .max(BigInteger.ZERO);
        BigInteger liquidityTokens = CurveMath.mulDiv(liquidityBase, token.effectiveTokenReserve(), token.effectiveBaseReserve())
                .min(headroom);

        BigInteger remainder = token.getRealReserve().subtract(burn).subtract(liquidityBase).subtract(creator);
        return new GraduationAllocation(token.getId(), burn, liquidityBase, liquidityTokens, creator, remainder);
    }

    /**
     * Graduates the transaction's token when it is due. Returns the executed allocation, or
     * empty when nothing happened.
     */
    Result<Optional<GraduationAllocation>, DomainError> checkAndGraduate(final EngineTransaction tx) {
        TokenRecord token = tx.record();
        if (!isDue(token)) {
            return Result.ok(Optional.empty());
        }

        Optional<LiquidityVenue> venue = admin.activeVenue();
        if (venue.isEmpty()) {
            return Result.err(new ExternalTransferFailedError("No liquidity venue available for graduation"));
        }
        LiquidityVenue target = venue.get();
        GraduationAllocation allocation = allocate(token, admin.fees());

        tx.adjustBase(LaunchpadConstants.BURN_ADDRESS, allocation.burnAmount());
        Result<Void, DomainError> creatorPaid = fees.payout(tx, token.getCreator(), allocation.creatorReward(), "creator reward");
        if (creatorPaid.isErr()) {
            return creatorPaid.propagate();
        }
        tx.adjustBase(target.custodyAccount(), allocation.liquidityBaseAmount());
        ledger.mint(tx, target.custodyAccount(), allocation.liquidityTokenAmount());

        Instant now = clock.instant();
        token.setLiquidityTokensMinted(token.getLiquidityTokensMinted().add(allocation.liquidityTokenAmount()));
        token.setRealReserve(allocation.remainder());
        token.setStatus(TokenStatus.GRADUATED);
        token.setGraduatedAt(now);

        LiquidityRequest request = new LiquidityRequest(
                token.getId(),
                token.getSymbol(),
                allocation.liquidityTokenAmount(),
                allocation.liquidityBaseAmount(),
                minimumAccepted(allocation.liquidityTokenAmount()),
                minimumAccepted(allocation.liquidityBaseAmount()),
                lpRecipient(),
                now.getEpochSecond() + deadlineSeconds);
        if (allocation.liquidityBaseAmount().signum() > 0 || allocation.liquidityTokenAmount().signum() > 0) {
            tx.beforeCommit(() -> addLiquidity(target, request, token));
        }

        logger.info("[Graduation] token={} symbol={} burn={} liquidityBase={} liquidityTokens={} creator={} remainder={}",
                token.getId(), token.getSymbol(), allocation.burnAmount(), allocation.liquidityBaseAmount(),
                allocation.liquidityTokenAmount(), allocation.creatorReward(), allocation.remainder());
        return Result.ok(Optional.of(allocation));
    }

    private Result<Void, DomainError> addLiquidity(final LiquidityVenue venue,
                                                   final LiquidityRequest request,
                                                   final TokenRecord token) {
        try {
            LiquidityReceipt receipt = venue.addLiquidity(request);
            token.setLiquidityPoolRef(receipt.poolRef());
            logger.info("[Graduation] token={} venue={} pool={} lp={} lpRecipient={}",
                    request.tokenId(), venue.name(), receipt.poolRef(), receipt.lpAmount(), request.recipient());
            return Result.ok(null);
        } catch (LiquidityVenueException | RuntimeException e) {
            logger.warn("[Graduation] token={} venue={} addLiquidity failed: {}",
                    request.tokenId(), venue.name(), e.getMessage());
            return Result.err(new ExternalTransferFailedError(
                    "Liquidity venue '" + venue.name() + "' failed: " + e.getMessage()));
        }
    }

    private BigInteger minimumAccepted(final BigInteger amount) {
        return CurveMath.bps(amount, LaunchpadConstants.BPS_100_PERCENT - liquiditySlippageBps);
    }

    private String lpRecipient() {
        String recipient = admin.settings().lpRecipient();
        return recipient == null || recipient.isBlank() ? LaunchpadConstants.BURN_ADDRESS : recipient;
    }
}
