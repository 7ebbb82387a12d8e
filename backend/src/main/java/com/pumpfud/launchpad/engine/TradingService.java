// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.engine;

import com.pumpfud.launchpad.common.DomainError;
import com.pumpfud.launchpad.common.Result;
import com.pumpfud.launchpad.common.errors.AlreadyGraduatedError;
import com.pumpfud.launchpad.common.errors.InsufficientBalanceError;
import com.pumpfud.launchpad.common.errors.InsufficientPaymentError;
import com.pumpfud.launchpad.common.errors.SlippageExceededError;
import com.pumpfud.launchpad.common.errors.ZeroAmountError;
import com.pumpfud.launchpad.constants.LaunchpadConstants;
import com.pumpfud.launchpad.metrics.LaunchpadMetrics;
import com.pumpfud.launchpad.model.CallerContext;
import com.pumpfud.launchpad.model.CurveProgress;
import com.pumpfud.launchpad.model.CurveQuote;
import com.pumpfud.launchpad.model.FeeSplit;
import com.pumpfud.launchpad.model.GraduationAllocation;
import com.pumpfud.launchpad.model.TokenRecord;
import com.pumpfud.launchpad.model.TradeQuote;
import com.pumpfud.launchpad.model.TradeReceipt;
import com.pumpfud.launchpad.model.TradeSide;
import com.pumpfud.launchpad.service.TradeHistoryService;
import com.pumpfud.launchpad.service.TraderStatsService;
import com.pumpfud.launchpad.util.CurveMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Trading surface of the engine: buy, sell, burn, quotes and curve state.
 *
 * VALIDATION ORDER (buy, sell, burn):
 * InvalidToken, AlreadyGraduated, Paused, ZeroAmount, payment or balance, curve,
 * SlippageExceeded, payouts, graduation. The first failure aborts the operation and nothing is
 * persisted.
 */
@Component
public class TradingService {

    private static final Logger logger = LoggerFactory.getLogger(TradingService.class);

    private final TokenTransactions transactions;
    private final BondingCurveEngine curve;
    private final FeeDistributor fees;
    private final GraduationCoordinator graduation;
    private final TokenLedger ledger;
    private final AdminControls admin;
    private final TradeHistoryService history;
    private final TraderStatsService stats;
    private final LaunchpadMetrics metrics;
    private final Clock clock;

    public TradingService(final TokenTransactions transactions,
                          final BondingCurveEngine curve,
                          final FeeDistributor fees,
                          final GraduationCoordinator graduation,
                          final TokenLedger ledger,
                          final AdminControls admin,
                          final TradeHistoryService history,
                          final TraderStatsService stats,
                          final LaunchpadMetrics metrics,
                          final Clock clock) {
        this.transactions = transactions;
        this.curve = curve;
        this.fees = fees;
        this.graduation = graduation;
        this.ledger = ledger;
        this.admin = admin;
        this.history = history;
        this.stats = stats;
        this.metrics = metrics;
        this.clock = clock;
    }

    // ========================================
    // MUTATIONS
    // ========================================

    /**
     * Spends {@code baseAmountIn} of the caller's base balance on tokens.
     *
     * @param minTokensOut fewest tokens the caller accepts; null means no bound
     * @param referrer     optional account that receives the referral share of the fee
     */
    public Result<TradeReceipt, DomainError> buy(final CallerContext ctx,
                                                 final long tokenId,
                                                 final BigInteger baseAmountIn,
                                                 final BigInteger minTokensOut,
                                                 final String referrer) {
        long started = System.nanoTime();
        String trader = ctx.account();
        Result<TradeReceipt, DomainError> result = transactions.execute(tokenId, tx -> {
            TokenRecord token = tx.record();
            Result<Void, DomainError> open = requireTradable(token, "buy");
            if (open.isErr()) {
                return open.propagate();
            }
            if (!CurveMath.isPositive(baseAmountIn)) {
                return Result.err(new ZeroAmountError("Buy amount must be positive"));
            }
            BigInteger available = tx.baseBalance(trader);
            if (available.compareTo(baseAmountIn) < 0) {
                return Result.err(new InsufficientPaymentError("Balance " + available + " of " + trader
                        + " cannot cover " + baseAmountIn));
            }

            FeeSplit split = fees.split(baseAmountIn, fees.buyFeeBps(trader), referrer, trader);
            Result<CurveQuote, DomainError> quoted = curve.quoteBuy(token, split.netAmount());
            if (quoted.isErr()) {
                return quoted.propagate();
            }
            CurveQuote quote = quoted.getValueUnsafe();
            BigInteger minimum = orZero(minTokensOut);
            if (quote.amountOut().compareTo(minimum) < 0) {
                return Result.err(new SlippageExceededError(minimum, quote.amountOut()));
            }

            tx.adjustBase(trader, baseAmountIn.negate());
            Result<Void, DomainError> routed = fees.route(tx, split);
            if (routed.isErr()) {
                return routed.propagate();
            }
            curve.applyBuy(tx, quote, baseAmountIn);
            ledger.mint(tx, trader, quote.amountOut());

            Result<Optional<GraduationAllocation>, DomainError> graduated = graduation.checkAndGraduate(tx);
            if (graduated.isErr()) {
                return graduated.propagate();
            }
            return committed(tx, new TradeReceipt(tokenId, TradeSide.BUY, trader, baseAmountIn, quote.amountOut(),
                    split.fee(), split.referrerCut(), curve.price(tx.record()), graduated.getValueUnsafe().isPresent()),
                    split.referrer());
        });
        return finish("buy", tokenId, trader, result, started);
    }

    /**
     * Returns {@code tokensIn} of the caller's tokens to the curve for base currency, net of the
     * sell fee.
     *
     * @param minBaseOut least net base the caller accepts; null means no bound
     */
    public Result<TradeReceipt, DomainError> sell(final CallerContext ctx,
                                                  final long tokenId,
                                                  final BigInteger tokensIn,
                                                  final BigInteger minBaseOut,
                                                  final String referrer) {
        long started = System.nanoTime();
        String trader = ctx.account();
        Result<TradeReceipt, DomainError> result = transactions.execute(tokenId, tx -> {
            TokenRecord token = tx.record();
            Result<Void, DomainError> open = requireTradable(token, "sell");
            if (open.isErr()) {
                return open.propagate();
            }
            if (!CurveMath.isPositive(tokensIn)) {
                return Result.err(new ZeroAmountError("Sell amount must be positive"));
            }
            BigInteger held = tx.tokenBalance(trader);
            if (held.compareTo(tokensIn) < 0) {
                return Result.err(new InsufficientBalanceError("Balance " + held + " of " + trader + " is below " + tokensIn));
            }

            Result<CurveQuote, DomainError> quoted = curve.quoteSell(token, tokensIn);
            if (quoted.isErr()) {
                return quoted.propagate();
            }
            CurveQuote quote = quoted.getValueUnsafe();
            FeeSplit split = fees.split(quote.amountOut(), fees.sellFeeBps(trader), referrer, trader);
            BigInteger minimum = orZero(minBaseOut);
            if (split.netAmount().compareTo(minimum) < 0) {
                return Result.err(new SlippageExceededError(minimum, split.netAmount()));
            }

            Result<Void, DomainError> burned = ledger.burn(tx, trader, tokensIn);
            if (burned.isErr()) {
                return burned.propagate();
            }
            curve.applySell(tx, quote);
            tx.adjustBase(trader, split.netAmount());
            Result<Void, DomainError> routed = fees.route(tx, split);
            if (routed.isErr()) {
                return routed.propagate();
            }
            return committed(tx, new TradeReceipt(tokenId, TradeSide.SELL, trader, split.netAmount(), tokensIn,
                    split.fee(), split.referrerCut(), curve.price(tx.record()), false), split.referrer());
        });
        return finish("sell", tokenId, trader, result, started);
    }

    /**
     * Redeems tokens for a pro-rata share of the real reserve: {@code tokensIn * realReserve / tokensSold}.
     * No fee is charged and the curve position is left untouched.
     */
    public Result<TradeReceipt, DomainError> burn(final CallerContext ctx, final long tokenId, final BigInteger tokensIn) {
        long started = System.nanoTime();
        String trader = ctx.account();
        Result<TradeReceipt, DomainError> result = transactions.execute(tokenId, tx -> {
            TokenRecord token = tx.record();
            Result<Void, DomainError> open = requireTradable(token, "burn");
            if (open.isErr()) {
                return open.propagate();
            }
            if (!CurveMath.isPositive(tokensIn)) {
                return Result.err(new ZeroAmountError("Burn amount must be positive"));
            }
            Result<Void, DomainError> burned = ledger.burn(tx, trader, tokensIn);
            if (burned.isErr()) {
                return burned.propagate();
            }

            BigInteger baseOut = CurveMath.mulDiv(tokensIn, token.getRealReserve(), token.getTokensSold());
            token.setRealReserve(token.getRealReserve().subtract(baseOut));
            token.setTotalBurned(token.getTotalBurned().add(tokensIn));
            BondingCurveEngine.recordTrade(token, baseOut);
            tx.adjustBase(trader, baseOut);
            return committed(tx, new TradeReceipt(tokenId, TradeSide.BURN, trader, baseOut, tokensIn,
                    BigInteger.ZERO, BigInteger.ZERO, curve.price(token), false), null);
        });
        return finish("burn", tokenId, trader, result, started);
    }

    // ========================================
    // READS
    // ========================================

    /**
     * Fee-inclusive buy quote at the regular (non-exempt) fee rate.
     */
    public Result<TradeQuote, DomainError> quoteBuy(final long tokenId, final BigInteger baseAmountIn) {
        return transactions.read(tokenId, token -> {
            Result<Void, DomainError> active = requireActive(token);
            if (active.isErr()) {
                return active.propagate();
            }
            if (!CurveMath.isPositive(baseAmountIn)) {
                return Result.err(new ZeroAmountError("Buy amount must be positive"));
            }
            FeeSplit split = FeeDistributor.split(baseAmountIn, admin.fees().buyFeeBps(), null, null, 0);
            return curve.quoteBuy(token, split.netAmount()).map(quote -> new TradeQuote(tokenId, TradeSide.BUY,
                    baseAmountIn, split.fee(), quote.amountOut(), quote.priceBefore(), quote.priceAfter()));
        });
    }

    /**
     * Net base the caller would receive for {@code tokensIn}, at the regular sell fee rate.
     */
    public Result<TradeQuote, DomainError> quoteSell(final long tokenId, final BigInteger tokensIn) {
        return transactions.read(tokenId, token -> {
            Result<Void, DomainError> active = requireActive(token);
            if (active.isErr()) {
                return active.propagate();
            }
            return curve.quoteSell(token, tokensIn).map(quote -> {
                FeeSplit split = FeeDistributor.split(quote.amountOut(), admin.fees().sellFeeBps(), null, null, 0);
                return new TradeQuote(tokenId, TradeSide.SELL, tokensIn, split.fee(), split.netAmount(),
                        quote.priceBefore(), quote.priceAfter());
            });
        });
    }

    public Result<BigInteger, DomainError> price(final long tokenId) {
        return transactions.read(tokenId, token -> Result.ok(curve.price(token)));
    }

    public Result<CurveProgress, DomainError> bondingCurveProgress(final long tokenId) {
        return transactions.read(tokenId, token -> {
            BigInteger target = token.getGraduationThreshold();
            int progressBps = token.isGraduated()
                    ? LaunchpadConstants.BPS_100_PERCENT
                    : CurveMath.mulDiv(token.getRealReserve(), LaunchpadConstants.BPS_DENOMINATOR, target)
                        .min(LaunchpadConstants.BPS_DENOMINATOR)
                        .intValueExact();
            return Result.ok(new CurveProgress(token.getRealReserve(), target, progressBps, token.getTokensSold()));
        });
    }

    // ========================================
    // HELPERS
    // ========================================

    private Result<Void, DomainError> requireTradable(final TokenRecord token, final String operation) {
        Result<Void, DomainError> active = requireActive(token);
        if (active.isErr()) {
            return active;
        }
        return admin.requireNotPaused(operation);
    }

    private static Result<Void, DomainError> requireActive(final TokenRecord token) {
        if (token.isGraduated()) {
            return Result.err(new AlreadyGraduatedError("Token " + token.getId() + " has graduated; trade it on the liquidity venue"));
        }
        return Result.ok(null);
    }

    /**
     * Feeds the trade history and trader statistics once the trade is published. Both run under
     * the token's write lock, so a token's feed lists its trades in commit order.
     */
    private Result<TradeReceipt, DomainError> committed(final EngineTransaction tx,
                                                        final TradeReceipt receipt,
                                                        final String referrer) {
        tx.afterCommit(() -> {
            Instant executedAt = clock.instant();
            history.record(receipt, executedAt);
            stats.record(receipt, referrer, executedAt);
        });
        return Result.ok(receipt);
    }

    private Result<TradeReceipt, DomainError> finish(final String operation,
                                                     final long tokenId,
                                                     final String trader,
                                                     final Result<TradeReceipt, DomainError> result,
                                                     final long startedNanos) {
        if (result.isErr()) {
            DomainError error = result.getErrorUnsafe();
            metrics.recordRejected(operation, error.code());
            logger.warn("[Trade] {} rejected token={} trader={}: {}", operation, tokenId, trader, error);
            return result;
        }
        TradeReceipt receipt = result.getValueUnsafe();
        metrics.recordTrade(receipt.side(), receipt.baseAmount(), System.nanoTime() - startedNanos);
        if (receipt.graduated()) {
            metrics.recordGraduation();
        }
        logger.info("[Trade] {} token={} trader={} base={} tokens={} fee={} priceAfter={} graduated={}",
                operation, tokenId, trader, receipt.baseAmount(), receipt.tokenAmount(), receipt.fee(),
                receipt.priceAfter(), receipt.graduated());
        return result;
    }

    private static BigInteger orZero(final BigInteger value) {
        return value == null ? BigInteger.ZERO : value;
    }
}
