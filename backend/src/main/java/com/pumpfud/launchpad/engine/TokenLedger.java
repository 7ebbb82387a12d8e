// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.engine;

import com.pumpfud.launchpad.common.DomainError;
import com.pumpfud.launchpad.common.Result;
import com.pumpfud.launchpad.common.errors.AllowanceExceededError;
import com.pumpfud.launchpad.common.errors.InsufficientBalanceError;
import com.pumpfud.launchpad.common.errors.InvalidParameterError;
import com.pumpfud.launchpad.common.errors.ZeroAmountError;
import com.pumpfud.launchpad.constants.LaunchpadConstants;
import com.pumpfud.launchpad.model.CallerContext;
import com.pumpfud.launchpad.util.CurveMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Fungible balances of launched tokens.
 *
 * Holders move their own balance with {@link #transfer} and delegate with {@link #approve} /
 * {@link #transferFrom}. Minting and burning are package-private: only the curve, the burn
 * redemption and graduation change supply.
 */
@Component
public class TokenLedger {

    private static final Logger logger = LoggerFactory.getLogger(TokenLedger.class);

    private final TokenTransactions transactions;
    private final TokenBalanceBook balances;
    private final TokenLocks locks;

    public TokenLedger(final TokenTransactions transactions,
                       final TokenBalanceBook balances,
                       final TokenLocks locks) {
        this.transactions = transactions;
        this.balances = balances;
        this.locks = locks;
    }

    public BigInteger balanceOf(final long tokenId, final String owner) {
        return locks.withReadLock(tokenId, () -> balances.balance(tokenId, CallerContext.normalize(owner)))
                .orElse(BigInteger.ZERO);
    }

    public BigInteger allowance(final long tokenId, final String owner, final String spender) {
        return locks.withReadLock(tokenId,
                () -> balances.allowance(tokenId, CallerContext.normalize(owner), CallerContext.normalize(spender)))
                .orElse(BigInteger.ZERO);
    }

    /**
     * Number of accounts with a non-zero balance.
     */
    public int holderCount(final long tokenId) {
        return locks.withReadLock(tokenId, () -> balances.holderCount(tokenId)).orElse(0);
    }

    public BigInteger totalBalances(final long tokenId) {
        return locks.withReadLock(tokenId, () -> balances.total(tokenId)).orElse(BigInteger.ZERO);
    }

    public Result<BigInteger, DomainError> transfer(final CallerContext ctx,
                                                    final long tokenId,
                                                    final String to,
                                                    final BigInteger amount) {
        Result<BigInteger, DomainError> result = transactions.execute(tokenId, tx ->
                validRecipient(to)
                        .flatMap(recipient -> requirePositive(amount)
                                .flatMap(ok -> move(tx, ctx.account(), recipient, amount))));
        if (result.isOk()) {
            logger.info("[Ledger] transfer token={} from={} to={} amount={}", tokenId, ctx.account(), to, amount);
        }
        return result;
    }

    public Result<BigInteger, DomainError> approve(final CallerContext ctx,
                                                   final long tokenId,
                                                   final String spender,
                                                   final BigInteger amount) {
        Result<BigInteger, DomainError> result = transactions.execute(tokenId, tx ->
                validRecipient(spender).<BigInteger>flatMap(normalizedSpender -> {
                    if (amount == null || amount.signum() < 0) {
                        return Result.err(new InvalidParameterError("Allowance must be zero or positive"));
                    }
                    tx.setAllowance(ctx.account(), normalizedSpender, amount);
                    return Result.ok(amount);
                }));
        if (result.isOk()) {
            logger.info("[Ledger] approve token={} owner={} spender={} amount={}", tokenId, ctx.account(), spender, amount);
        }
        return result;
    }

    /**
     * Moves {@code amount} from {@code from} to {@code to} on the caller's allowance.
     */
    public Result<BigInteger, DomainError> transferFrom(final CallerContext ctx,
                                                        final long tokenId,
                                                        final String from,
                                                        final String to,
                                                        final BigInteger amount) {
        Result<BigInteger, DomainError> result = transactions.execute(tokenId, tx ->
                validRecipient(from).<BigInteger>flatMap(owner -> validRecipient(to).<BigInteger>flatMap(recipient -> {
                    Result<Void, DomainError> positive = requirePositive(amount);
                    if (positive.isErr()) {
                        return positive.propagate();
                    }
                    BigInteger allowed = tx.allowance(owner, ctx.account());
                    if (allowed.compareTo(amount) < 0) {
                        return Result.err(new AllowanceExceededError("Allowance " + allowed + " of "
                                + ctx.account() + " over " + owner + " is below " + amount));
                    }
                    Result<BigInteger, DomainError> moved = move(tx, owner, recipient, amount);
                    if (moved.isOk()) {
                        tx.setAllowance(owner, ctx.account(), allowed.subtract(amount));
                    }
                    return moved;
                })));
        if (result.isOk()) {
            logger.info("[Ledger] transferFrom token={} spender={} from={} to={} amount={}",
                    tokenId, ctx.account(), from, to, amount);
        }
        return result;
    }

    // ========================================
    // ENGINE-ONLY SUPPLY CHANGES
    // ========================================

    void mint(final EngineTransaction tx, final String to, final BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Cannot mint a negative amount");
        }
        tx.adjustTokens(to, amount);
    }

    Result<Void, DomainError> burn(final EngineTransaction tx, final String from, final BigInteger amount) {
        BigInteger held = tx.tokenBalance(from);
        if (held.compareTo(amount) < 0) {
            return Result.err(new InsufficientBalanceError("Balance " + held + " of " + from + " is below " + amount));
        }
        tx.adjustTokens(from, amount.negate());
        return Result.ok(null);
    }

    private Result<BigInteger, DomainError> move(final EngineTransaction tx,
                                                 final String from,
                                                 final String to,
                                                 final BigInteger amount) {
        Result<Void, DomainError> debited = burn(tx, from, amount);
        if (debited.isErr()) {
            return debited.propagate();
        }
        mint(tx, to, amount);
        return Result.ok(amount);
    }

    private static Result<Void, DomainError> requirePositive(final BigInteger amount) {
        if (!CurveMath.isPositive(amount)) {
            return Result.err(new ZeroAmountError("Amount must be positive"));
        }
        return Result.ok(null);
    }

    private static Result<String, DomainError> validRecipient(final String account) {
        if (account == null || account.isBlank()) {
            return Result.err(new InvalidParameterError("Account must not be blank"));
        }
        if (account.length() > LaunchpadConstants.MAX_ACCOUNT_LENGTH) {
            return Result.err(new InvalidParameterError("Account exceeds " + LaunchpadConstants.MAX_ACCOUNT_LENGTH + " characters"));
        }
        return Result.ok(CallerContext.normalize(account));
    }
}
