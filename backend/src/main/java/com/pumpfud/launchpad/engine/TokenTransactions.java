// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.engine;

import com.pumpfud.launchpad.common.DomainError;
import com.pumpfud.launchpad.common.Result;
import com.pumpfud.launchpad.common.errors.InvalidTokenError;
import com.pumpfud.launchpad.model.TokenRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.Function;

/**
 * Runs engine operations as all-or-nothing units of work.
 *
 * A mutation runs under the token's write lock against an {@link EngineTransaction}. An
 * {@code Err} result discards the transaction. An {@code Ok} result is committed: the base
 * debits are re-verified and reserved, pre-commit hooks run, the reservation is settled, token
 * balances and the record snapshot are published, and after-commit steps run. A failed hook
 * releases the reservation. Everything from the reservation on holds the token's write lock
 * only, so a slow hook never delays other tokens.
 */
@Component
public class TokenTransactions {

    private static final Logger logger = LoggerFactory.getLogger(TokenTransactions.class);

    private final TokenStore store;
    private final TokenLocks locks;
    private final TokenBalanceBook balances;
    private final BaseLedger baseLedger;

    public TokenTransactions(final TokenStore store,
                             final TokenLocks locks,
                             final TokenBalanceBook balances,
                             final BaseLedger baseLedger) {
        this.store = store;
        this.locks = locks;
        this.balances = balances;
        this.baseLedger = baseLedger;
    }

    /**
     * Runs {@code work} against a working copy of an existing token.
     */
    <T> Result<T, DomainError> execute(final long tokenId,
                                       final Function<EngineTransaction, Result<T, DomainError>> work) {
        return locks.withWriteLock(tokenId, () -> {
            Optional<TokenRecord> current = store.find(tokenId);
            if (current.isEmpty()) {
                return TokenTransactions.<T>unknown(tokenId);
            }
            return runAndCommit(new EngineTransaction(current.get().copy(), balances, baseLedger), work);
        }).orElseGet(() -> unknown(tokenId));
    }

    /**
     * Runs {@code work} for a token that is not stored yet. The caller serializes creations.
     */
    <T> Result<T, DomainError> executeNew(final TokenRecord fresh,
                                          final Function<EngineTransaction, Result<T, DomainError>> work) {
        locks.register(fresh.getId());
        return locks.withWriteLock(fresh.getId(),
                        () -> runAndCommit(new EngineTransaction(fresh, balances, baseLedger), work))
                .orElseThrow(() -> new IllegalStateException("No lock for new token " + fresh.getId()));
    }

    /**
     * Runs a read against the committed snapshot under the token's read lock.
     */
    public <T> Result<T, DomainError> read(final long tokenId,
                                           final Function<TokenRecord, Result<T, DomainError>> query) {
        return locks.withReadLock(tokenId, () -> store.find(tokenId)
                        .map(query)
                        .orElseGet(() -> unknown(tokenId)))
                .orElseGet(() -> unknown(tokenId));
    }

    private static <T> Result<T, DomainError> unknown(final long tokenId) {
        return Result.err(new InvalidTokenError("Unknown token id " + tokenId));
    }

    private <T> Result<T, DomainError> runAndCommit(final EngineTransaction tx,
                                                    final Function<EngineTransaction, Result<T, DomainError>> work) {
        Result<T, DomainError> outcome = work.apply(tx);
        if (outcome.isErr()) {
            logger.debug("[Tx] token={} rolled back: {}", tx.tokenId(), outcome.getErrorUnsafe());
            return outcome;
        }
        Result<Void, DomainError> committed = commit(tx);
        if (committed.isErr()) {
            logger.warn("[Tx] token={} commit aborted: {}", tx.tokenId(), committed.getErrorUnsafe());
            return committed.propagate();
        }
        return outcome;
    }

    private Result<Void, DomainError> commit(final EngineTransaction tx) {
        Result<BaseLedger.Reservation, DomainError> reserved = baseLedger.reserve(tx.baseDeltas());
        if (reserved.isErr()) {
            return reserved.propagate();
        }
        BaseLedger.Reservation reservation = reserved.getValueUnsafe();
        boolean settled = false;
        try {
            for (EngineTransaction.PreCommitHook hook : tx.hooks()) {
                Result<Void, DomainError> hookResult = hook.run();
                if (hookResult.isErr()) {
                    return hookResult;
                }
            }
            baseLedger.settle(reservation);
            settled = true;
        } finally {
            if (!settled) {
                baseLedger.release(reservation);
            }
        }
        balances.apply(tx.tokenId(), tx.tokenDeltas(), tx.allowanceWrites());
        store.put(tx.record());
        tx.afterCommitSteps().forEach(Runnable::run);
        return Result.ok(null);
    }
}
