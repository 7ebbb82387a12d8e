// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.engine;

import com.pumpfud.launchpad.common.DomainError;
import com.pumpfud.launchpad.common.Result;
import com.pumpfud.launchpad.model.CallerContext;
import com.pumpfud.launchpad.model.TokenRecord;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unit of work for one mutating operation on one token.
 *
 * Collects a working copy of the token record, balance and allowance changes, base-account
 * deltas and pre-commit hooks. Nothing reaches shared state until {@link TokenTransactions}
 * commits it; dropping the instance discards every change.
 */
final class EngineTransaction {

    /**
     * Work that must succeed for the transaction to commit, run while its base debits are reserved.
     */
    @FunctionalInterface
    interface PreCommitHook {
        Result<Void, DomainError> run();
    }

    private final TokenRecord record;
    private final TokenBalanceBook balances;
    private final BaseLedger baseLedger;

    private final Map<String, BigInteger> tokenDeltas = new LinkedHashMap<>();
    private final Map<String, BigInteger> allowanceWrites = new LinkedHashMap<>();
    private final Map<String, BigInteger> baseDeltas = new LinkedHashMap<>();
    private final List<PreCommitHook> hooks = new ArrayList<>();
    private final List<Runnable> afterCommit = new ArrayList<>();

    EngineTransaction(final TokenRecord record, final TokenBalanceBook balances, final BaseLedger baseLedger) {
        this.record = record;
        this.balances = balances;
        this.baseLedger = baseLedger;
    }

    TokenRecord record() {
        return record;
    }

    long tokenId() {
        return record.getId();
    }

    BigInteger tokenBalance(final String owner) {
        String key = CallerContext.normalize(owner);
        return balances.balance(tokenId(), key).add(tokenDeltas.getOrDefault(key, BigInteger.ZERO));
    }

    void adjustTokens(final String owner, final BigInteger delta) {
        tokenDeltas.merge(CallerContext.normalize(owner), delta, BigInteger::add);
    }

    BigInteger allowance(final String owner, final String spender) {
        String key = TokenBalanceBook.allowanceKey(CallerContext.normalize(owner), CallerContext.normalize(spender));
        BigInteger pending = allowanceWrites.get(key);
        return pending != null ? pending : balances.allowance(tokenId(), CallerContext.normalize(owner), CallerContext.normalize(spender));
    }

    void setAllowance(final String owner, final String spender, final BigInteger amount) {
        allowanceWrites.put(TokenBalanceBook.allowanceKey(CallerContext.normalize(owner), CallerContext.normalize(spender)), amount);
    }

    /**
     * Committed balance plus this transaction's pending delta. Other tokens may move the same
     * account concurrently, so debits are verified again at commit.
     */
    BigInteger baseBalance(final String account) {
        String key = CallerContext.normalize(account);
        return baseLedger.balanceOf(key).add(baseDeltas.getOrDefault(key, BigInteger.ZERO));
    }

    void adjustBase(final String account, final BigInteger delta) {
        if (delta.signum() == 0) {
            return;
        }
        baseDeltas.merge(CallerContext.normalize(account), delta, BigInteger::add);
    }

    void beforeCommit(final PreCommitHook hook) {
        hooks.add(hook);
    }

    /**
     * Runs once the transaction is published, still under the token's write lock, so steps of
     * successive transactions on one token run in commit order.
     */
    void afterCommit(final Runnable step) {
        afterCommit.add(step);
    }

    Map<String, BigInteger> tokenDeltas() {
        return Collections.unmodifiableMap(tokenDeltas);
    }

    Map<String, BigInteger> allowanceWrites() {
        return Collections.unmodifiableMap(allowanceWrites);
    }

    Map<String, BigInteger> baseDeltas() {
        return Collections.unmodifiableMap(baseDeltas);
    }

    List<PreCommitHook> hooks() {
        return Collections.unmodifiableList(hooks);
    }

    List<Runnable> afterCommitSteps() {
        return Collections.unmodifiableList(afterCommit);
    }
}
