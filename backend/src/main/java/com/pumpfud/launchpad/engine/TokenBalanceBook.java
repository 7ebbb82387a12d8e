// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.engine;

import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Balances table keyed by (token, owner), plus allowances keyed by (token, owner, spender).
 *
 * Written only by {@link TokenTransactions} while the token's write lock is held.
 */
@Component
public class TokenBalanceBook {

    private final Map<Long, Book> books = new ConcurrentHashMap<>();

    public BigInteger balance(final long tokenId, final String owner) {
        Book book = books.get(tokenId);
        return book == null ? BigInteger.ZERO : book.balances.getOrDefault(owner, BigInteger.ZERO);
    }

    public BigInteger allowance(final long tokenId, final String owner, final String spender) {
        Book book = books.get(tokenId);
        return book == null ? BigInteger.ZERO : book.allowances.getOrDefault(allowanceKey(owner, spender), BigInteger.ZERO);
    }

    public int holderCount(final long tokenId) {
        Book book = books.get(tokenId);
        return book == null ? 0 : book.balances.size();
    }

    public BigInteger total(final long tokenId) {
        Book book = books.get(tokenId);
        if (book == null) {
            return BigInteger.ZERO;
        }
        return book.balances.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
    }

    void apply(final long tokenId,
               final Map<String, BigInteger> balanceDeltas,
               final Map<String, BigInteger> allowanceWrites) {
        if (balanceDeltas.isEmpty() && allowanceWrites.isEmpty()) {
            return;
        }
        Book book = books.computeIfAbsent(tokenId, id -> new Book());
        balanceDeltas.forEach((owner, delta) -> {
            BigInteger updated = book.balances.getOrDefault(owner, BigInteger.ZERO).add(delta);
            if (updated.signum() < 0) {
                throw new IllegalStateException("Negative balance for " + owner + " on token " + tokenId);
            }
            if (updated.signum() == 0) {
                book.balances.remove(owner);
            } else {
                book.balances.put(owner, updated);
            }
        });
        allowanceWrites.forEach((key, amount) -> {
            if (amount.signum() == 0) {
                book.allowances.remove(key);
            } else {
                book.allowances.put(key, amount);
            }
        });
    }

    static String allowanceKey(final String owner, final String spender) {
        return owner + "->" + spender;
    }

    private static final class Book {
        final Map<String, BigInteger> balances = new ConcurrentHashMap<>();
        final Map<String, BigInteger> allowances = new ConcurrentHashMap<>();
    }
}
