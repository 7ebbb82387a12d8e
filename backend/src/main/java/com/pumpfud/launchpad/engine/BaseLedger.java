// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.engine;

import com.pumpfud.launchpad.common.DomainError;
import com.pumpfud.launchpad.common.Result;
import com.pumpfud.launchpad.common.errors.InsufficientPaymentError;
import com.pumpfud.launchpad.common.errors.ZeroAmountError;
import com.pumpfud.launchpad.model.CallerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;

/**
 * Base-currency accounts: traders, treasury, referrers, creators, venue custody and the burn sink.
 *
 * Curve reserves are not accounts; they live on the token record. Every method synchronizes on
 * this instance and returns quickly. A commit reserves its debits, runs its external hooks with
 * the monitor released, then settles or releases the reservation.
 */
@Component
public class BaseLedger {

    private static final Logger logger = LoggerFactory.getLogger(BaseLedger.class);

    private final Map<String, BigInteger> accounts = new HashMap<>();
    private BigInteger held = BigInteger.ZERO;

    public synchronized BigInteger balanceOf(final String account) {
        return accounts.getOrDefault(CallerContext.normalize(account), BigInteger.ZERO);
    }

    /**
     * Credits funds arriving from outside the engine.
     */
    public synchronized Result<BigInteger, DomainError> deposit(final String account, final BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            return Result.err(new ZeroAmountError("Deposit amount must be positive"));
        }
        String key = CallerContext.normalize(account);
        BigInteger updated = accounts.getOrDefault(key, BigInteger.ZERO).add(amount);
        accounts.put(key, updated);
        logger.info("[BaseLedger] deposit account={} amount={} balance={}", key, amount, updated);
        return Result.ok(updated);
    }

    /**
     * Sum of all accounts plus debits held by commits in flight.
     */
    public synchronized BigInteger totalBalance() {
        return accounts.values().stream().reduce(held, BigInteger::add);
    }

    /**
     * Takes every debit in {@code deltas} out of its account and holds it until the reservation is
     * settled or released. Credits are not applied yet. Fails without side effects when any debit
     * is not covered.
     */
    synchronized Result<Reservation, DomainError> reserve(final Map<String, BigInteger> deltas) {
        for (Map.Entry<String, BigInteger> entry : deltas.entrySet()) {
            BigInteger after = accounts.getOrDefault(entry.getKey(), BigInteger.ZERO).add(entry.getValue());
            if (after.signum() < 0) {
                return Result.err(new InsufficientPaymentError(
                        "Account " + entry.getKey() + " cannot cover " + entry.getValue().negate()));
            }
        }
        Reservation reservation = new Reservation(deltas);
        deltas.forEach((account, delta) -> {
            if (delta.signum() < 0) {
                credit(account, delta);
            }
        });
        held = held.add(reservation.debits);
        return Result.ok(reservation);
    }

    /**
     * Applies the credits of a reservation. Its debits become final.
     */
    synchronized void settle(final Reservation reservation) {
        close(reservation);
        reservation.deltas.forEach((account, delta) -> {
            if (delta.signum() > 0) {
                credit(account, delta);
            }
        });
    }

    /**
     * Returns the held debits to their accounts.
     */
    synchronized void release(final Reservation reservation) {
        close(reservation);
        reservation.deltas.forEach((account, delta) -> {
            if (delta.signum() < 0) {
                credit(account, delta.negate());
            }
        });
    }

    private void close(final Reservation reservation) {
        if (reservation.closed) {
            throw new IllegalStateException("Reservation already settled or released");
        }
        reservation.closed = true;
        held = held.subtract(reservation.debits);
    }

    private void credit(final String account, final BigInteger delta) {
        BigInteger updated = accounts.getOrDefault(account, BigInteger.ZERO).add(delta);
        if (updated.signum() < 0) {
            throw new IllegalStateException("Negative base balance for " + account);
        }
        if (updated.signum() == 0) {
            accounts.remove(account);
        } else {
            accounts.put(account, updated);
        }
    }

    /**
     * Base deltas of one commit whose debits are held out of their accounts.
     */
    static final class Reservation {

        private final Map<String, BigInteger> deltas;
        private final BigInteger debits;
        private boolean closed;

        private Reservation(final Map<String, BigInteger> deltas) {
            this.deltas = Map.copyOf(deltas);
            this.debits = deltas.values().stream()
                    .filter(delta -> delta.signum() < 0)
                    .map(BigInteger::negate)
                    .reduce(BigInteger.ZERO, BigInteger::add);
        }
    }
}
