// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.service;

import com.pumpfud.launchpad.model.CallerContext;
import com.pumpfud.launchpad.model.TradeReceipt;
import com.pumpfud.launchpad.model.TradeSide;
import com.pumpfud.launchpad.model.TraderStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Per-account trading and referral statistics, fed by every committed trade.
 *
 * Rankings:
 * - volume: buy value + sell value
 * - referrers: distinct referred traders, then referral volume
 * - ROI: realized return in bps, then volume; accounts that never bought are not ranked
 * Ties fall back to the account name so rankings are stable.
 */
@Service
public class TraderStatsService {

    private static final Logger LOG = LoggerFactory.getLogger(TraderStatsService.class);

    private static final Comparator<TraderStats> BY_ACCOUNT = Comparator.comparing(TraderStats::account);

    private final Map<String, AccountTotals> accounts = new ConcurrentHashMap<>();
    private final AtomicLong traderSequence = new AtomicLong();

    /**
     * @param referrer effective referrer of the trade, null when there was none
     */
    public void record(TradeReceipt receipt, String referrer, Instant executedAt) {
        String trader = CallerContext.normalize(receipt.trader());
        totalsFor(trader).trade(receipt.side(), receipt.baseAmount(), executedAt, traderSequence);
        if (referrer != null) {
            String key = CallerContext.normalize(referrer);
            totalsFor(key).referral(trader, receipt.baseAmount(), receipt.referrerCut());
            LOG.debug("Referral recorded referrer={} trader={} cut={}", key, trader, receipt.referrerCut());
        }
    }

    /**
     * Totals for {@code account}; all zero when it has no activity.
     */
    public TraderStats getStats(String account) {
        String key = CallerContext.normalize(account);
        AccountTotals totals = accounts.get(key);
        return totals == null ? TraderStats.empty(key) : totals.snapshot(key);
    }

    /**
     * Traders this account referred, in the order they were first referred.
     */
    public List<String> getReferrals(String account) {
        AccountTotals totals = accounts.get(CallerContext.normalize(account));
        return totals == null ? List.of() : totals.referred();
    }

    public int getTotalTraders() {
        return (int) accounts.values().stream().filter(AccountTotals::hasTraded).count();
    }

    /**
     * Accounts that traded, in order of their first trade.
     */
    public List<String> getTraders(int offset, int limit) {
        return accounts.entrySet().stream()
            .filter(entry -> entry.getValue().hasTraded())
            .sorted(Comparator.comparingLong((Map.Entry<String, AccountTotals> entry) -> entry.getValue().firstTradeSequence()))
            .skip(offset)
            .limit(limit)
            .map(Map.Entry::getKey)
            .toList();
    }

    public List<TraderStats> getTopVolumeTraders(int count) {
        return top(count, stats -> stats.tradeCount() > 0,
            Comparator.comparing(TraderStats::totalVolume).reversed().thenComparing(BY_ACCOUNT));
    }

    public List<TraderStats> getTopReferrers(int count) {
        return top(count, stats -> stats.referralCount() > 0,
            Comparator.comparingLong(TraderStats::referralCount).reversed()
                .thenComparing(Comparator.comparing(TraderStats::referralVolume).reversed())
                .thenComparing(BY_ACCOUNT));
    }

    public List<TraderStats> getTopRoiTraders(int count) {
        Comparator<TraderStats> byRoi = Comparator.comparing(stats -> stats.roiBps().orElseThrow());
        return top(count, stats -> stats.roiBps().isPresent(),
            byRoi.reversed()
                .thenComparing(Comparator.comparing(TraderStats::totalVolume).reversed())
                .thenComparing(BY_ACCOUNT));
    }

    private List<TraderStats> top(int count, Predicate<TraderStats> eligible, Comparator<TraderStats> order) {
        if (count <= 0) {
            return List.of();
        }
        List<TraderStats> snapshots = new ArrayList<>();
        accounts.forEach((account, totals) -> snapshots.add(totals.snapshot(account)));
        return snapshots.stream()
            .filter(eligible)
            .sorted(order)
            .limit(count)
            .toList();
    }

    private AccountTotals totalsFor(String account) {
        return accounts.computeIfAbsent(account, key -> new AccountTotals());
    }

    private static final class AccountTotals {
        private BigInteger buyValue = BigInteger.ZERO;
        private BigInteger sellValue = BigInteger.ZERO;
        private long buyCount;
        private long sellCount;
        private BigInteger referralVolume = BigInteger.ZERO;
        private BigInteger referralEarnings = BigInteger.ZERO;
        private final Set<String> referred = new LinkedHashSet<>();
        private Instant lastTradeAt;
        private long firstTradeSequence = Long.MAX_VALUE;

        synchronized void trade(TradeSide side, BigInteger baseAmount, Instant executedAt, AtomicLong sequence) {
            if (firstTradeSequence == Long.MAX_VALUE) {
                firstTradeSequence = sequence.incrementAndGet();
            }
            if (side == TradeSide.BUY) {
                buyValue = buyValue.add(baseAmount);
                buyCount++;
            } else {
                sellValue = sellValue.add(baseAmount);
                sellCount++;
            }
            lastTradeAt = executedAt;
        }

        synchronized void referral(String trader, BigInteger volume, BigInteger earnings) {
            referred.add(trader);
            referralVolume = referralVolume.add(volume);
            referralEarnings = referralEarnings.add(earnings);
        }

        synchronized boolean hasTraded() {
            return buyCount + sellCount > 0;
        }

        synchronized long firstTradeSequence() {
            return firstTradeSequence;
        }

        synchronized List<String> referred() {
            return List.copyOf(referred);
        }

        synchronized TraderStats snapshot(String account) {
            return new TraderStats(account, buyValue, sellValue, buyCount, sellCount, referred.size(),
                referralVolume, referralEarnings, lastTradeAt);
        }
    }
}
