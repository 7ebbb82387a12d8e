// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.dto;

import com.pumpfud.launchpad.model.TraderStats;

import java.math.BigInteger;

/**
 * TraderStatsResponse - One account's trading and referral totals
 *
 * Amounts are decimal strings in base units. roiBps is null for accounts that never bought.
 */
public class TraderStatsResponse {
    public final String account;
    public final String totalVolume;
    public final String totalBuyValue;
    public final String totalSellValue;
    public final long tradeCount;
    public final long buyCount;
    public final long sellCount;
    public final long referralCount;
    public final String referralVolume;
    public final String referralEarnings;
    public final String roiBps;
    public final String lastTradeAt;

    public TraderStatsResponse(TraderStats stats) {
        this.account = stats.account();
        this.totalVolume = stats.totalVolume().toString();
        this.totalBuyValue = stats.totalBuyValue().toString();
        this.totalSellValue = stats.totalSellValue().toString();
        this.tradeCount = stats.tradeCount();
        this.buyCount = stats.buyCount();
        this.sellCount = stats.sellCount();
        this.referralCount = stats.referralCount();
        this.referralVolume = stats.referralVolume().toString();
        this.referralEarnings = stats.referralEarnings().toString();
        this.roiBps = stats.roiBps().map(BigInteger::toString).orElse(null);
        this.lastTradeAt = stats.lastTradeAt() == null ? null : stats.lastTradeAt().toString();
    }
}
