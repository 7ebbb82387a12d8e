// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.dto;

import com.pumpfud.launchpad.model.TradeReceipt;

/**
 * TradeResponse - Outcome of a committed buy, sell or burn
 */
public class TradeResponse {
    public final long tokenId;
    public final String side;
    public final String trader;
    public final String baseAmount;
    public final String tokenAmount;
    public final String fee;
    public final String referrerCut;
    public final String priceAfter;
    public final boolean graduated;

    public TradeResponse(TradeReceipt receipt) {
        this.tokenId = receipt.tokenId();
        this.side = receipt.side().name();
        this.trader = receipt.trader();
        this.baseAmount = receipt.baseAmount().toString();
        this.tokenAmount = receipt.tokenAmount().toString();
        this.fee = receipt.fee().toString();
        this.referrerCut = receipt.referrerCut().toString();
        this.priceAfter = receipt.priceAfter().toString();
        this.graduated = receipt.graduated();
    }
}
