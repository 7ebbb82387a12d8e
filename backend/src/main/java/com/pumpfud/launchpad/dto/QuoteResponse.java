// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.dto;

import com.pumpfud.launchpad.model.TradeQuote;

/**
 * QuoteResponse - Fee-inclusive quote at the regular fee rate
 */
public class QuoteResponse {
    public final long tokenId;
    public final String side;
    public final String amountIn;
    public final String fee;
    public final String amountOut;
    public final String priceBefore;
    public final String priceAfter;

    public QuoteResponse(TradeQuote quote) {
        this.tokenId = quote.tokenId();
        this.side = quote.side().name();
        this.amountIn = quote.amountIn().toString();
        this.fee = quote.fee().toString();
        this.amountOut = quote.amountOut().toString();
        this.priceBefore = quote.priceBefore().toString();
        this.priceAfter = quote.priceAfter().toString();
    }
}
