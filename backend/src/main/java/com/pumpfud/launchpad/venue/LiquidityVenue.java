// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.venue;

/**
 * Secondary trading venue that receives a graduated token's liquidity allocation.
 */
public interface LiquidityVenue {

    /**
     * Registry name, used by {@code setLiquidityVenue}.
     */
    String name();

    /**
     * Account that holds the tokens and base currency handed to this venue.
     */
    String custodyAccount();

    /**
     * Seeds a pool for the token. Called once per token, synchronously, while the graduating
     * trade is being committed.
     *
     * @throws LiquidityVenueException when the venue rejects the request or cannot be reached
     */
    LiquidityReceipt addLiquidity(LiquidityRequest request) throws LiquidityVenueException;
}
