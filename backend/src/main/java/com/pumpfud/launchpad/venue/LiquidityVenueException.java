// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.venue;

/**
 * The venue refused or failed an add-liquidity call.
 */
public class LiquidityVenueException extends Exception {

    public LiquidityVenueException(final String message) {
        super(message);
    }

    public LiquidityVenueException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
