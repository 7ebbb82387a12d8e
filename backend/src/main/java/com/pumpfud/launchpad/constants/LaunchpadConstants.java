// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.constants;

import java.math.BigInteger;

/**
 * Centralized constants for curve trading and graduation.
 *
 * Limits that operators may tune live in configuration; what is here is fixed protocol.
 */
public final class LaunchpadConstants {

    private LaunchpadConstants() {
        // Prevent instantiation
    }

    // ========================================
    // PRECISION & SCALE
    // ========================================

    /**
     * Fixed-point scale of {@code price()} results (1e18 = one base unit per token unit).
     */
    public static final BigInteger PRICE_SCALE = BigInteger.TEN.pow(18);

    // ========================================
    // BASIS POINTS
    // ========================================

    /**
     * Basis points representation of 100% (10000 bps = 100%).
     */
    public static final int BPS_100_PERCENT = 10000;

    public static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(BPS_100_PERCENT);

    /**
     * Hard cap on the buy and sell fee rates (5%).
     */
    public static final int MAX_TRADE_FEE_BPS = 500;

    // ========================================
    // ACCOUNTS
    // ========================================

    /**
     * Non-recoverable sink for burned base currency and locked LP receipts.
     */
    public static final String BURN_ADDRESS = "0x000000000000000000000000000000000000dead";

    public static final int MAX_ACCOUNT_LENGTH = 128;

    // ========================================
    // TOKEN METADATA
    // ========================================

    public static final int MAX_NAME_LENGTH = 64;

    public static final int MAX_SYMBOL_LENGTH = 16;

    public static final int MAX_DESCRIPTION_LENGTH = 1000;

    public static final int MAX_URI_LENGTH = 512;

    // ========================================
    // QUERIES
    // ========================================

    public static final int DEFAULT_PAGE_SIZE = 50;

    public static final int MAX_PAGE_SIZE = 200;

    /**
     * Trades kept per token in the in-memory feed.
     */
    public static final int MAX_TRADE_HISTORY = 1000;

    // ========================================
    // CALLER CONTEXT
    // ========================================

    /**
     * Header naming the acting account on every HTTP call.
     */
    public static final String ACCOUNT_HEADER = "X-Account";

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
}
