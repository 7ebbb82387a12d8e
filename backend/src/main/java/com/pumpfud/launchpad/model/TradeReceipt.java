// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.model;

import java.math.BigInteger;

/**
 * Outcome of a committed buy, sell or burn.
 *
 * @param baseAmount  base paid in (buy) or paid out net of fees (sell, burn)
 * @param tokenAmount tokens minted (buy) or destroyed (sell, burn)
 * @param graduated   true when this trade triggered graduation
 */
public record TradeReceipt(
        long tokenId,
        TradeSide side,
        String trader,
        BigInteger baseAmount,
        BigInteger tokenAmount,
        BigInteger fee,
        BigInteger referrerCut,
        BigInteger priceAfter,
        boolean graduated
) {
}
