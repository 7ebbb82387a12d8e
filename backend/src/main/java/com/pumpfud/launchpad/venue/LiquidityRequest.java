// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.venue;

import java.math.BigInteger;

/**
 * Add-liquidity instruction sent at graduation.
 *
 * @param minToken minimum token amount the venue may accept into the pool
 * @param minBase  minimum base amount the venue may accept into the pool
 * @param recipient receiver of the LP receipt
 * @param deadline  epoch second after which the venue must reject the request
 */
public record LiquidityRequest(
        long tokenId,
        String tokenSymbol,
        BigInteger tokenAmount,
        BigInteger baseAmount,
        BigInteger minToken,
        BigInteger minBase,
        String recipient,
        long deadline
) {
}
