// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.model;

import java.math.BigInteger;

/**
 * Distribution executed when a token graduates.
 *
 * @param remainder raised base left in the reserve after the three allocations
 */
public record GraduationAllocation(
        long tokenId,
        BigInteger burnAmount,
        BigInteger liquidityBaseAmount,
        BigInteger liquidityTokenAmount,
        BigInteger creatorReward,
        BigInteger remainder
) {
}
