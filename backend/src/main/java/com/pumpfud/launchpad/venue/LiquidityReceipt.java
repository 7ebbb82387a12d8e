// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.venue;

import java.math.BigInteger;

/**
 * Venue acknowledgement of an add-liquidity call.
 */
public record LiquidityReceipt(String poolRef, BigInteger lpAmount) {
}
