// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.model;

/**
 * Fee rates and graduation allocation, all in basis points.
 */
public record FeeSchedule(
        int buyFeeBps,
        int sellFeeBps,
        int creatorBps,
        int burnBps,
        int liquidityBps
) {

    public int graduationAllocationBps() {
        return creatorBps + burnBps + liquidityBps;
    }
}
