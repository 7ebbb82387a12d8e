// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.dto;

import jakarta.validation.constraints.NotNull;

/**
 * FeesRequest - Trade fee rates and graduation allocation, in basis points
 */
public class FeesRequest {
    @NotNull(message = "buyFeeBps is required")
    public Integer buyFeeBps;

    @NotNull(message = "sellFeeBps is required")
    public Integer sellFeeBps;

    @NotNull(message = "creatorBps is required")
    public Integer creatorBps;

    @NotNull(message = "burnBps is required")
    public Integer burnBps;

    @NotNull(message = "liquidityBps is required")
    public Integer liquidityBps;

    // Default constructor for Jackson
    public FeesRequest() {}

    public FeesRequest(Integer buyFeeBps, Integer sellFeeBps, Integer creatorBps, Integer burnBps, Integer liquidityBps) {
        this.buyFeeBps = buyFeeBps;
        this.sellFeeBps = sellFeeBps;
        this.creatorBps = creatorBps;
        this.burnBps = burnBps;
        this.liquidityBps = liquidityBps;
    }
}
