// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * TradeRequest - Buy (amount in base units) or sell (amount in token units) against the curve
 */
public class TradeRequest {
    @NotBlank(message = "amount is required")
    @Pattern(regexp = "\\d{1,78}", message = "amount must be a non-negative integer in base units")
    public String amount;

    /**
     * Minimum output accepted; tokens for a buy, net base for a sell. Defaults to 0.
     */
    @Pattern(regexp = "\\d{1,78}", message = "minOut must be a non-negative integer in base units")
    public String minOut;

    public String referrer;

    // Default constructor for Jackson
    public TradeRequest() {}

    public TradeRequest(String amount, String minOut, String referrer) {
        this.amount = amount;
        this.minOut = minOut;
        this.referrer = referrer;
    }
}
