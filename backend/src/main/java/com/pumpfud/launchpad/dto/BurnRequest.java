// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * BurnRequest - Redeem tokens for a pro-rata share of the raised reserve
 */
public class BurnRequest {
    @NotBlank(message = "amount is required")
    @Pattern(regexp = "\\d{1,78}", message = "amount must be a non-negative integer in base units")
    public String amount;

    // Default constructor for Jackson
    public BurnRequest() {}

    public BurnRequest(String amount) {
        this.amount = amount;
    }
}
