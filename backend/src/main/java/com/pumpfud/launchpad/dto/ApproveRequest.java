// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * ApproveRequest - Set the spender's allowance over the caller's balance
 */
public class ApproveRequest {
    @NotBlank(message = "spender is required")
    public String spender;

    @NotBlank(message = "amount is required")
    @Pattern(regexp = "\\d{1,78}", message = "amount must be a non-negative integer in base units")
    public String amount;

    // Default constructor for Jackson
    public ApproveRequest() {}

    public ApproveRequest(String spender, String amount) {
        this.spender = spender;
        this.amount = amount;
    }
}
