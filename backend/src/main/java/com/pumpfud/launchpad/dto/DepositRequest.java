// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * DepositRequest - Credit base currency arriving from outside the engine
 */
public class DepositRequest {
    @NotBlank(message = "account is required")
    public String account;

    @NotBlank(message = "amount is required")
    @Pattern(regexp = "\\d{1,78}", message = "amount must be a non-negative integer in base units")
    public String amount;

    // Default constructor for Jackson
    public DepositRequest() {}

    public DepositRequest(String account, String amount) {
        this.account = account;
        this.amount = amount;
    }
}
