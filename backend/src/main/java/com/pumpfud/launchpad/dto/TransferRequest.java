// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * TransferRequest - Move tokens; {@code from} is only read by transfer-from
 */
public class TransferRequest {
    public String from;

    @NotBlank(message = "to is required")
    public String to;

    @NotBlank(message = "amount is required")
    @Pattern(regexp = "\\d{1,78}", message = "amount must be a non-negative integer in base units")
    public String amount;

    // Default constructor for Jackson
    public TransferRequest() {}

    public TransferRequest(String from, String to, String amount) {
        this.from = from;
        this.to = to;
        this.amount = amount;
    }
}
