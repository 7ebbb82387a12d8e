// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * CreateTokenRequest - Launch a token on the bonding curve
 */
public class CreateTokenRequest {
    @NotBlank(message = "name is required")
    @Size(max = 64, message = "name must be at most 64 characters")
    public String name;

    @NotBlank(message = "symbol is required")
    @Size(max = 16, message = "symbol must be at most 16 characters")
    public String symbol;

    @Size(max = 1000, message = "description must be at most 1000 characters")
    public String description;

    @Size(max = 512, message = "imageUri must be at most 512 characters")
    public String imageUri;

    /**
     * Base units offered for the creation fee.
     */
    @NotBlank(message = "payment is required")
    @Pattern(regexp = "\\d{1,78}", message = "payment must be a non-negative integer in base units")
    public String payment;

    // Default constructor for Jackson
    public CreateTokenRequest() {}

    public CreateTokenRequest(String name, String symbol, String description, String imageUri, String payment) {
        this.name = name;
        this.symbol = symbol;
        this.description = description;
        this.imageUri = imageUri;
        this.payment = payment;
    }
}
