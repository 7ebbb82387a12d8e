// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.dto;

/**
 * AdminUpdateRequest - Single-value admin update. Each endpoint reads the field it needs.
 */
public class AdminUpdateRequest {
    public Boolean paused;
    public String venue;
    public String account;
    public Boolean exempt;
    public Boolean testToken;
    public String amount;

    // Default constructor for Jackson
    public AdminUpdateRequest() {}
}
