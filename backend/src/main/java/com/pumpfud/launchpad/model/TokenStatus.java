// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.model;

/**
 * Lifecycle of a launched token. ACTIVE moves to GRADUATED once and never back.
 */
public enum TokenStatus {
    ACTIVE,
    GRADUATED
}
