// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.common;

/**
 * Tag for every failure the engine can report. Each kind carries the HTTP status the REST layer
 * answers with.
 */
public enum ErrorKind {
    INSUFFICIENT_PAYMENT(402),
    ZERO_AMOUNT(400),
    INVALID_TOKEN(404),
    ALREADY_GRADUATED(409),
    SLIPPAGE_EXCEEDED(422),
    INSUFFICIENT_BALANCE(409),
    ALLOWANCE_EXCEEDED(409),
    INSUFFICIENT_LIQUIDITY(422),
    PAUSED(503),
    EXTERNAL_TRANSFER_FAILED(502),
    UNAUTHORIZED(403),
    INVALID_PARAMETER(400);

    private final int httpStatus;

    ErrorKind(final int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
