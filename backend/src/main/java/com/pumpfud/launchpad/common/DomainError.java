// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.common;

/**
 * Base type for domain-level errors.
 */
public abstract class DomainError {

    private final ErrorKind kind;
    private final String message;

    protected DomainError(final ErrorKind kind, final String message) {
        this.kind = kind;
        this.message = message;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String code() {
        return kind.name();
    }

    public String message() {
        return message;
    }

    public int httpStatus() {
        return kind.httpStatus();
    }

    @Override
    public String toString() {
        return code() + ": " + message;
    }
}
