// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.common;

/**
 * Carries a {@link DomainError} out of a controller so the global handler can render it.
 */
public class DomainErrorException extends RuntimeException {

    private final DomainError error;

    public DomainErrorException(final DomainError error) {
        super(error.code() + ": " + error.message());
        this.error = error;
    }

    public DomainError error() {
        return error;
    }
}
