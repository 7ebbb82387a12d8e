// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.common.errors;

import com.pumpfud.launchpad.common.DomainError;
import com.pumpfud.launchpad.common.ErrorKind;

import java.math.BigInteger;

public final class SlippageExceededError extends DomainError {

    private final BigInteger minimum;
    private final BigInteger actual;

    public SlippageExceededError(final BigInteger minimum, final BigInteger actual) {
        super(ErrorKind.SLIPPAGE_EXCEEDED,
                "Output " + actual + " is below the requested minimum " + minimum);
        this.minimum = minimum;
        this.actual = actual;
    }

    public BigInteger minimum() {
        return minimum;
    }

    public BigInteger actual() {
        return actual;
    }
}
