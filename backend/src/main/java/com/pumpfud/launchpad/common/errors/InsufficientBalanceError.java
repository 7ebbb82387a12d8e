// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.common.errors;

import com.pumpfud.launchpad.common.DomainError;
import com.pumpfud.launchpad.common.ErrorKind;

public final class InsufficientBalanceError extends DomainError {

    public InsufficientBalanceError(final String details) {
        super(ErrorKind.INSUFFICIENT_BALANCE, details);
    }
}
