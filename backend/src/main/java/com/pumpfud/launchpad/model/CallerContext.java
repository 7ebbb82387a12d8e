// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.model;

import java.util.Locale;
import java.util.Objects;

/**
 * The acting identity of a mutating call. Accounts compare case-insensitively, so they are
 * normalized to lower case on the way in.
 */
public record CallerContext(String account) {

    public CallerContext {
        Objects.requireNonNull(account, "account");
        account = normalize(account);
    }

    public static CallerContext of(final String account) {
        return new CallerContext(account);
    }

    public static String normalize(final String account) {
        return account == null ? null : account.trim().toLowerCase(Locale.ROOT);
    }

    public boolean is(final String other) {
        return other != null && account.equals(normalize(other));
    }
}
