// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.dto;

import java.math.BigInteger;

/**
 * BalanceResponse - A token balance, allowance or base-account balance
 *
 * @param tokenId null for base-account balances
 * @param spender set for allowances only
 */
public record BalanceResponse(Long tokenId, String owner, String spender, String amount) {

    public static BalanceResponse token(long tokenId, String owner, BigInteger amount) {
        return new BalanceResponse(tokenId, owner, null, amount.toString());
    }

    public static BalanceResponse allowance(long tokenId, String owner, String spender, BigInteger amount) {
        return new BalanceResponse(tokenId, owner, spender, amount.toString());
    }

    public static BalanceResponse base(String account, BigInteger amount) {
        return new BalanceResponse(null, account, null, amount.toString());
    }
}
