// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.model;

import java.math.BigInteger;

/**
 * Curve constants applied to every newly created token, in base units.
 *
 * @param virtualBaseReserve      virtual base-currency offset added to the real reserve
 * @param virtualTokenReserve     virtual token reserve the curve starts from
 * @param graduationThreshold     real reserve at which a token graduates
 * @param testGraduationThreshold reduced threshold for tokens flagged as test tokens
 * @param maxSupply               total token supply including the liquidity allocation
 * @param bondingSupply           cap on tokens the curve may sell
 */
public record CurveParameters(
        BigInteger virtualBaseReserve,
        BigInteger virtualTokenReserve,
        BigInteger graduationThreshold,
        BigInteger testGraduationThreshold,
        BigInteger maxSupply,
        BigInteger bondingSupply
) {

    public CurveParameters {
        requirePositive("virtualBaseReserve", virtualBaseReserve);
        requirePositive("virtualTokenReserve", virtualTokenReserve);
        requirePositive("graduationThreshold", graduationThreshold);
        requirePositive("testGraduationThreshold", testGraduationThreshold);
        requirePositive("maxSupply", maxSupply);
        requirePositive("bondingSupply", bondingSupply);
        if (bondingSupply.compareTo(maxSupply) > 0) {
            throw new IllegalArgumentException("bondingSupply " + bondingSupply + " exceeds maxSupply " + maxSupply);
        }
    }

    public BigInteger curveConstant() {
        return virtualBaseReserve.multiply(virtualTokenReserve);
    }

    private static void requirePositive(final String name, final BigInteger value) {
        if (value == null || value.signum() <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
    }
}
