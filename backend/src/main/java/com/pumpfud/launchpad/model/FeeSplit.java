package com.pumpfud.launchpad.model;

import java.math.BigInteger;

/**
 * Per-trade fee breakdown. Never stored.
 *
 * @param referrer effective referrer, null when absent or self-referred
 */
public record FeeSplit(
        BigInteger grossAmount,
        int feeBps,
        BigInteger fee,
        BigInteger netAmount,
        BigInteger treasuryCut,
        BigInteger referrerCut,
        String referrer
) {

    public boolean hasReferrer() {
        return referrer != null;
    }
}
