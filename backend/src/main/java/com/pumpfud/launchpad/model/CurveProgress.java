package com.pumpfud.launchpad.model;

import java.math.BigInteger;

public record CurveProgress(
        BigInteger raised,
        BigInteger target,
        int progressBps,
        BigInteger tokensSold
) {
}
