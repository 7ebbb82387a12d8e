// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.metrics;

import com.pumpfud.launchpad.model.TradeSide;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for token launches, trades and graduations.
 *
 * CARDINALITY SAFETY:
 * - Tags carry the trade side and error code only, never token ids or accounts
 */
@Component
public class LaunchpadMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter tokensCreated;
    private final Counter graduations;
    private final DistributionSummary baseVolume;
    private final Timer tradeExecutionTime;

    public LaunchpadMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.tokensCreated = Counter.builder("launchpad.token.created.total")
            .description("Total number of tokens launched")
            .register(meterRegistry);

        this.graduations = Counter.builder("launchpad.token.graduated.total")
            .description("Total number of tokens that graduated from the curve")
            .register(meterRegistry);

        // Recorded as double; amounts above 2^53 base units lose precision
        this.baseVolume = DistributionSummary.builder("launchpad.trade.base.amount")
            .description("Distribution of base amounts per trade")
            .baseUnit("base")
            .register(meterRegistry);

        this.tradeExecutionTime = Timer.builder("launchpad.trade.execution.time")
            .description("Time taken to execute a trade including commit")
            .register(meterRegistry);
    }

    public void recordTokenCreated() {
        tokensCreated.increment();
    }

    public void recordTrade(TradeSide side, BigInteger baseAmount, long executionTimeNanos) {
        meterRegistry.counter("launchpad.trade.executed.total",
            "side", side.name().toLowerCase(Locale.ROOT)).increment();
        baseVolume.record(baseAmount.doubleValue());
        tradeExecutionTime.record(executionTimeNanos, TimeUnit.NANOSECONDS);
    }

    public void recordGraduation() {
        graduations.increment();
    }

    /**
     * Record a rejected operation, tagged by the error code.
     */
    public void recordRejected(String operation, String errorCode) {
        meterRegistry.counter("launchpad.operation.rejected.total",
            "operation", operation,
            "reason", errorCode).increment();
    }
}
