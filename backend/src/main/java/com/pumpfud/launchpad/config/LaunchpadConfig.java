// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.config;

import com.pumpfud.launchpad.constants.LaunchpadConstants;
import com.pumpfud.launchpad.model.CurveParameters;
import com.pumpfud.launchpad.model.FeeSchedule;
import com.pumpfud.launchpad.model.ProtocolSettings;
import com.pumpfud.launchpad.util.CurveMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;
import java.time.Clock;

/**
 * Binds {@code launchpad.*} properties into the engine's immutable parameter records.
 *
 * Reserve, threshold, supply and fee amounts are configured in whole units and scaled by
 * {@code 10^launchpad.decimals}.
 */
@Configuration
public class LaunchpadConfig {

    private static final Logger logger = LoggerFactory.getLogger(LaunchpadConfig.class);

    @Value("${launchpad.decimals:18}")
    private int decimals;

    @Value("${launchpad.curve.virtual-base-reserve:12500000}")
    private long virtualBaseReserve;

    @Value("${launchpad.curve.virtual-token-reserve:250000000}")
    private long virtualTokenReserve;

    @Value("${launchpad.curve.graduation-threshold:50000000}")
    private long graduationThreshold;

    @Value("${launchpad.curve.test-graduation-threshold:10000}")
    private long testGraduationThreshold;

    @Value("${launchpad.curve.max-supply:1000000000}")
    private long maxSupply;

    @Value("${launchpad.curve.bonding-supply:800000000}")
    private long bondingSupply;

    @Value("${launchpad.fees.buy-bps:100}")
    private int buyFeeBps;

    @Value("${launchpad.fees.sell-bps:100}")
    private int sellFeeBps;

    @Value("${launchpad.fees.creation-fee:100}")
    private long creationFee;

    @Value("${launchpad.fees.referral-share-bps:5000}")
    private int referralShareBps;

    @Value("${launchpad.graduation.creator-bps:500}")
    private int creatorBps;

    @Value("${launchpad.graduation.burn-bps:1000}")
    private int burnBps;

    @Value("${launchpad.graduation.liquidity-bps:8000}")
    private int liquidityBps;

    @Value("${launchpad.admin.owner:}")
    private String owner;

    @Value("${launchpad.admin.treasury:}")
    private String treasury;

    @Value("${launchpad.admin.lp-recipient:" + LaunchpadConstants.BURN_ADDRESS + "}")
    private String lpRecipient;

    @Value("${launchpad.venue.active:in-memory}")
    private String activeVenue;

    @Bean
    public CurveParameters curveParameters() {
        CurveParameters curve = new CurveParameters(
                CurveMath.units(virtualBaseReserve, decimals),
                CurveMath.units(virtualTokenReserve, decimals),
                CurveMath.units(graduationThreshold, decimals),
                CurveMath.units(testGraduationThreshold, decimals),
                CurveMath.units(maxSupply, decimals),
                CurveMath.units(bondingSupply, decimals));
        logger.info("[Config] curve virtualBase={} virtualTokens={} threshold={} testThreshold={} maxSupply={} bondingSupply={} (whole units, decimals={})",
                virtualBaseReserve, virtualTokenReserve, graduationThreshold, testGraduationThreshold, maxSupply, bondingSupply, decimals);
        return curve;
    }

    @Bean
    public FeeSchedule feeSchedule() {
        return new FeeSchedule(buyFeeBps, sellFeeBps, creatorBps, burnBps, liquidityBps);
    }

    @Bean
    public ProtocolSettings protocolSettings() {
        if (owner.isBlank()) {
            logger.warn("[Config] launchpad.admin.owner is not set; admin operations will be rejected");
        }
        if (treasury.isBlank()) {
            logger.warn("[Config] launchpad.admin.treasury is not set; fee-bearing operations will fail");
        }
        if (referralShareBps < 0 || referralShareBps > LaunchpadConstants.BPS_100_PERCENT) {
            throw new IllegalStateException("launchpad.fees.referral-share-bps out of range: " + referralShareBps);
        }
        BigInteger fee = CurveMath.units(creationFee, decimals);
        return new ProtocolSettings(owner, treasury, lpRecipient, fee, referralShareBps, activeVenue);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
