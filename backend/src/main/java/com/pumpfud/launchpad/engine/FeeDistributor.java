// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.engine;

import com.pumpfud.launchpad.common.DomainError;
import com.pumpfud.launchpad.common.Result;
import com.pumpfud.launchpad.common.errors.ExternalTransferFailedError;
import com.pumpfud.launchpad.model.CallerContext;
import com.pumpfud.launchpad.model.FeeSplit;
import com.pumpfud.launchpad.util.CurveMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Computes the protocol fee of a trade and routes the treasury and referral cuts.
 *
 * FEE MODEL:
 * - fee = gross * feeBps / 10000 (floor)
 * - referrerCut = fee * referralShareBps / 10000 (floor) when a referrer other than the trader is given
 * - treasuryCut = fee - referrerCut
 *
 * A self-referral is accepted and treated as "no referrer".
 */
@Component
public class FeeDistributor {

    private static final Logger logger = LoggerFactory.getLogger(FeeDistributor.class);

    private final AdminControls admin;

    public FeeDistributor(final AdminControls admin) {
        this.admin = admin;
    }

    public int buyFeeBps(final String trader) {
        return admin.isFeeExempt(trader) ? 0 : admin.fees().buyFeeBps();
    }

    public int sellFeeBps(final String trader) {
        return admin.isFeeExempt(trader) ? 0 : admin.fees().sellFeeBps();
    }

    public FeeSplit split(final BigInteger grossAmount, final int feeBps, final String referrer, final String trader) {
        return split(grossAmount, feeBps, referrer, trader, admin.settings().referralShareBps());
    }

    static FeeSplit split(final BigInteger grossAmount,
                          final int feeBps,
                          final String referrer,
                          final String trader,
                          final int referralShareBps) {
        BigInteger fee = CurveMath.bps(grossAmount, feeBps);
        String effectiveReferrer = effectiveReferrer(referrer, trader);
        BigInteger referrerCut = effectiveReferrer == null
                ? BigInteger.ZERO
                : CurveMath.bps(fee, referralShareBps);
        return new FeeSplit(
                grossAmount,
                feeBps,
                fee,
                grossAmount.subtract(fee),
                fee.subtract(referrerCut),
                referrerCut,
                effectiveReferrer);
    }

    /**
     * Credits the treasury and referrer cuts of {@code split} inside {@code tx}.
     */
    Result<Void, DomainError> route(final EngineTransaction tx, final FeeSplit split) {
        Result<Void, DomainError> treasury = payout(tx, admin.settings().treasury(), split.treasuryCut(), "treasury fee");
        if (treasury.isErr()) {
            return treasury;
        }
        if (split.hasReferrer()) {
            return payout(tx, split.referrer(), split.referrerCut(), "referral fee");
        }
        return Result.ok(null);
    }

    /**
     * Credits {@code amount} to {@code account}. A zero amount is a no-op; a positive amount
     * to an account that does not exist fails the whole operation.
     */
    Result<Void, DomainError> payout(final EngineTransaction tx,
                                     final String account,
                                     final BigInteger amount,
                                     final String purpose) {
        if (amount.signum() == 0) {
            return Result.ok(null);
        }
        if (account == null || account.isBlank()) {
            logger.warn("[Fees] token={} {} of {} has no recipient", tx.tokenId(), purpose, amount);
            return Result.err(new ExternalTransferFailedError("No recipient configured for " + purpose));
        }
        tx.adjustBase(account, amount);
        return Result.ok(null);
    }

    private static String effectiveReferrer(final String referrer, final String trader) {
        if (referrer == null || referrer.isBlank()) {
            return null;
        }
        String normalized = CallerContext.normalize(referrer);
        if (normalized.equals(CallerContext.normalize(trader))) {
            return null;
        }
        return normalized;
    }
}
