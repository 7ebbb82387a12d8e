package com.pumpfud.launchpad.model;

import com.pumpfud.launchpad.constants.LaunchpadConstants;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Optional;

/**
 * Trading and referral totals of one account across all tokens.
 *
 * @param totalSellValue base received from sells (net of fees) and burns
 * @param referralCount  distinct traders this account has referred
 * @param referralVolume base amount of the trades it was credited as referrer on
 * @param lastTradeAt    null when the account never traded itself
 */
public record TraderStats(
        String account,
        BigInteger totalBuyValue,
        BigInteger totalSellValue,
        long buyCount,
        long sellCount,
        long referralCount,
        BigInteger referralVolume,
        BigInteger referralEarnings,
        Instant lastTradeAt
) {

    public static TraderStats empty(final String account) {
        return new TraderStats(account, BigInteger.ZERO, BigInteger.ZERO, 0, 0, 0,
                BigInteger.ZERO, BigInteger.ZERO, null);
    }

    public BigInteger totalVolume() {
        return totalBuyValue.add(totalSellValue);
    }

    public long tradeCount() {
        return buyCount + sellCount;
    }

    /**
     * Realized return in bps: (sold - bought) * 10000 / bought, truncated toward zero. Tokens
     * still held count for nothing. Empty when the account never bought.
     */
    public Optional<BigInteger> roiBps() {
        if (totalBuyValue.signum() == 0) {
            return Optional.empty();
        }
        return Optional.of(totalSellValue.subtract(totalBuyValue)
                .multiply(LaunchpadConstants.BPS_DENOMINATOR)
                .divide(totalBuyValue));
    }
}
