// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.model;

import java.math.BigInteger;

/**
 * Operator-controlled settings outside the fee schedule.
 *
 * @param owner             account allowed to call admin operations
 * @param treasury          receives creation fees and the treasury share of trade fees
 * @param lpRecipient       receives the venue's LP receipt at graduation
 * @param creationFee       flat fee charged by createToken, in base units
 * @param referralShareBps  share of a trade fee paid to a referrer
 * @param activeVenue       name of the liquidity venue used at graduation
 */
public record ProtocolSettings(
        String owner,
        String treasury,
        String lpRecipient,
        BigInteger creationFee,
        int referralShareBps,
        String activeVenue
) {

    public ProtocolSettings withOwner(final String newOwner) {
        return new ProtocolSettings(newOwner, treasury, lpRecipient, creationFee, referralShareBps, activeVenue);
    }

    public ProtocolSettings withTreasury(final String newTreasury) {
        return new ProtocolSettings(owner, newTreasury, lpRecipient, creationFee, referralShareBps, activeVenue);
    }

    public ProtocolSettings withLpRecipient(final String newLpRecipient) {
        return new ProtocolSettings(owner, treasury, newLpRecipient, creationFee, referralShareBps, activeVenue);
    }

    public ProtocolSettings withCreationFee(final BigInteger newCreationFee) {
        return new ProtocolSettings(owner, treasury, lpRecipient, newCreationFee, referralShareBps, activeVenue);
    }

    public ProtocolSettings withActiveVenue(final String newActiveVenue) {
        return new ProtocolSettings(owner, treasury, lpRecipient, creationFee, referralShareBps, newActiveVenue);
    }
}
