// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.dto;

import com.pumpfud.launchpad.model.FeeSchedule;
import com.pumpfud.launchpad.model.ProtocolSettings;

import java.util.List;
import java.util.Set;

/**
 * AdminConfigResponse - Current protocol parameters
 */
public class AdminConfigResponse {
    public final String owner;
    public final String treasury;
    public final String lpRecipient;
    public final String creationFee;
    public final int referralShareBps;
    public final String activeVenue;
    public final List<String> availableVenues;
    public final boolean paused;
    public final int buyFeeBps;
    public final int sellFeeBps;
    public final int creatorBps;
    public final int burnBps;
    public final int liquidityBps;
    public final Set<String> feeExemptAccounts;

    public AdminConfigResponse(ProtocolSettings settings,
                               FeeSchedule fees,
                               boolean paused,
                               List<String> availableVenues,
                               Set<String> feeExemptAccounts) {
        this.owner = settings.owner();
        this.treasury = settings.treasury();
        this.lpRecipient = settings.lpRecipient();
        this.creationFee = settings.creationFee().toString();
        this.referralShareBps = settings.referralShareBps();
        this.activeVenue = settings.activeVenue();
        this.availableVenues = availableVenues;
        this.paused = paused;
        this.buyFeeBps = fees.buyFeeBps();
        this.sellFeeBps = fees.sellFeeBps();
        this.creatorBps = fees.creatorBps();
        this.burnBps = fees.burnBps();
        this.liquidityBps = fees.liquidityBps();
        this.feeExemptAccounts = feeExemptAccounts;
    }
}
