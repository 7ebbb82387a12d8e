// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.dto;

import com.pumpfud.launchpad.model.CurveProgress;

/**
 * ProgressResponse - How far a token is toward graduation
 */
public class ProgressResponse {
    public final long tokenId;
    public final String raised;
    public final String target;
    public final int progressBps;
    public final String tokensSold;

    public ProgressResponse(long tokenId, CurveProgress progress) {
        this.tokenId = tokenId;
        this.raised = progress.raised().toString();
        this.target = progress.target().toString();
        this.progressBps = progress.progressBps();
        this.tokensSold = progress.tokensSold().toString();
    }
}
