// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.dto;

import com.pumpfud.launchpad.model.TokenRecord;

import java.math.BigInteger;

/**
 * TokenResponse - Token record as exposed over HTTP. Amounts are decimal strings in base units.
 */
public class TokenResponse {
    public final long id;
    public final String creator;
    public final String name;
    public final String symbol;
    public final String description;
    public final String imageUri;
    public final String status;
    public final boolean testToken;
    public final String virtualBaseReserve;
    public final String virtualTokenReserve;
    public final String realReserve;
    public final String tokensSold;
    public final String totalBurned;
    public final String graduationThreshold;
    public final String bondingSupply;
    public final String maxSupply;
    public final String tradingVolume;
    public final long tradeCount;
    public final String price;
    public final int holderCount;
    public final long createdAt;
    /**
     * Epoch second, 0 until graduation.
     */
    public final long graduatedAt;
    public final String liquidityPoolRef;

    public TokenResponse(TokenRecord token, BigInteger price, int holderCount) {
        this.id = token.getId();
        this.creator = token.getCreator();
        this.name = token.getName();
        this.symbol = token.getSymbol();
        this.description = token.getDescription();
        this.imageUri = token.getImageUri();
        this.status = token.getStatus().name();
        this.testToken = token.isTestToken();
        this.virtualBaseReserve = token.getVirtualBaseReserve().toString();
        this.virtualTokenReserve = token.getVirtualTokenReserve().toString();
        this.realReserve = token.getRealReserve().toString();
        this.tokensSold = token.getTokensSold().toString();
        this.totalBurned = token.getTotalBurned().toString();
        this.graduationThreshold = token.getGraduationThreshold().toString();
        this.bondingSupply = token.getBondingSupply().toString();
        this.maxSupply = token.getMaxSupply().toString();
        this.tradingVolume = token.getTradingVolume().toString();
        this.tradeCount = token.getTradeCount();
        this.price = price.toString();
        this.holderCount = holderCount;
        this.createdAt = token.getCreatedAt().getEpochSecond();
        this.graduatedAt = token.getGraduatedAt() == null ? 0L : token.getGraduatedAt().getEpochSecond();
        this.liquidityPoolRef = token.getLiquidityPoolRef();
    }
}
