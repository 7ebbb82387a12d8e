// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.model;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One row of the token table.
 *
 * Stored instances are never mutated in place: the engine mutates a {@link #copy()} inside a
 * unit of work and swaps it in on commit, so readers always see a complete record.
 */
public final class TokenRecord {

    private long id;
    private String creator;
    private String name;
    private String symbol;
    private String description;
    private String imageUri;

    private BigInteger virtualBaseReserve;
    private BigInteger virtualTokenReserve;
    private BigInteger curveConstant;
    private BigInteger maxSupply;
    private BigInteger bondingSupply;
    private BigInteger graduationThreshold;

    private BigInteger realReserve = BigInteger.ZERO;
    private BigInteger tokensSold = BigInteger.ZERO;
    private BigInteger totalBurned = BigInteger.ZERO;
    private BigInteger liquidityTokensMinted = BigInteger.ZERO;
    private BigInteger tradingVolume = BigInteger.ZERO;
    private long tradeCount;

    private TokenStatus status = TokenStatus.ACTIVE;
    private boolean testToken;
    private Instant createdAt;
    private Instant graduatedAt;
    private String liquidityPoolRef;

    public TokenRecord() {
    }

    public static TokenRecord launch(final long id,
                                     final String creator,
                                     final String name,
                                     final String symbol,
                                     final String description,
                                     final String imageUri,
                                     final CurveParameters curve,
                                     final Instant createdAt) {
        TokenRecord record = new TokenRecord();
        record.id = id;
        record.creator = creator;
        record.name = name;
        record.symbol = symbol;
        record.description = description;
        record.imageUri = imageUri;
        record.virtualBaseReserve = curve.virtualBaseReserve();
        record.virtualTokenReserve = curve.virtualTokenReserve();
        record.curveConstant = curve.curveConstant();
        record.maxSupply = curve.maxSupply();
        record.bondingSupply = curve.bondingSupply();
        record.graduationThreshold = curve.graduationThreshold();
        record.createdAt = createdAt;
        return record;
    }

    public TokenRecord copy() {
        TokenRecord c = new TokenRecord();
        c.id = id;
        c.creator = creator;
        c.name = name;
        c.symbol = symbol;
        c.description = description;
        c.imageUri = imageUri;
        c.virtualBaseReserve = virtualBaseReserve;
        c.virtualTokenReserve = virtualTokenReserve;
        c.curveConstant = curveConstant;
        c.maxSupply = maxSupply;
        c.bondingSupply = bondingSupply;
        c.graduationThreshold = graduationThreshold;
        c.realReserve = realReserve;
        c.tokensSold = tokensSold;
        c.totalBurned = totalBurned;
        c.liquidityTokensMinted = liquidityTokensMinted;
        c.tradingVolume = tradingVolume;
        c.tradeCount = tradeCount;
        c.status = status;
        c.testToken = testToken;
        c.createdAt = createdAt;
        c.graduatedAt = graduatedAt;
        c.liquidityPoolRef = liquidityPoolRef;
        return c;
    }

    /**
     * x in {@code x * y = k}: virtual plus raised base.
     */
    public BigInteger effectiveBaseReserve() {
        return virtualBaseReserve.add(realReserve);
    }

    /**
     * y in {@code x * y = k}: virtual tokens not yet sold.
     */
    public BigInteger effectiveTokenReserve() {
        return virtualTokenReserve.subtract(tokensSold);
    }

    /**
     * Tokens in circulation according to the record.
     */
    public BigInteger circulatingSupply() {
        return tokensSold.add(liquidityTokensMinted).subtract(totalBurned);
    }

    public boolean isGraduated() {
        return status == TokenStatus.GRADUATED;
    }

    public long getId() {
        return id;
    }

    public String getCreator() {
        return creator;
    }

    public String getName() {
        return name;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getDescription() {
        return description;
    }

    public String getImageUri() {
        return imageUri;
    }

    public BigInteger getVirtualBaseReserve() {
        return virtualBaseReserve;
    }

    public BigInteger getVirtualTokenReserve() {
        return virtualTokenReserve;
    }

    public BigInteger getCurveConstant() {
        return curveConstant;
    }

    public BigInteger getMaxSupply() {
        return maxSupply;
    }

    public BigInteger getBondingSupply() {
        return bondingSupply;
    }

    public BigInteger getGraduationThreshold() {
        return graduationThreshold;
    }

    public void setGraduationThreshold(final BigInteger graduationThreshold) {
        this.graduationThreshold = graduationThreshold;
    }

    public BigInteger getRealReserve() {
        return realReserve;
    }

    public void setRealReserve(final BigInteger realReserve) {
        this.realReserve = realReserve;
    }

    public BigInteger getTokensSold() {
        return tokensSold;
    }

    public void setTokensSold(final BigInteger tokensSold) {
        this.tokensSold = tokensSold;
    }

    public BigInteger getTotalBurned() {
        return totalBurned;
    }

    public void setTotalBurned(final BigInteger totalBurned) {
        this.totalBurned = totalBurned;
    }

    public BigInteger getLiquidityTokensMinted() {
        return liquidityTokensMinted;
    }

    public void setLiquidityTokensMinted(final BigInteger liquidityTokensMinted) {
        this.liquidityTokensMinted = liquidityTokensMinted;
    }

    public BigInteger getTradingVolume() {
        return tradingVolume;
    }

    public void setTradingVolume(final BigInteger tradingVolume) {
        this.tradingVolume = tradingVolume;
    }

    public long getTradeCount() {
        return tradeCount;
    }

    public void setTradeCount(final long tradeCount) {
        this.tradeCount = tradeCount;
    }

    public TokenStatus getStatus() {
        return status;
    }

    public void setStatus(final TokenStatus status) {
        this.status = status;
    }

    public boolean isTestToken() {
        return testToken;
    }

    public void setTestToken(final boolean testToken) {
        this.testToken = testToken;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getGraduatedAt() {
        return graduatedAt;
    }

    public void setGraduatedAt(final Instant graduatedAt) {
        this.graduatedAt = graduatedAt;
    }

    public String getLiquidityPoolRef() {
        return liquidityPoolRef;
    }

    public void setLiquidityPoolRef(final String liquidityPoolRef) {
        this.liquidityPoolRef = liquidityPoolRef;
    }

    @Override
    public String toString() {
        return "TokenRecord{id=" + id
                + ", symbol=" + symbol
                + ", status=" + status
                + ", realReserve=" + realReserve
                + ", tokensSold=" + tokensSold
                + ", totalBurned=" + totalBurned + "}";
    }
}
