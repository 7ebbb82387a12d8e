// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.controller;

import com.pumpfud.launchpad.common.DomainErrorException;
import com.pumpfud.launchpad.constants.LaunchpadConstants;
import com.pumpfud.launchpad.dto.AdminConfigResponse;
import com.pumpfud.launchpad.dto.AdminUpdateRequest;
import com.pumpfud.launchpad.dto.BalanceResponse;
import com.pumpfud.launchpad.dto.DepositRequest;
import com.pumpfud.launchpad.dto.FeesRequest;
import com.pumpfud.launchpad.dto.TokenResponse;
import com.pumpfud.launchpad.engine.AdminControls;
import com.pumpfud.launchpad.engine.BaseLedger;
import com.pumpfud.launchpad.engine.BondingCurveEngine;
import com.pumpfud.launchpad.engine.TokenLedger;
import com.pumpfud.launchpad.engine.TokenRegistry;
import com.pumpfud.launchpad.model.CallerContext;
import com.pumpfud.launchpad.model.TokenRecord;
import com.pumpfud.launchpad.validation.RequestValidator;
import com.pumpfud.launchpad.venue.LiquidityVenueRegistry;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

/**
 * AdminController - Owner-gated protocol parameters
 *
 * Every mutation answers with the full configuration so the caller sees the applied state.
 */
@RestController
@RequestMapping("/api/admin")
public class AdminController {
    private final AdminControls admin;
    private final TokenRegistry registry;
    private final BaseLedger baseLedger;
    private final BondingCurveEngine curve;
    private final TokenLedger ledger;
    private final LiquidityVenueRegistry venues;
    private final RequestValidator validator;

    public AdminController(AdminControls admin,
                           TokenRegistry registry,
                           BaseLedger baseLedger,
                           BondingCurveEngine curve,
                           TokenLedger ledger,
                           LiquidityVenueRegistry venues,
                           RequestValidator validator) {
        this.admin = admin;
        this.registry = registry;
        this.baseLedger = baseLedger;
        this.curve = curve;
        this.ledger = ledger;
        this.venues = venues;
        this.validator = validator;
    }

    @GetMapping("/config")
    public AdminConfigResponse config() {
        return new AdminConfigResponse(admin.settings(), admin.fees(), admin.isPaused(),
            venues.names(), admin.feeExemptAccounts());
    }

    @PutMapping("/fees")
    @WithSpan
    public AdminConfigResponse setFees(
        @RequestHeader(LaunchpadConstants.ACCOUNT_HEADER) String account,
        @Valid @RequestBody FeesRequest req
    ) {
        admin.setFees(validator.caller(account), req.buyFeeBps, req.sellFeeBps, req.creatorBps, req.burnBps, req.liquidityBps)
            .orElseThrow(DomainErrorException::new);
        return config();
    }

    @PutMapping("/pause")
    @WithSpan
    public AdminConfigResponse setPaused(
        @RequestHeader(LaunchpadConstants.ACCOUNT_HEADER) String account,
        @RequestBody AdminUpdateRequest req
    ) {
        admin.setPaused(validator.caller(account), validator.required("paused", req.paused))
            .orElseThrow(DomainErrorException::new);
        return config();
    }

    @PutMapping("/venue")
    @WithSpan
    public AdminConfigResponse setVenue(
        @RequestHeader(LaunchpadConstants.ACCOUNT_HEADER) String account,
        @RequestBody AdminUpdateRequest req
    ) {
        admin.setLiquidityVenue(validator.caller(account), validator.required("venue", req.venue))
            .orElseThrow(DomainErrorException::new);
        return config();
    }

    @PutMapping("/treasury")
    @WithSpan
    public AdminConfigResponse setTreasury(
        @RequestHeader(LaunchpadConstants.ACCOUNT_HEADER) String account,
        @RequestBody AdminUpdateRequest req
    ) {
        admin.setTreasury(validator.caller(account), req.account).orElseThrow(DomainErrorException::new);
        return config();
    }

    @PutMapping("/lp-recipient")
    @WithSpan
    public AdminConfigResponse setLpRecipient(
        @RequestHeader(LaunchpadConstants.ACCOUNT_HEADER) String account,
        @RequestBody AdminUpdateRequest req
    ) {
        admin.setLpRecipient(validator.caller(account), req.account).orElseThrow(DomainErrorException::new);
        return config();
    }

    @PutMapping("/creation-fee")
    @WithSpan
    public AdminConfigResponse setCreationFee(
        @RequestHeader(LaunchpadConstants.ACCOUNT_HEADER) String account,
        @RequestBody AdminUpdateRequest req
    ) {
        admin.setCreationFee(validator.caller(account), validator.amount("amount", req.amount))
            .orElseThrow(DomainErrorException::new);
        return config();
    }

    @PutMapping("/fee-exempt")
    @WithSpan
    public AdminConfigResponse setFeeExempt(
        @RequestHeader(LaunchpadConstants.ACCOUNT_HEADER) String account,
        @RequestBody AdminUpdateRequest req
    ) {
        admin.setFeeExempt(validator.caller(account), req.account, validator.required("exempt", req.exempt))
            .orElseThrow(DomainErrorException::new);
        return config();
    }

    @PutMapping("/owner")
    @WithSpan
    public AdminConfigResponse transferOwnership(
        @RequestHeader(LaunchpadConstants.ACCOUNT_HEADER) String account,
        @RequestBody AdminUpdateRequest req
    ) {
        admin.transferOwnership(validator.caller(account), req.account).orElseThrow(DomainErrorException::new);
        return config();
    }

    /**
     * PUT /api/admin/test-token/{tokenId} - Switch a token to the reduced test graduation threshold
     */
    @PutMapping("/test-token/{tokenId}")
    @WithSpan
    public TokenResponse setTestToken(
        @RequestHeader(LaunchpadConstants.ACCOUNT_HEADER) String account,
        @PathVariable("tokenId") long tokenId,
        @RequestBody AdminUpdateRequest req
    ) {
        TokenRecord token = registry.setTestToken(validator.caller(account), tokenId,
                validator.required("testToken", req.testToken))
            .orElseThrow(DomainErrorException::new);
        return new TokenResponse(token, curve.price(token), ledger.holderCount(tokenId));
    }

    /**
     * POST /api/admin/deposits - Credit base currency to an account (owner only)
     */
    @PostMapping("/deposits")
    @WithSpan
    public BalanceResponse deposit(
        @RequestHeader(LaunchpadConstants.ACCOUNT_HEADER) String account,
        @Valid @RequestBody DepositRequest req
    ) {
        CallerContext ctx = validator.caller(account);
        admin.requireOwner(ctx).orElseThrow(DomainErrorException::new);
        String target = validator.requireAccount("account", req.account);
        BigInteger balance = baseLedger.deposit(target, validator.amount("amount", req.amount))
            .orElseThrow(DomainErrorException::new);
        return BalanceResponse.base(target, balance);
    }
}
