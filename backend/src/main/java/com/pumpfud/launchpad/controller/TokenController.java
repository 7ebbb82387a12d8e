// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.controller;

import com.pumpfud.launchpad.common.DomainErrorException;
import com.pumpfud.launchpad.constants.LaunchpadConstants;
import com.pumpfud.launchpad.dto.CreateTokenRequest;
import com.pumpfud.launchpad.dto.ProgressResponse;
import com.pumpfud.launchpad.dto.QuoteResponse;
import com.pumpfud.launchpad.dto.TokenResponse;
import com.pumpfud.launchpad.engine.BondingCurveEngine;
import com.pumpfud.launchpad.engine.TokenLedger;
import com.pumpfud.launchpad.engine.TokenRegistry;
import com.pumpfud.launchpad.engine.TradingService;
import com.pumpfud.launchpad.model.CallerContext;
import com.pumpfud.launchpad.model.TokenRecord;
import com.pumpfud.launchpad.validation.RequestValidator;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * TokenController - Token launch and read-only curve queries
 */
@RestController
@RequestMapping("/api/tokens")
public class TokenController {
    private final TokenRegistry registry;
    private final TradingService trading;
    private final BondingCurveEngine curve;
    private final TokenLedger ledger;
    private final RequestValidator validator;

    public TokenController(TokenRegistry registry,
                           TradingService trading,
                           BondingCurveEngine curve,
                           TokenLedger ledger,
                           RequestValidator validator) {
        this.registry = registry;
        this.trading = trading;
        this.curve = curve;
        this.ledger = ledger;
        this.validator = validator;
    }

    /**
     * POST /api/tokens - Launch a token; the creation fee is debited from the caller's base account
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @WithSpan
    public TokenResponse createToken(
        @RequestHeader(LaunchpadConstants.ACCOUNT_HEADER) String account,
        @Valid @RequestBody CreateTokenRequest req
    ) {
        CallerContext ctx = validator.caller(account);
        TokenRecord token = registry.createToken(ctx, req.name, req.symbol, req.description, req.imageUri,
                validator.amount("payment", req.payment))
            .orElseThrow(DomainErrorException::new);
        return toResponse(token);
    }

    @GetMapping
    @WithSpan
    public List<TokenResponse> listTokens(
        @RequestParam(required = false) Integer offset,
        @RequestParam(required = false) Integer limit
    ) {
        return registry.listTokens(validator.offset(offset), validator.pageSize(limit)).stream()
            .map(this::toResponse)
            .toList();
    }

    /**
     * GET /api/tokens/live - Tokens still trading on the curve
     */
    @GetMapping("/live")
    @WithSpan
    public List<TokenResponse> listLiveTokens(
        @RequestParam(required = false) Integer offset,
        @RequestParam(required = false) Integer limit
    ) {
        return registry.listLiveTokens(validator.offset(offset), validator.pageSize(limit)).stream()
            .map(this::toResponse)
            .toList();
    }

    @GetMapping("/count")
    public Map<String, Integer> tokenCount() {
        return Map.of("count", registry.tokenCount());
    }

    @GetMapping("/{id}")
    @WithSpan
    public TokenResponse getToken(@PathVariable("id") long id) {
        return toResponse(registry.getToken(id).orElseThrow(DomainErrorException::new));
    }

    @GetMapping("/creator/{creator}")
    @WithSpan
    public List<TokenResponse> tokensByCreator(@PathVariable("creator") String creator) {
        return registry.tokensByCreator(validator.requireAccount("creator", creator)).stream()
            .map(this::toResponse)
            .toList();
    }

    /**
     * GET /api/tokens/{id}/price - Spot price scaled by 1e18
     */
    @GetMapping("/{id}/price")
    public Map<String, String> price(@PathVariable("id") long id) {
        String price = trading.price(id).orElseThrow(DomainErrorException::new).toString();
        return Map.of("tokenId", Long.toString(id), "price", price);
    }

    @GetMapping("/{id}/progress")
    public ProgressResponse progress(@PathVariable("id") long id) {
        return new ProgressResponse(id, trading.bondingCurveProgress(id).orElseThrow(DomainErrorException::new));
    }

    @GetMapping("/{id}/quote/buy")
    @WithSpan
    public QuoteResponse quoteBuy(@PathVariable("id") long id, @RequestParam("amount") String amount) {
        return new QuoteResponse(trading.quoteBuy(id, validator.amount("amount", amount))
            .orElseThrow(DomainErrorException::new));
    }

    @GetMapping("/{id}/quote/sell")
    @WithSpan
    public QuoteResponse quoteSell(@PathVariable("id") long id, @RequestParam("amount") String amount) {
        return new QuoteResponse(trading.quoteSell(id, validator.amount("amount", amount))
            .orElseThrow(DomainErrorException::new));
    }

    private TokenResponse toResponse(TokenRecord token) {
        return new TokenResponse(token, curve.price(token), ledger.holderCount(token.getId()));
    }
}
