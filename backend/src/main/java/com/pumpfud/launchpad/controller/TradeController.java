// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.controller;

import com.pumpfud.launchpad.common.DomainErrorException;
import com.pumpfud.launchpad.constants.LaunchpadConstants;
import com.pumpfud.launchpad.dto.BurnRequest;
import com.pumpfud.launchpad.dto.TradeRequest;
import com.pumpfud.launchpad.dto.TradeResponse;
import com.pumpfud.launchpad.engine.TokenRegistry;
import com.pumpfud.launchpad.engine.TradingService;
import com.pumpfud.launchpad.model.CallerContext;
import com.pumpfud.launchpad.service.TradeHistoryService;
import com.pumpfud.launchpad.service.TradeHistoryService.TradeHistoryEntry;
import com.pumpfud.launchpad.validation.RequestValidator;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * TradeController - Buy, sell and burn against a token's bonding curve
 *
 * Every trade is all-or-nothing: an error response means no balance, reserve or fee moved.
 */
@RestController
@RequestMapping("/api/tokens/{id}")
public class TradeController {
    private static final Logger logger = LoggerFactory.getLogger(TradeController.class);
    private final TradingService trading;
    private final TokenRegistry registry;
    private final TradeHistoryService history;
    private final RequestValidator validator;

    public TradeController(TradingService trading,
                           TokenRegistry registry,
                           TradeHistoryService history,
                           RequestValidator validator) {
        this.trading = trading;
        this.registry = registry;
        this.history = history;
        this.validator = validator;
    }

    /**
     * POST /api/tokens/{id}/buy - Spend base currency on tokens
     */
    @PostMapping("/buy")
    @WithSpan
    public TradeResponse buy(
        @RequestHeader(LaunchpadConstants.ACCOUNT_HEADER) String account,
        @PathVariable("id") long id,
        @Valid @RequestBody TradeRequest req
    ) {
        CallerContext ctx = validator.caller(account);
        logger.debug("POST /api/tokens/{}/buy trader={} amount={} minOut={}", id, ctx.account(), req.amount, req.minOut);
        return new TradeResponse(trading.buy(ctx, id,
                validator.amount("amount", req.amount),
                validator.optionalAmount("minOut", req.minOut),
                req.referrer)
            .orElseThrow(DomainErrorException::new));
    }

    /**
     * POST /api/tokens/{id}/sell - Return tokens to the curve for base currency
     */
    @PostMapping("/sell")
    @WithSpan
    public TradeResponse sell(
        @RequestHeader(LaunchpadConstants.ACCOUNT_HEADER) String account,
        @PathVariable("id") long id,
        @Valid @RequestBody TradeRequest req
    ) {
        CallerContext ctx = validator.caller(account);
        logger.debug("POST /api/tokens/{}/sell trader={} amount={} minOut={}", id, ctx.account(), req.amount, req.minOut);
        return new TradeResponse(trading.sell(ctx, id,
                validator.amount("amount", req.amount),
                validator.optionalAmount("minOut", req.minOut),
                req.referrer)
            .orElseThrow(DomainErrorException::new));
    }

    /**
     * POST /api/tokens/{id}/burn - Redeem tokens pro rata against the raised reserve
     */
    @PostMapping("/burn")
    @WithSpan
    public TradeResponse burn(
        @RequestHeader(LaunchpadConstants.ACCOUNT_HEADER) String account,
        @PathVariable("id") long id,
        @Valid @RequestBody BurnRequest req
    ) {
        CallerContext ctx = validator.caller(account);
        return new TradeResponse(trading.burn(ctx, id, validator.amount("amount", req.amount))
            .orElseThrow(DomainErrorException::new));
    }

    /**
     * GET /api/tokens/{id}/trades - Most recent trades, newest first
     */
    @GetMapping("/trades")
    public List<TradeHistoryEntry> trades(
        @PathVariable("id") long id,
        @RequestParam(required = false) Integer limit
    ) {
        registry.getToken(id).orElseThrow(DomainErrorException::new);
        return history.getRecent(id, validator.pageSize(limit));
    }
}
