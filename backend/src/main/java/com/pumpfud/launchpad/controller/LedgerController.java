// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.controller;

import com.pumpfud.launchpad.common.DomainErrorException;
import com.pumpfud.launchpad.constants.LaunchpadConstants;
import com.pumpfud.launchpad.dto.ApproveRequest;
import com.pumpfud.launchpad.dto.BalanceResponse;
import com.pumpfud.launchpad.dto.TransferRequest;
import com.pumpfud.launchpad.engine.BaseLedger;
import com.pumpfud.launchpad.engine.TokenLedger;
import com.pumpfud.launchpad.engine.TokenRegistry;
import com.pumpfud.launchpad.model.CallerContext;
import com.pumpfud.launchpad.validation.RequestValidator;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

/**
 * LedgerController - Token balances, allowances and base-account balances
 */
@RestController
@RequestMapping("/api/ledger")
public class LedgerController {
    private final TokenLedger ledger;
    private final BaseLedger baseLedger;
    private final TokenRegistry registry;
    private final RequestValidator validator;

    public LedgerController(TokenLedger ledger,
                            BaseLedger baseLedger,
                            TokenRegistry registry,
                            RequestValidator validator) {
        this.ledger = ledger;
        this.baseLedger = baseLedger;
        this.registry = registry;
        this.validator = validator;
    }

    @GetMapping("/{tokenId}/balances/{owner}")
    public BalanceResponse balance(@PathVariable("tokenId") long tokenId, @PathVariable("owner") String owner) {
        registry.getToken(tokenId).orElseThrow(DomainErrorException::new);
        String normalized = validator.requireAccount("owner", owner);
        return BalanceResponse.token(tokenId, normalized, ledger.balanceOf(tokenId, normalized));
    }

    @GetMapping("/{tokenId}/allowances/{owner}/{spender}")
    public BalanceResponse allowance(
        @PathVariable("tokenId") long tokenId,
        @PathVariable("owner") String owner,
        @PathVariable("spender") String spender
    ) {
        registry.getToken(tokenId).orElseThrow(DomainErrorException::new);
        String normalizedOwner = validator.requireAccount("owner", owner);
        String normalizedSpender = validator.requireAccount("spender", spender);
        return BalanceResponse.allowance(tokenId, normalizedOwner, normalizedSpender,
            ledger.allowance(tokenId, normalizedOwner, normalizedSpender));
    }

    @PostMapping("/{tokenId}/transfer")
    @WithSpan
    public BalanceResponse transfer(
        @RequestHeader(LaunchpadConstants.ACCOUNT_HEADER) String account,
        @PathVariable("tokenId") long tokenId,
        @Valid @RequestBody TransferRequest req
    ) {
        CallerContext ctx = validator.caller(account);
        ledger.transfer(ctx, tokenId, req.to, validator.amount("amount", req.amount))
            .orElseThrow(DomainErrorException::new);
        return BalanceResponse.token(tokenId, ctx.account(), ledger.balanceOf(tokenId, ctx.account()));
    }

    @PostMapping("/{tokenId}/approve")
    @WithSpan
    public BalanceResponse approve(
        @RequestHeader(LaunchpadConstants.ACCOUNT_HEADER) String account,
        @PathVariable("tokenId") long tokenId,
        @Valid @RequestBody ApproveRequest req
    ) {
        CallerContext ctx = validator.caller(account);
        BigInteger allowed = ledger.approve(ctx, tokenId, req.spender, validator.amount("amount", req.amount))
            .orElseThrow(DomainErrorException::new);
        return BalanceResponse.allowance(tokenId, ctx.account(), CallerContext.normalize(req.spender), allowed);
    }

    @PostMapping("/{tokenId}/transfer-from")
    @WithSpan
    public BalanceResponse transferFrom(
        @RequestHeader(LaunchpadConstants.ACCOUNT_HEADER) String account,
        @PathVariable("tokenId") long tokenId,
        @Valid @RequestBody TransferRequest req
    ) {
        CallerContext ctx = validator.caller(account);
        String from = validator.requireAccount("from", req.from);
        ledger.transferFrom(ctx, tokenId, from, req.to, validator.amount("amount", req.amount))
            .orElseThrow(DomainErrorException::new);
        return BalanceResponse.allowance(tokenId, from, ctx.account(), ledger.allowance(tokenId, from, ctx.account()));
    }

    @GetMapping("/base/{account}")
    public BalanceResponse baseBalance(@PathVariable("account") String account) {
        String normalized = validator.requireAccount("account", account);
        return BalanceResponse.base(normalized, baseLedger.balanceOf(normalized));
    }
}
