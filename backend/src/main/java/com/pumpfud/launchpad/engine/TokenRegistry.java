// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.engine;

import com.pumpfud.launchpad.common.DomainError;
import com.pumpfud.launchpad.common.Result;
import com.pumpfud.launchpad.common.errors.AlreadyGraduatedError;
import com.pumpfud.launchpad.common.errors.InsufficientPaymentError;
import com.pumpfud.launchpad.common.errors.InvalidParameterError;
import com.pumpfud.launchpad.constants.LaunchpadConstants;
import com.pumpfud.launchpad.metrics.LaunchpadMetrics;
import com.pumpfud.launchpad.model.CallerContext;
import com.pumpfud.launchpad.model.CurveParameters;
import com.pumpfud.launchpad.model.TokenRecord;
import com.pumpfud.launchpad.model.TokenStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;

/**
 * Launches tokens and answers queries over the token table.
 *
 * Creations are serialized so ids stay sequential; an id is consumed only by a committed
 * creation. Every record handed out is a copy.
 */
@Component
public class TokenRegistry {

    private static final Logger logger = LoggerFactory.getLogger(TokenRegistry.class);

    private final TokenStore store;
    private final TokenTransactions transactions;
    private final AdminControls admin;
    private final FeeDistributor fees;
    private final CurveParameters curve;
    private final Clock clock;
    private final LaunchpadMetrics metrics;
    private final Object createLock = new Object();

    public TokenRegistry(final TokenStore store,
                         final TokenTransactions transactions,
                         final AdminControls admin,
                         final FeeDistributor fees,
                         final CurveParameters curve,
                         final Clock clock,
                         final LaunchpadMetrics metrics) {
        this.store = store;
        this.transactions = transactions;
        this.admin = admin;
        this.fees = fees;
        this.curve = curve;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Launches a token owned by the caller and charges the flat creation fee to the treasury.
     *
     * @param payment amount the caller offers for the fee; only the fee itself is debited
     */
    public Result<TokenRecord, DomainError> createToken(final CallerContext ctx,
                                                        final String name,
                                                        final String symbol,
                                                        final String description,
                                                        final String imageUri,
                                                        final BigInteger payment) {
        Result<Void, DomainError> open = admin.requireNotPaused("createToken");
        if (open.isErr()) {
            return rejected(ctx, symbol, open.getErrorUnsafe());
        }
        Result<Void, DomainError> valid = validateMetadata(name, symbol, description, imageUri);
        if (valid.isErr()) {
            return rejected(ctx, symbol, valid.getErrorUnsafe());
        }

        BigInteger creationFee = admin.settings().creationFee();
        BigInteger offered = payment == null ? BigInteger.ZERO : payment;
        if (offered.compareTo(creationFee) < 0) {
            return rejected(ctx, symbol, new InsufficientPaymentError(
                    "Creation fee is " + creationFee + ", payment was " + offered));
        }

        Result<TokenRecord, DomainError> created;
        synchronized (createLock) {
            TokenRecord fresh = TokenRecord.launch(
                    store.nextId(),
                    ctx.account(),
                    name.trim(),
                    symbol.trim(),
                    description == null ? "" : description.trim(),
                    imageUri == null ? "" : imageUri.trim(),
                    curve,
                    clock.instant());
            created = transactions.executeNew(fresh, tx -> {
                if (tx.baseBalance(ctx.account()).compareTo(creationFee) < 0) {
                    return Result.err(new InsufficientPaymentError("Balance of " + ctx.account()
                            + " cannot cover the creation fee " + creationFee));
                }
                tx.adjustBase(ctx.account(), creationFee.negate());
                Result<Void, DomainError> paid = fees.payout(tx, admin.settings().treasury(), creationFee, "creation fee");
                if (paid.isErr()) {
                    return paid.propagate();
                }
                return Result.ok(tx.record().copy());
            });
        }
        if (created.isErr()) {
            return rejected(ctx, symbol, created.getErrorUnsafe());
        }

        TokenRecord token = created.getValueUnsafe();
        metrics.recordTokenCreated();
        logger.info("[Registry] created token={} symbol={} creator={} fee={}",
                token.getId(), token.getSymbol(), token.getCreator(), creationFee);
        return Result.ok(token);
    }

    public Result<TokenRecord, DomainError> getToken(final long tokenId) {
        return transactions.read(tokenId, token -> Result.ok(token.copy()));
    }

    /**
     * All tokens in id order.
     */
    public List<TokenRecord> listTokens(final int offset, final int limit) {
        return page(store.select(token -> true), offset, limit);
    }

    /**
     * Tokens still trading on the curve, in id order.
     */
    public List<TokenRecord> listLiveTokens(final int offset, final int limit) {
        return page(store.select(token -> token.getStatus() == TokenStatus.ACTIVE), offset, limit);
    }

    public List<TokenRecord> tokensByCreator(final String creator) {
        String normalized = CallerContext.normalize(creator);
        return store.select(token -> token.getCreator().equals(normalized)).stream()
                .map(TokenRecord::copy)
                .toList();
    }

    public int tokenCount() {
        return store.size();
    }

    /**
     * Switches an active token between the regular and the test graduation threshold. The new
     * threshold takes effect on the token's next buy.
     */
    public Result<TokenRecord, DomainError> setTestToken(final CallerContext ctx, final long tokenId, final boolean testToken) {
        Result<Void, DomainError> owner = admin.requireOwner(ctx);
        if (owner.isErr()) {
            return owner.propagate();
        }
        Result<TokenRecord, DomainError> updated = transactions.execute(tokenId, tx -> {
            TokenRecord token = tx.record();
            if (token.isGraduated()) {
                return Result.err(new AlreadyGraduatedError("Token " + tokenId + " has graduated"));
            }
            token.setTestToken(testToken);
            token.setGraduationThreshold(testToken ? curve.testGraduationThreshold() : curve.graduationThreshold());
            return Result.ok(token.copy());
        });
        if (updated.isOk()) {
            logger.info("[Registry] setTestToken by={} token={} test={} threshold={}",
                    ctx.account(), tokenId, testToken, updated.getValueUnsafe().getGraduationThreshold());
        }
        return updated;
    }

    private Result<TokenRecord, DomainError> rejected(final CallerContext ctx, final String symbol, final DomainError error) {
        metrics.recordRejected("create", error.code());
        logger.warn("[Registry] createToken rejected creator={} symbol={}: {}", ctx.account(), symbol, error);
        return Result.err(error);
    }

    private static List<TokenRecord> page(final List<TokenRecord> tokens, final int offset, final int limit) {
        int from = Math.max(0, Math.min(offset, tokens.size()));
        int size = Math.max(0, Math.min(limit, LaunchpadConstants.MAX_PAGE_SIZE));
        int to = Math.min(tokens.size(), from + size);
        return tokens.subList(from, to).stream()
                .map(TokenRecord::copy)
                .toList();
    }

    private static Result<Void, DomainError> validateMetadata(final String name,
                                                              final String symbol,
                                                              final String description,
                                                              final String imageUri) {
        if (name == null || name.isBlank()) {
            return Result.err(new InvalidParameterError("Token name must not be blank"));
        }
        if (symbol == null || symbol.isBlank()) {
            return Result.err(new InvalidParameterError("Token symbol must not be blank"));
        }
        if (name.trim().length() > LaunchpadConstants.MAX_NAME_LENGTH) {
            return Result.err(new InvalidParameterError("Token name exceeds " + LaunchpadConstants.MAX_NAME_LENGTH + " characters"));
        }
        if (symbol.trim().length() > LaunchpadConstants.MAX_SYMBOL_LENGTH) {
            return Result.err(new InvalidParameterError("Token symbol exceeds " + LaunchpadConstants.MAX_SYMBOL_LENGTH + " characters"));
        }
        if (description != null && description.length() > LaunchpadConstants.MAX_DESCRIPTION_LENGTH) {
            return Result.err(new InvalidParameterError("Description exceeds " + LaunchpadConstants.MAX_DESCRIPTION_LENGTH + " characters"));
        }
        if (imageUri != null && imageUri.length() > LaunchpadConstants.MAX_URI_LENGTH) {
            return Result.err(new InvalidParameterError("Image URI exceeds " + LaunchpadConstants.MAX_URI_LENGTH + " characters"));
        }
        return Result.ok(null);
    }
}
