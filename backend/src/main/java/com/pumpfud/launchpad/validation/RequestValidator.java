// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.validation;

import com.pumpfud.launchpad.common.DomainErrorException;
import com.pumpfud.launchpad.common.errors.InvalidParameterError;
import com.pumpfud.launchpad.constants.LaunchpadConstants;
import com.pumpfud.launchpad.model.CallerContext;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Turns raw request values into engine arguments.
 */
@Component
public class RequestValidator {

    /**
     * Resolve the acting account from the caller header.
     *
     * @throws DomainErrorException if the header value is blank or too long
     */
    public CallerContext caller(String account) {
        return CallerContext.of(requireAccount(LaunchpadConstants.ACCOUNT_HEADER, account));
    }

    /**
     * Validate an account name carried in a path or body.
     *
     * @throws DomainErrorException if the account is blank or too long
     */
    public String requireAccount(String field, String account) {
        if (account == null || account.isBlank()) {
            throw invalid(field + " is required");
        }
        if (account.length() > LaunchpadConstants.MAX_ACCOUNT_LENGTH) {
            throw invalid(field + " exceeds " + LaunchpadConstants.MAX_ACCOUNT_LENGTH + " characters");
        }
        return CallerContext.normalize(account);
    }

    /**
     * Parse a base-unit amount. Zero is accepted here; the engine decides whether zero is legal.
     *
     * @throws DomainErrorException if the amount is missing, negative or not an integer
     */
    public BigInteger amount(String field, String raw) {
        if (raw == null || raw.isBlank()) {
            throw invalid(field + " is required");
        }
        return parse(field, raw);
    }

    /**
     * Parse an optional base-unit amount, defaulting to zero.
     */
    public BigInteger optionalAmount(String field, String raw) {
        if (raw == null || raw.isBlank()) {
            return BigInteger.ZERO;
        }
        return parse(field, raw);
    }

    /**
     * Clamp a page window to [0, MAX_PAGE_SIZE].
     */
    public int pageSize(Integer limit) {
        if (limit == null) {
            return LaunchpadConstants.DEFAULT_PAGE_SIZE;
        }
        if (limit < 0) {
            throw invalid("limit cannot be negative, got: " + limit);
        }
        return Math.min(limit, LaunchpadConstants.MAX_PAGE_SIZE);
    }

    public int offset(Integer offset) {
        if (offset == null) {
            return 0;
        }
        if (offset < 0) {
            throw invalid("offset cannot be negative, got: " + offset);
        }
        return offset;
    }

    public <T> T required(String field, T value) {
        if (value == null) {
            throw invalid(field + " is required");
        }
        return value;
    }

    private static BigInteger parse(String field, String raw) {
        BigInteger value;
        try {
            value = new BigInteger(raw.trim());
        } catch (NumberFormatException e) {
            throw invalid(field + " must be an integer in base units, got: " + raw);
        }
        if (value.signum() < 0) {
            throw invalid(field + " cannot be negative, got: " + raw);
        }
        return value;
    }

    private static DomainErrorException invalid(String message) {
        return new DomainErrorException(new InvalidParameterError(message));
    }
}
