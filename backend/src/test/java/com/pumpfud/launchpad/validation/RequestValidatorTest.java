// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.validation;

import com.pumpfud.launchpad.common.DomainErrorException;
import com.pumpfud.launchpad.common.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Request Validator Tests")
class RequestValidatorTest {

    private final RequestValidator validator = new RequestValidator();

    @Test
    @DisplayName("Caller header is trimmed and lower-cased")
    void testCaller() {
        assertEquals("alice", validator.caller("  Alice ").account());
        assertInvalid(() -> validator.caller(""));
        assertInvalid(() -> validator.caller(null));
        assertInvalid(() -> validator.caller("a".repeat(129)));
    }

    @Test
    @DisplayName("Amounts must be non-negative integers")
    void testAmount() {
        assertEquals(new BigInteger("1000000000000000000000"), validator.amount("amount", "1000000000000000000000"));
        assertEquals(BigInteger.ZERO, validator.amount("amount", "0"));
        assertEquals(BigInteger.ZERO, validator.optionalAmount("minOut", null));
        assertInvalid(() -> validator.amount("amount", "-5"));
        assertInvalid(() -> validator.amount("amount", "1.5"));
        assertInvalid(() -> validator.amount("amount", " "));
    }

    @Test
    @DisplayName("Paging defaults and clamps")
    void testPaging() {
        assertEquals(50, validator.pageSize(null));
        assertEquals(200, validator.pageSize(10_000));
        assertEquals(0, validator.offset(null));
        assertInvalid(() -> validator.pageSize(-1));
        assertInvalid(() -> validator.offset(-1));
    }

    private static void assertInvalid(final Runnable call) {
        DomainErrorException e = assertThrows(DomainErrorException.class, call::run);
        assertEquals(ErrorKind.INVALID_PARAMETER, e.error().kind());
    }
}
