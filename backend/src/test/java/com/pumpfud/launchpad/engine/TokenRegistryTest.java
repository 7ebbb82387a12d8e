// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.engine;

import com.pumpfud.launchpad.common.DomainError;
import com.pumpfud.launchpad.common.ErrorKind;
import com.pumpfud.launchpad.common.Result;
import com.pumpfud.launchpad.model.TokenRecord;
import com.pumpfud.launchpad.model.TokenStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static com.pumpfud.launchpad.engine.LaunchpadFixture.CREATION_FEE;
import static com.pumpfud.launchpad.engine.LaunchpadFixture.OWNER;
import static com.pumpfud.launchpad.engine.LaunchpadFixture.TREASURY;
import static com.pumpfud.launchpad.engine.LaunchpadFixture.as;
import static com.pumpfud.launchpad.engine.LaunchpadFixture.bi;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Token Registry Tests")
class TokenRegistryTest {

    private LaunchpadFixture fx;

    @BeforeEach
    void setUp() {
        fx = new LaunchpadFixture();
    }

    @Test
    @DisplayName("createToken stores the launch state and charges the creation fee")
    void testCreateToken() {
        // Arrange
        fx.fund("Creator", 250);

        // Act
        TokenRecord token = fx.registry.createToken(as("Creator"), " Moon Coin ", "MOON", "to the moon",
            "ipfs://moon", bi(250)).getValueUnsafe();

        // Assert
        assertEquals(1, token.getId());
        assertEquals("creator", token.getCreator());
        assertEquals("Moon Coin", token.getName());
        assertEquals("MOON", token.getSymbol());
        assertEquals(TokenStatus.ACTIVE, token.getStatus());
        assertEquals(LaunchpadFixture.CURVE.virtualBaseReserve(), token.getVirtualBaseReserve());
        assertEquals(LaunchpadFixture.CURVE.curveConstant(), token.getCurveConstant());
        assertEquals(LaunchpadFixture.CURVE.graduationThreshold(), token.getGraduationThreshold());
        assertEquals(BigInteger.ZERO, token.getRealReserve());
        assertEquals(fx.clock.instant(), token.getCreatedAt());

        // Only the fee is debited, not the whole offered payment
        assertEquals(bi(150), fx.base("creator"));
        assertEquals(CREATION_FEE, fx.base(TREASURY));
        assertEquals(1.0, fx.meterRegistry.counter("launchpad.token.created.total").count());
    }

    @Test
    @DisplayName("Token ids are sequential starting at 1")
    void testSequentialIds() {
        long first = fx.launch("a");
        long second = fx.launch("b");
        long third = fx.launch("c");

        assertEquals(List.of(1L, 2L, 3L), List.of(first, second, third));
        assertEquals(3, fx.registry.tokenCount());
    }

    @Test
    @DisplayName("A failed creation consumes no id")
    void testFailedCreationConsumesNoId() {
        // Arrange - offered enough but holds nothing
        Result<TokenRecord, DomainError> failed =
            fx.registry.createToken(as("broke"), "Broke", "BRK", "", "", CREATION_FEE);

        // Act
        long next = fx.launch("creator");

        // Assert
        assertEquals(ErrorKind.INSUFFICIENT_PAYMENT, failed.getErrorUnsafe().kind());
        assertEquals(1, next);
        assertEquals(1, fx.registry.tokenCount());
    }

    @Test
    @DisplayName("Payment below the creation fee fails with InsufficientPayment")
    void testUnderpayment() {
        fx.fund("creator", 1_000);

        Result<TokenRecord, DomainError> result =
            fx.registry.createToken(as("creator"), "Cheap", "CHP", "", "", bi(99));

        assertEquals(ErrorKind.INSUFFICIENT_PAYMENT, result.getErrorUnsafe().kind());
        assertEquals(bi(1_000), fx.base("creator"));
        assertEquals(1.0, fx.meterRegistry.counter("launchpad.operation.rejected.total",
            "operation", "create", "reason", "INSUFFICIENT_PAYMENT").count());
    }

    @Test
    @DisplayName("Metadata is validated before payment")
    void testMetadataValidation() {
        fx.fund("creator", 1_000);

        assertEquals(ErrorKind.INVALID_PARAMETER,
            fx.registry.createToken(as("creator"), " ", "SYM", "", "", CREATION_FEE).getErrorUnsafe().kind());
        assertEquals(ErrorKind.INVALID_PARAMETER,
            fx.registry.createToken(as("creator"), "Name", null, "", "", BigInteger.ZERO).getErrorUnsafe().kind());
        assertEquals(ErrorKind.INVALID_PARAMETER,
            fx.registry.createToken(as("creator"), "Name", "SEVENTEEN_CHARSXX", "", "", CREATION_FEE).getErrorUnsafe().kind());
        assertEquals(ErrorKind.INVALID_PARAMETER,
            fx.registry.createToken(as("creator"), "x".repeat(65), "SYM", "", "", CREATION_FEE).getErrorUnsafe().kind());
        assertEquals(0, fx.registry.tokenCount());
    }

    @Test
    @DisplayName("Creation is rejected while paused")
    void testPausedCreation() {
        fx.fund("creator", 1_000);
        fx.admin.setPaused(as(OWNER), true).getValueUnsafe();

        assertEquals(ErrorKind.PAUSED,
            fx.registry.createToken(as("creator"), "Name", "SYM", "", "", CREATION_FEE).getErrorUnsafe().kind());
    }

    @Test
    @DisplayName("A zero creation fee launches without any base balance")
    void testFreeCreation() {
        fx.admin.setCreationFee(as(OWNER), BigInteger.ZERO).getValueUnsafe();

        assertTrue(fx.registry.createToken(as("newbie"), "Free", "FREE", null, null, null).isOk());
    }

    @Test
    @DisplayName("Unknown ids fail with InvalidToken")
    void testUnknownToken() {
        assertEquals(ErrorKind.INVALID_TOKEN, fx.registry.getToken(7).getErrorUnsafe().kind());
    }

    @Test
    @DisplayName("Lookups and trades on unknown ids allocate no per-token state")
    void testUnknownIdsAllocateNoLocks() {
        // Arrange
        long tokenId = fx.launch("creator");
        fx.fund("alice", 1_000);

        // Act
        for (long id = 2; id < 1_002; id++) {
            fx.registry.getToken(id);
            fx.trading.price(id);
            fx.trading.bondingCurveProgress(id);
            fx.ledger.balanceOf(id, "alice");
            fx.trading.buy(as("alice"), id, bi(1_000), null, null);
        }

        // Assert
        assertEquals(1, fx.locks.size());
        assertEquals(ErrorKind.INVALID_TOKEN, fx.trading.buy(as("alice"), 2, bi(1_000), null, null).getErrorUnsafe().kind());
        assertEquals(BigInteger.ZERO, fx.ledger.balanceOf(2, "alice"));
        assertEquals(bi(1_000), fx.base("alice"));
        assertTrue(fx.registry.getToken(tokenId).isOk());
    }

    @Test
    @DisplayName("A failed creation leaves at most the next id's lock behind")
    void testFailedCreationLockIsReused() {
        // Act
        for (int i = 0; i < 100; i++) {
            fx.registry.createToken(as("broke"), "Broke", "BRK", "", "", CREATION_FEE);
        }
        long created = fx.launch("creator");

        // Assert
        assertEquals(1, created);
        assertEquals(1, fx.locks.size());
    }

    @Test
    @DisplayName("Listing pages through tokens in id order and filters live tokens")
    void testListing() {
        // Arrange
        for (int i = 0; i < 5; i++) {
            fx.launch("creator" + (i % 2));
        }
        fx.fund("whale", 60_000_000);
        for (int i = 0; i < 6; i++) {
            fx.trading.buy(as("whale"), 2, bi(10_000_000), null, null).getValueUnsafe();
        }

        // Act
        List<TokenRecord> page = fx.registry.listTokens(1, 2);
        List<TokenRecord> live = fx.registry.listLiveTokens(0, 10);
        List<TokenRecord> byCreator = fx.registry.tokensByCreator("CREATOR0");

        // Assert
        assertEquals(List.of(2L, 3L), page.stream().map(TokenRecord::getId).toList());
        assertEquals(List.of(1L, 3L, 4L, 5L), live.stream().map(TokenRecord::getId).toList());
        assertEquals(List.of(1L, 3L, 5L), byCreator.stream().map(TokenRecord::getId).toList());
        assertTrue(fx.registry.listTokens(10, 5).isEmpty());
        assertTrue(fx.registry.listTokens(0, 0).isEmpty());
    }

    @Test
    @DisplayName("Returned records are snapshots")
    void testSnapshots() {
        long tokenId = fx.launch("creator");

        fx.registry.getToken(tokenId).getValueUnsafe().setRealReserve(bi(1_000));

        assertEquals(BigInteger.ZERO, fx.token(tokenId).getRealReserve());
    }

    @Test
    @DisplayName("Test-token flag is owner-only and frozen after graduation")
    void testSetTestToken() {
        long tokenId = fx.launch("creator");

        assertEquals(ErrorKind.UNAUTHORIZED,
            fx.registry.setTestToken(as("creator"), tokenId, true).getErrorUnsafe().kind());

        TokenRecord flagged = fx.registry.setTestToken(as(OWNER), tokenId, true).getValueUnsafe();
        assertEquals(LaunchpadFixture.CURVE.testGraduationThreshold(), flagged.getGraduationThreshold());
        TokenRecord cleared = fx.registry.setTestToken(as(OWNER), tokenId, false).getValueUnsafe();
        assertEquals(LaunchpadFixture.CURVE.graduationThreshold(), cleared.getGraduationThreshold());

        fx.registry.setTestToken(as(OWNER), tokenId, true).getValueUnsafe();
        fx.fund("alice", 1_000_000);
        fx.trading.buy(as("alice"), tokenId, bi(1_000_000), null, null).getValueUnsafe();
        assertEquals(ErrorKind.ALREADY_GRADUATED,
            fx.registry.setTestToken(as(OWNER), tokenId, false).getErrorUnsafe().kind());
    }
}
