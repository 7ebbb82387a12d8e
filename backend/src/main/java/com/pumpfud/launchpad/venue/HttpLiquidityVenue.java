// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.venue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigInteger;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Venue reached over HTTP: {@code POST {base-uri}/liquidity} with the request as JSON, answered
 * by {@code {"poolRef": "...", "lpAmount": "..."}}.
 */
@Component
@ConditionalOnProperty(prefix = "launchpad.venue.http", name = "enabled", havingValue = "true")
public class HttpLiquidityVenue implements LiquidityVenue {

    public static final String NAME = "http";

    private static final Logger logger = LoggerFactory.getLogger(HttpLiquidityVenue.class);

    private final URI endpoint;
    private final Duration timeout;
    private final String custodyAccount;
    private final ObjectMapper mapper;
    private final HttpClient client;

    public HttpLiquidityVenue(@Value("${launchpad.venue.http.base-uri}") final String baseUri,
                              @Value("${launchpad.venue.http.timeout-ms:5000}") final long timeoutMs,
                              @Value("${launchpad.venue.http.custody-account:venue:http}") final String custodyAccount,
                              final ObjectMapper mapper) {
        this.endpoint = URI.create(baseUri.endsWith("/") ? baseUri + "liquidity" : baseUri + "/liquidity");
        this.timeout = Duration.ofMillis(timeoutMs);
        this.custodyAccount = custodyAccount;
        this.mapper = mapper;
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String custodyAccount() {
        return custodyAccount;
    }

    @Override
    public LiquidityReceipt addLiquidity(final LiquidityRequest request) throws LiquidityVenueException {
        String body;
        try {
            body = mapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new LiquidityVenueException("Cannot encode liquidity request", e);
        }

        HttpRequest httpRequest = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = client.send(httpRequest, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new LiquidityVenueException("Venue unreachable at " + endpoint + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LiquidityVenueException("Interrupted while calling venue", e);
        }

        if (response.statusCode() / 100 != 2) {
            logger.warn("[Venue:{}] token={} rejected status={} body={}",
                    NAME, request.tokenId(), response.statusCode(), response.body());
            throw new LiquidityVenueException("Venue answered HTTP " + response.statusCode());
        }

        try {
            JsonNode json = mapper.readTree(response.body());
            String poolRef = json.path("poolRef").asText(null);
            if (poolRef == null || poolRef.isBlank()) {
                throw new LiquidityVenueException("Venue response carries no poolRef");
            }
            BigInteger lpAmount = json.hasNonNull("lpAmount")
                    ? new BigInteger(json.get("lpAmount").asText())
                    : BigInteger.ZERO;
            logger.info("[Venue:{}] token={} pool={} lp={}", NAME, request.tokenId(), poolRef, lpAmount);
            return new LiquidityReceipt(poolRef, lpAmount);
        } catch (JsonProcessingException | NumberFormatException e) {
            throw new LiquidityVenueException("Malformed venue response: " + e.getMessage(), e);
        }
    }
}
