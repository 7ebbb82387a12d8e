// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Standardized error response for all API endpoints.
 *
 * Example:
 * {
 *   "error": "SLIPPAGE_EXCEEDED",
 *   "message": "Output 990 is below the requested minimum 1000",
 *   "timestamp": "2025-10-21T15:30:45.123Z",
 *   "path": "/api/tokens/3/sell",
 *   "status": 422
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /**
     * Error code (uppercase snake_case), e.g. ALREADY_GRADUATED.
     */
    private String error;

    private String message;

    /**
     * ISO-8601 timestamp when error occurred.
     */
    private String timestamp;

    private String path;

    private int status;

    /**
     * Optional: Request ID for tracing (if X-Request-ID header provided).
     */
    private String requestId;

    /**
     * Optional: Additional details (e.g., validation errors).
     */
    private Object details;

    public ErrorResponse() {
        this.timestamp = Instant.now().toString();
    }

    public ErrorResponse(String error, String message, int status, String path) {
        this();
        this.error = error;
        this.message = message;
        this.status = status;
        this.path = path;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public int getStatus() {
        return status;
    }

    public void setStatus(int status) {
        this.status = status;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public Object getDetails() {
        return details;
    }

    public void setDetails(Object details) {
        this.details = details;
    }
}
