// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.config;

import com.pumpfud.launchpad.common.DomainError;
import com.pumpfud.launchpad.common.DomainErrorException;
import com.pumpfud.launchpad.constants.LaunchpadConstants;
import com.pumpfud.launchpad.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for all REST controllers.
 *
 * Provides standardized error responses across all endpoints:
 * - DomainErrorException (engine errors, status taken from the error kind)
 * - Validation and binding errors (400 Bad Request)
 * - Generic exceptions (500 Internal Server Error)
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle engine errors surfaced by controllers.
     */
    @ExceptionHandler(DomainErrorException.class)
    public ResponseEntity<ErrorResponse> handleDomainError(
            DomainErrorException ex,
            HttpServletRequest request
    ) {
        DomainError error = ex.error();
        ErrorResponse errorResponse = withRequestId(new ErrorResponse(
            error.code(),
            error.message(),
            error.httpStatus(),
            request.getRequestURI()
        ), request);

        logger.warn("DomainError: {} {} - {}", error.httpStatus(), request.getRequestURI(), error);

        return ResponseEntity.status(error.httpStatus()).body(errorResponse);
    }

    /**
     * Handle validation errors (e.g., @Valid annotation failures).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        Map<String, String> validationErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
            validationErrors.put(error.getField(), error.getDefaultMessage())
        );

        ErrorResponse errorResponse = withRequestId(new ErrorResponse(
            "VALIDATION_ERROR",
            "Request validation failed",
            HttpStatus.BAD_REQUEST.value(),
            request.getRequestURI()
        ), request);
        errorResponse.setDetails(validationErrors);

        logger.warn("Validation error on {}: {}", request.getRequestURI(), validationErrors);

        return ResponseEntity.badRequest().body(errorResponse);
    }

    /**
     * Handle a missing caller header or query parameter, or an unparseable path variable.
     */
    @ExceptionHandler({
        MissingRequestHeaderException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(
            Exception ex,
            HttpServletRequest request
    ) {
        String message = ex instanceof MissingRequestHeaderException missing
            && LaunchpadConstants.ACCOUNT_HEADER.equals(missing.getHeaderName())
                ? "Header " + LaunchpadConstants.ACCOUNT_HEADER + " naming the acting account is required"
                : ex.getMessage();

        ErrorResponse errorResponse = withRequestId(new ErrorResponse(
            "BAD_REQUEST",
            message,
            HttpStatus.BAD_REQUEST.value(),
            request.getRequestURI()
        ), request);

        logger.warn("Bad request on {}: {}", request.getRequestURI(), message);

        return ResponseEntity.badRequest().body(errorResponse);
    }

    /**
     * Handle all other uncaught exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            HttpServletRequest request
    ) {
        ErrorResponse errorResponse = withRequestId(new ErrorResponse(
            "INTERNAL_SERVER_ERROR",
            ex.getMessage() != null ? ex.getMessage() : "An unexpected error occurred",
            HttpStatus.INTERNAL_SERVER_ERROR.value(),
            request.getRequestURI()
        ), request);

        logger.error("Unhandled exception on {}: {}", request.getRequestURI(), ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private static ErrorResponse withRequestId(ErrorResponse response, HttpServletRequest request) {
        String requestId = request.getHeader(LaunchpadConstants.REQUEST_ID_HEADER);
        if (requestId != null) {
            response.setRequestId(requestId);
        }
        return response;
    }
}
