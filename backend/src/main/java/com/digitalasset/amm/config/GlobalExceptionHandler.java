// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.config;

import com.digitalasset.amm.common.ExchangeException;
import com.digitalasset.amm.controller.DomainErrorStatusMapper;
import com.digitalasset.amm.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for all REST controllers.
 *
 * Provides standardized error responses across all endpoints:
 * - ResponseStatusException (4xx/5xx errors)
 * - Validation errors, unreadable bodies, bad parameters and missing headers (400 Bad Request)
 * - ExchangeException escaping a domain boundary (status of its domain error)
 * - Generic exceptions (500 Internal Server Error)
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(
            ResponseStatusException ex,
            HttpServletRequest request
    ) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        String message = ex.getReason() != null ? ex.getReason() : status.getReasonPhrase();

        logger.warn("ResponseStatusException: {} {} - {}",
            status.value(), request.getRequestURI(), message);

        return respond(status, getErrorCodeFromStatus(status), message, request, null);
    }

    /**
     * Handle validation errors (e.g., @Valid annotation failures).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        Map<String, String> validationErrors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
            validationErrors.put(error.getField(), error.getDefaultMessage())
        );

        logger.warn("Validation error on {}: {}", request.getRequestURI(), validationErrors);

        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request validation failed", request, validationErrors);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(
            MissingRequestHeaderException ex,
            HttpServletRequest request
    ) {
        logger.warn("Missing header {} on {}", ex.getHeaderName(), request.getRequestURI());
        return respond(HttpStatus.BAD_REQUEST, "MISSING_HEADER",
            "Required header " + ex.getHeaderName() + " is missing", request, null);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
        IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.warn("Bad request on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Malformed request: " + ex.getMessage(), request, null);
    }

    /**
     * Domain failures are normally returned as results; this covers one thrown past a boundary.
     */
    @ExceptionHandler(ExchangeException.class)
    public ResponseEntity<ErrorResponse> handleExchangeException(
            ExchangeException ex,
            HttpServletRequest request
    ) {
        logger.warn("Exchange error on {}: {}", request.getRequestURI(), ex.error());
        return DomainErrorStatusMapper.toResponse(ex.error(), request.getRequestURI());
    }

    /**
     * Handle all other uncaught exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.error("Unhandled exception on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR",
            ex.getMessage() != null ? ex.getMessage() : "An unexpected error occurred", request, null);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String errorCode, String message,
                                                  HttpServletRequest request, Object details) {
        ErrorResponse errorResponse = ErrorResponse.of(errorCode, message, status.value(), request.getRequestURI(),
            MDC.get(RequestIdFilter.MDC_KEY), details);
        return ResponseEntity.status(status).body(errorResponse);
    }

    /**
     * Map HTTP status to error code.
     */
    private String getErrorCodeFromStatus(HttpStatus status) {
        return switch (status) {
            case BAD_REQUEST -> "BAD_REQUEST";
            case FORBIDDEN -> "FORBIDDEN";
            case NOT_FOUND -> "NOT_FOUND";
            case CONFLICT -> "CONFLICT";
            case UNPROCESSABLE_ENTITY -> "UNPROCESSABLE_ENTITY";
            case INTERNAL_SERVER_ERROR -> "INTERNAL_SERVER_ERROR";
            default -> status.name();
        };
    }
}
