// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.controller;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.errors.SlippageExceededError;
import com.digitalasset.amm.config.RequestIdFilter;
import com.digitalasset.amm.dto.ErrorResponse;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/**
 * HTTP mapping of domain errors.
 */
public final class DomainErrorStatusMapper {

    private DomainErrorStatusMapper() {
    }

    public static HttpStatus map(final DomainError error) {
        HttpStatus derived = HttpStatus.resolve(error.httpStatus());
        return derived != null ? derived : HttpStatus.INTERNAL_SERVER_ERROR;
    }

    /**
     * Error payload for a rejected operation; slippage errors carry their bound and actual amount.
     */
    public static ResponseEntity<ErrorResponse> toResponse(final DomainError error, final String path) {
        HttpStatus status = map(error);
        Object details = null;
        if (error instanceof SlippageExceededError slippage) {
            details = Map.of(
                "bound", slippage.bound().toString(),
                "actual", slippage.actual().toString());
        }
        ErrorResponse payload = ErrorResponse.of(error.code(), error.message(), status.value(), path,
            MDC.get(RequestIdFilter.MDC_KEY), details);
        return ResponseEntity.status(status).body(payload);
    }
}
