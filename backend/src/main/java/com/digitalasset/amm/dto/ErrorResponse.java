// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Body of every rejected API call. {@code error} is the domain error code where there is one;
 * {@code details} carries the bound and actual amount of a slippage failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error,
                            String message,
                            int status,
                            String path,
                            String requestId,
                            Object details,
                            String timestamp) {

    public static ErrorResponse of(String error, String message, int status, String path,
                                   String requestId, Object details) {
        return new ErrorResponse(error, message, status, path, requestId, details, Instant.now().toString());
    }
}
