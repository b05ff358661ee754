// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;

/**
 * ApproveRequest - Let a spender (usually an exchange) pull tokens from the caller
 */
public class ApproveRequest {
    @NotBlank(message = "token is required")
    public String token;

    @NotBlank(message = "spender is required")
    public String spender;

    @NotNull(message = "amount is required")
    @PositiveOrZero(message = "amount must be non-negative")
    public BigInteger amount;

    // Default constructor for Jackson
    public ApproveRequest() {}

    public ApproveRequest(String token, String spender, BigInteger amount) {
        this.token = token;
        this.spender = spender;
        this.amount = amount;
    }
}
