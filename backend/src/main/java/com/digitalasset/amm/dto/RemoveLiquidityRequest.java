// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigInteger;

/**
 * RemoveLiquidityRequest - Request to burn pool shares
 */
public class RemoveLiquidityRequest {
    @NotNull(message = "shares is required")
    @Positive(message = "shares must be positive")
    public BigInteger shares;

    @NotNull(message = "minEth is required")
    @Positive(message = "minEth must be positive")
    public BigInteger minEth;

    @NotNull(message = "minTokens is required")
    @Positive(message = "minTokens must be positive")
    public BigInteger minTokens;

    public Long deadline;

    // Default constructor for Jackson
    public RemoveLiquidityRequest() {}

    public RemoveLiquidityRequest(BigInteger shares, BigInteger minEth, BigInteger minTokens, Long deadline) {
        this.shares = shares;
        this.minEth = minEth;
        this.minTokens = minTokens;
        this.deadline = deadline;
    }
}
