// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;

/**
 * AddLiquidityRequest - Request to add liquidity to a pool
 */
public class AddLiquidityRequest {
    @NotNull(message = "ethAmount is required")
    @Positive(message = "ethAmount must be positive")
    public BigInteger ethAmount;

    @NotNull(message = "maxTokens is required")
    @Positive(message = "maxTokens must be positive")
    public BigInteger maxTokens;

    @NotNull(message = "minLiquidity is required")
    @PositiveOrZero(message = "minLiquidity must be non-negative")
    public BigInteger minLiquidity;

    /**
     * Absolute deadline in block seconds; defaults to ten minutes from now.
     */
    public Long deadline;

    // Default constructor for Jackson
    public AddLiquidityRequest() {}

    public AddLiquidityRequest(BigInteger ethAmount, BigInteger maxTokens, BigInteger minLiquidity, Long deadline) {
        this.ethAmount = ethAmount;
        this.maxTokens = maxTokens;
        this.minLiquidity = minLiquidity;
        this.deadline = deadline;
    }
}
