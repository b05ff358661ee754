// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;

/**
 * ExecuteSwapRequest - Swap against the exchange of the token in the path
 *
 * amount is the exact side of the trade (sold for INPUT, bought for OUTPUT); limit is the
 * bound on the other side (minimum bought for INPUT, maximum sold for OUTPUT). For
 * ETH_TO_TOKEN/OUTPUT the limit is the native amount attached and the unused part is refunded.
 */
public class ExecuteSwapRequest {
    @NotNull(message = "direction is required")
    public SwapDirection direction;

    @NotNull(message = "mode is required")
    public SwapMode mode;

    @NotNull(message = "amount is required")
    @Positive(message = "amount must be positive")
    public BigInteger amount;

    @NotNull(message = "limit is required")
    @PositiveOrZero(message = "limit must be non-negative")
    public BigInteger limit;

    /**
     * TOKEN_TO_TOKEN only: minimum native amount routed (INPUT) or maximum (OUTPUT).
     */
    @PositiveOrZero(message = "ethLimit must be non-negative")
    public BigInteger ethLimit;

    public Long deadline;

    /**
     * Receiver of the bought asset; the caller when absent.
     */
    public String recipient;

    /**
     * TOKEN_TO_TOKEN only: token to buy, resolved through the registry.
     */
    public String outputToken;

    /**
     * TOKEN_TO_TOKEN only: exchange to buy from directly.
     */
    public String outputExchange;

    // Default constructor for Jackson
    public ExecuteSwapRequest() {}

    public ExecuteSwapRequest(SwapDirection direction, SwapMode mode, BigInteger amount, BigInteger limit) {
        this.direction = direction;
        this.mode = mode;
        this.amount = amount;
        this.limit = limit;
    }
}
