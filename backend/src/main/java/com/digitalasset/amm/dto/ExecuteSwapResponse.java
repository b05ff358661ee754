// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

/**
 * ExecuteSwapResponse - Settled amounts of a swap
 */
public class ExecuteSwapResponse {
    public final String exchange;
    public final SwapDirection direction;
    public final SwapMode mode;
    public final String amountIn;
    public final String amountOut;
    public final String recipient;
    public final PoolDTO pool;

    public ExecuteSwapResponse(String exchange, SwapDirection direction, SwapMode mode,
                               String amountIn, String amountOut, String recipient, PoolDTO pool) {
        this.exchange = exchange;
        this.direction = direction;
        this.mode = mode;
        this.amountIn = amountIn;
        this.amountOut = amountOut;
        this.recipient = recipient;
        this.pool = pool;
    }
}
