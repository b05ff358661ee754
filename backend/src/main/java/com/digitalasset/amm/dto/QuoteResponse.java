// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

/**
 * QuoteResponse - Price of a swap at the current reserves
 */
public class QuoteResponse {
    public final String exchange;
    public final SwapDirection direction;
    public final SwapMode mode;
    public final String amountIn;
    public final String amountOut;

    /**
     * Native amount routed between the two exchanges; only set for token-to-token quotes.
     */
    public final String ethRouted;

    public QuoteResponse(String exchange, SwapDirection direction, SwapMode mode,
                         String amountIn, String amountOut, String ethRouted) {
        this.exchange = exchange;
        this.direction = direction;
        this.mode = mode;
        this.amountIn = amountIn;
        this.amountOut = amountOut;
        this.ethRouted = ethRouted;
    }
}
