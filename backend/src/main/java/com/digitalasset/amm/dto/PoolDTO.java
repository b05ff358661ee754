// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

/**
 * Pool DTO for frontend consumption
 * Represents one exchange with its token, reserves, share supply and fee
 */
public class PoolDTO {
    public final String exchange;
    public final String token;
    public final String tokenSymbol;
    public final String ethReserve;
    public final String tokenReserve;
    public final String totalShares;
    public final String shareSymbol;
    public final long feeBps;

    /**
     * Tokens per native unit at the current reserves, as a decimal string; "0" for an empty pool.
     */
    public final String spotPrice;

    public PoolDTO(String exchange, String token, String tokenSymbol,
                   String ethReserve, String tokenReserve,
                   String totalShares, String shareSymbol, long feeBps, String spotPrice) {
        this.exchange = exchange;
        this.token = token;
        this.tokenSymbol = tokenSymbol;
        this.ethReserve = ethReserve;
        this.tokenReserve = tokenReserve;
        this.totalShares = totalShares;
        this.shareSymbol = shareSymbol;
        this.feeBps = feeBps;
        this.spotPrice = spotPrice;
    }
}
