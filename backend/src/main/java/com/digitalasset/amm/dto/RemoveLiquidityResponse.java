// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

/**
 * RemoveLiquidityResponse - Assets paid out for the burned shares
 */
public class RemoveLiquidityResponse {
    public final String sharesBurned;
    public final String ethAmount;
    public final String tokenAmount;
    public final PoolDTO pool;

    public RemoveLiquidityResponse(String sharesBurned, String ethAmount, String tokenAmount, PoolDTO pool) {
        this.sharesBurned = sharesBurned;
        this.ethAmount = ethAmount;
        this.tokenAmount = tokenAmount;
        this.pool = pool;
    }
}
