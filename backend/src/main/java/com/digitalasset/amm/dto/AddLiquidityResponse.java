// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

/**
 * AddLiquidityResponse - Shares minted and the pool after the deposit
 */
public class AddLiquidityResponse {
    public final String sharesMinted;
    public final String shareBalance;
    public final PoolDTO pool;

    public AddLiquidityResponse(String sharesMinted, String shareBalance, PoolDTO pool) {
        this.sharesMinted = sharesMinted;
        this.shareBalance = shareBalance;
        this.pool = pool;
    }
}
