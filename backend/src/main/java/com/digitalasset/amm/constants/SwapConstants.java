// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.constants;

import java.math.BigInteger;

/**
 * Centralized constants for swap and liquidity operations.
 *
 * All pricing and liquidity limits defined here for easy auditing.
 */
public final class SwapConstants {

    private SwapConstants() {
        // Prevent instantiation
    }

    // ========================================
    // FEE STRUCTURE
    // ========================================

    /**
     * Total swap fee in basis points (0.3% = 30 bps), all of it accrues to liquidity providers.
     */
    public static final long FEE_BPS = 30;

    /**
     * Input multiplier applied before the constant-product computation (1000 - 3).
     */
    public static final BigInteger FEE_NUMERATOR = BigInteger.valueOf(997);

    /**
     * Scale of {@link #FEE_NUMERATOR}.
     */
    public static final BigInteger FEE_DENOMINATOR = BigInteger.valueOf(1000);

    // ========================================
    // LIQUIDITY
    // ========================================

    /**
     * Minimum native amount of the first deposit into an empty pool (dust threshold).
     */
    public static final BigInteger MIN_INITIAL_LIQUIDITY = BigInteger.valueOf(1_000_000_000L);

    /**
     * Minimum tokens accepted by the fallback swap.
     */
    public static final BigInteger FALLBACK_MIN_TOKENS = BigInteger.ONE;

    // ========================================
    // DEADLINES
    // ========================================

    /**
     * Deadline applied by the REST layer when a request carries none (10 minutes from now).
     */
    public static final long DEFAULT_DEADLINE_SECONDS = 600;

    // ========================================
    // POOL SHARE METADATA
    // ========================================

    public static final String SHARE_NAME = "Exchange Pool Share";

    public static final String SHARE_SYMBOL = "POOL-V1";

    public static final int SHARE_DECIMALS = 18;

    // ========================================
    // HTTP
    // ========================================

    /**
     * Header carrying the calling party.
     */
    public static final String PARTY_HEADER = "X-Party";

    /**
     * Header carrying the request correlation id.
     */
    public static final String REQUEST_ID_HEADER = "X-Request-ID";
}
