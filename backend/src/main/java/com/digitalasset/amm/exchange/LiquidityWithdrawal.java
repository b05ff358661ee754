// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.exchange;

import java.math.BigInteger;

/**
 * Amounts paid out by {@link Exchange#removeLiquidity}.
 */
public record LiquidityWithdrawal(BigInteger ethAmount, BigInteger tokenAmount) {}
