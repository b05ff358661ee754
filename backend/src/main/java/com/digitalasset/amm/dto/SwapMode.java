// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

/**
 * INPUT fixes the amount sold, OUTPUT fixes the amount bought.
 */
public enum SwapMode {
    INPUT,
    OUTPUT
}
