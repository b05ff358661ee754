// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.ledger;

/**
 * Source of the current ordering-sequence number that deadlines are compared against.
 */
@FunctionalInterface
public interface BlockClock {

    long currentBlock();
}
