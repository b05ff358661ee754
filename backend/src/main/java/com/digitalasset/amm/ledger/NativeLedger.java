// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.ledger;

import java.math.BigInteger;

/**
 * Balances of the native currency.
 *
 * A transfer returns {@code false} when it cannot be settled (insufficient funds or a
 * recipient that refuses payments); callers treat that as a failed operation.
 */
public interface NativeLedger {

    BigInteger balanceOf(Address account);

    boolean transfer(Address from, Address to, BigInteger amount);
}
