// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.ledger;

import java.math.BigInteger;

/**
 * Fungible token ledger an exchange trades against.
 *
 * {@code transfer} moves the sender's own balance; {@code transferFrom} moves funds on
 * behalf of {@code from} within the allowance granted to {@code spender}. Both return
 * {@code false} instead of moving anything when they cannot settle.
 */
public interface TokenLedger {

    Address address();

    String symbol();

    BigInteger balanceOf(Address holder);

    BigInteger allowance(Address owner, Address spender);

    boolean transfer(Address sender, Address to, BigInteger amount);

    boolean transferFrom(Address spender, Address from, Address to, BigInteger amount);

    boolean approve(Address owner, Address spender, BigInteger amount);
}
