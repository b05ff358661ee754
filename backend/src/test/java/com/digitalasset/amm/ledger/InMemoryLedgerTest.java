// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.ledger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryLedgerTest {

    private static final Address ALICE = Address.of("alice");
    private static final Address BOB = Address.of("bob");
    private static final Address SPENDER = Address.of("exchange-1");

    private TransactionManager transactions;
    private InMemoryNativeLedger nativeLedger;
    private InMemoryTokenLedger token;

    @BeforeEach
    void setUp() {
        transactions = new TransactionManager();
        nativeLedger = new InMemoryNativeLedger(transactions);
        token = new InMemoryTokenLedger(Address.of("token-1"), "Test Token", "TST", transactions);
        token.mint(ALICE, BigInteger.valueOf(1_000));
    }

    @Test
    void testTokenTransferMovesBalance() {
        assertThat(token.transfer(ALICE, BOB, BigInteger.valueOf(400))).isTrue();

        assertThat(token.balanceOf(ALICE)).isEqualTo(BigInteger.valueOf(600));
        assertThat(token.balanceOf(BOB)).isEqualTo(BigInteger.valueOf(400));
        assertThat(token.totalSupply()).isEqualTo(BigInteger.valueOf(1_000));
    }

    @Test
    void testTokenTransferAboveBalanceFails() {
        assertThat(token.transfer(ALICE, BOB, BigInteger.valueOf(1_001))).isFalse();
        assertThat(token.balanceOf(BOB)).isZero();
    }

    @Test
    void testTransferFromConsumesAllowance() {
        token.approve(ALICE, SPENDER, BigInteger.valueOf(500));

        assertThat(token.transferFrom(SPENDER, ALICE, BOB, BigInteger.valueOf(300))).isTrue();

        assertThat(token.allowance(ALICE, SPENDER)).isEqualTo(BigInteger.valueOf(200));
        assertThat(token.balanceOf(BOB)).isEqualTo(BigInteger.valueOf(300));
    }

    @Test
    void testTransferFromAboveAllowanceFails() {
        token.approve(ALICE, SPENDER, BigInteger.valueOf(100));

        assertThat(token.transferFrom(SPENDER, ALICE, BOB, BigInteger.valueOf(101))).isFalse();

        assertThat(token.allowance(ALICE, SPENDER)).isEqualTo(BigInteger.valueOf(100));
        assertThat(token.balanceOf(ALICE)).isEqualTo(BigInteger.valueOf(1_000));
    }

    @Test
    void testNegativeAmountsRejected() {
        assertThat(token.transfer(ALICE, BOB, BigInteger.valueOf(-1))).isFalse();
        assertThat(token.approve(ALICE, SPENDER, BigInteger.valueOf(-1))).isFalse();
        assertThat(nativeLedger.transfer(ALICE, BOB, BigInteger.valueOf(-1))).isFalse();
        assertThatThrownBy(() -> token.mint(ALICE, BigInteger.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testNativeTransferToRejectingAccountFails() {
        nativeLedger.mint(ALICE, BigInteger.TEN);
        nativeLedger.setRejectsPayments(BOB, true);

        assertThat(nativeLedger.transfer(ALICE, BOB, BigInteger.ONE)).isFalse();
        assertThat(nativeLedger.balanceOf(ALICE)).isEqualTo(BigInteger.TEN);

        nativeLedger.setRejectsPayments(BOB, false);
        assertThat(nativeLedger.transfer(ALICE, BOB, BigInteger.ONE)).isTrue();
    }

    @Test
    void testZeroNativeTransferAlwaysSucceeds() {
        assertThat(nativeLedger.transfer(ALICE, BOB, BigInteger.ZERO)).isTrue();
    }
}
