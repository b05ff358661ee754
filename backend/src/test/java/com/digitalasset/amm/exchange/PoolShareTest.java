// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.exchange;

import com.digitalasset.amm.common.errors.InsufficientBalanceError;
import com.digitalasset.amm.common.errors.InvalidRecipientError;
import com.digitalasset.amm.event.ExchangeEvent;
import com.digitalasset.amm.ledger.Address;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.digitalasset.amm.exchange.ExchangeFixture.ONE;
import static com.digitalasset.amm.exchange.ExchangeFixture.TWO;
import static com.digitalasset.amm.exchange.ExchangeFixture.party;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Pool Share Tests")
class PoolShareTest {

    private static final Address ALICE = party("alice");
    private static final Address BOB = party("bob");
    private static final Address CAROL = party("carol");

    private ExchangeFixture fixture;
    private Exchange exchange;

    @BeforeEach
    void setUp() {
        fixture = new ExchangeFixture();
        exchange = fixture.pool(fixture.token("TST"), ALICE, TWO, TWO);
    }

    @Test
    @DisplayName("Transfer moves shares and keeps total supply")
    void testTransfer() {
        // Act
        boolean moved = exchange.transfer(Call.from(ALICE), BOB, ONE).getValueUnsafe();

        // Assert
        assertThat(moved).isTrue();
        assertThat(exchange.balanceOf(ALICE)).isEqualTo(ONE);
        assertThat(exchange.balanceOf(BOB)).isEqualTo(ONE);
        assertThat(exchange.totalSupply()).isEqualTo(TWO);
        assertThat(fixture.events).containsExactly(new ExchangeEvent.Transfer(exchange.address(), ALICE, BOB, ONE));
    }

    @Test
    @DisplayName("Transferred shares can be redeemed by the new holder")
    void testTransferredSharesRedeemable() {
        exchange.transfer(Call.from(ALICE), BOB, ONE);

        LiquidityWithdrawal withdrawal = exchange.removeLiquidity(
            Call.from(BOB), ONE, BigInteger.ONE, BigInteger.ONE, fixture.deadline()).getValueUnsafe();

        assertThat(withdrawal.ethAmount()).isEqualTo(ONE);
        assertThat(withdrawal.tokenAmount()).isEqualTo(ONE);
        assertThat(fixture.nativeLedger.balanceOf(BOB)).isEqualTo(ONE);
    }

    @Test
    @DisplayName("Transfer to the zero address is rejected")
    void testTransferToZero() {
        assertThat(exchange.transfer(Call.from(ALICE), Address.ZERO, ONE).getErrorUnsafe())
            .isInstanceOf(InvalidRecipientError.class);
        assertThat(exchange.balanceOf(ALICE)).isEqualTo(TWO);
    }

    @Test
    @DisplayName("Transfer above the holding is rejected")
    void testTransferAboveBalance() {
        assertThat(exchange.transfer(Call.from(BOB), ALICE, BigInteger.ONE).getErrorUnsafe())
            .isInstanceOf(InsufficientBalanceError.class);
        assertThat(fixture.events).isEmpty();
    }

    @Test
    @DisplayName("Approve then transferFrom spends the allowance")
    void testApproveAndTransferFrom() {
        // Arrange
        exchange.approve(Call.from(ALICE), BOB, ONE).getValueUnsafe();

        // Act
        boolean moved = exchange.transferFrom(Call.from(BOB), ALICE, CAROL, ONE).getValueUnsafe();

        // Assert
        assertThat(moved).isTrue();
        assertThat(exchange.balanceOf(CAROL)).isEqualTo(ONE);
        assertThat(exchange.allowance(ALICE, BOB)).isZero();
        assertThat(fixture.events).containsExactly(
            new ExchangeEvent.Approval(exchange.address(), ALICE, BOB, ONE),
            new ExchangeEvent.Transfer(exchange.address(), ALICE, CAROL, ONE));
    }

    @Test
    @DisplayName("TransferFrom above the allowance leaves balances and allowance untouched")
    void testTransferFromAboveAllowance() {
        exchange.approve(Call.from(ALICE), BOB, ONE);

        assertThat(exchange.transferFrom(Call.from(BOB), ALICE, CAROL, TWO).getErrorUnsafe())
            .isInstanceOf(InsufficientBalanceError.class);
        assertThat(exchange.allowance(ALICE, BOB)).isEqualTo(ONE);
        assertThat(exchange.balanceOf(ALICE)).isEqualTo(TWO);
    }
}
