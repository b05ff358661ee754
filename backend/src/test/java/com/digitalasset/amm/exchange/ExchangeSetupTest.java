// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.exchange;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.common.errors.AlreadyConfiguredError;
import com.digitalasset.amm.common.errors.NotConfiguredError;
import com.digitalasset.amm.common.errors.ValidationError;
import com.digitalasset.amm.constants.SwapConstants;
import com.digitalasset.amm.ledger.Address;
import com.digitalasset.amm.ledger.InMemoryTokenLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.digitalasset.amm.exchange.ExchangeFixture.ONE;
import static com.digitalasset.amm.exchange.ExchangeFixture.party;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Exchange Setup Tests")
class ExchangeSetupTest {

    private ExchangeFixture fixture;
    private InMemoryTokenLedger token;
    private Exchange exchange;

    @BeforeEach
    void setUp() {
        fixture = new ExchangeFixture();
        token = fixture.token("TST");
        exchange = fixture.runtime.deployExchange();
    }

    @Test
    @DisplayName("Setup pairs the token and records the caller as factory")
    void testSetup() {
        // Act
        Result<Address, DomainError> result = exchange.setup(Call.from(party("factory")), token.address());

        // Assert
        assertThat(result.getValueUnsafe()).isEqualTo(token.address());
        assertThat(exchange.tokenAddress()).isEqualTo(token.address());
        assertThat(exchange.factoryAddress()).isEqualTo(party("factory"));
        assertThat(exchange.isConfigured()).isTrue();
    }

    @Test
    @DisplayName("Second setup fails and leaves the pairing unchanged")
    void testSecondSetupRejected() {
        exchange.setup(Call.from(party("factory")), token.address());
        InMemoryTokenLedger other = fixture.token("OTH");

        Result<Address, DomainError> result = exchange.setup(Call.from(party("intruder")), other.address());

        assertThat(result.getErrorUnsafe()).isInstanceOf(AlreadyConfiguredError.class);
        assertThat(exchange.tokenAddress()).isEqualTo(token.address());
        assertThat(exchange.factoryAddress()).isEqualTo(party("factory"));
    }

    @Test
    @DisplayName("Setup with the zero address or an unknown token is invalid")
    void testSetupInvalidToken() {
        assertThat(exchange.setup(Call.from(party("factory")), Address.ZERO).getErrorUnsafe())
            .isInstanceOf(ValidationError.class);
        assertThat(exchange.setup(Call.from(party("factory")), Address.of("nowhere")).getErrorUnsafe())
            .isInstanceOf(ValidationError.class);
        assertThat(exchange.isConfigured()).isFalse();
    }

    @Test
    @DisplayName("Every trading, liquidity and price operation requires setup")
    void testUninitializedOperationsRejected() {
        Call call = Call.from(party("alice")).withValue(ONE);
        long deadline = fixture.deadline();

        assertThat(exchange.addLiquidity(call, BigInteger.ONE, ONE, deadline).getErrorUnsafe())
            .isInstanceOf(NotConfiguredError.class);
        assertThat(exchange.ethToTokenSwapInput(call, BigInteger.ONE, deadline).getErrorUnsafe())
            .isInstanceOf(NotConfiguredError.class);
        assertThat(exchange.receive(call).getErrorUnsafe())
            .isInstanceOf(NotConfiguredError.class);
        assertThat(exchange.tokenToEthSwapInput(Call.from(party("alice")), ONE, BigInteger.ONE, deadline).getErrorUnsafe())
            .isInstanceOf(NotConfiguredError.class);
        assertThat(exchange.getEthToTokenInputPrice(ONE).getErrorUnsafe())
            .isInstanceOf(NotConfiguredError.class);
    }

    @Test
    @DisplayName("Pool share metadata")
    void testShareMetadata() {
        assertThat(exchange.name()).isEqualTo("Exchange Pool Share");
        assertThat(exchange.symbol()).isEqualTo(SwapConstants.SHARE_SYMBOL);
        assertThat(exchange.decimals()).isEqualTo(18);
        assertThat(exchange.totalSupply()).isZero();
    }
}
