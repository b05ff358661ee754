// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.metrics;

import com.digitalasset.amm.common.errors.SlippageExceededError;
import com.digitalasset.amm.common.errors.ValidationError;
import com.digitalasset.amm.event.ExchangeEvent;
import com.digitalasset.amm.ledger.Address;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

class SwapMetricsTest {

    private static final Address EXCHANGE = Address.of("exchange-1");
    private static final Address TRADER = Address.of("trader");

    private SimpleMeterRegistry registry;
    private SwapMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SwapMetrics(registry);
    }

    @Test
    void testSwapEvents_countedBySide() {
        metrics.onEvent(new ExchangeEvent.TokenPurchase(EXCHANGE, TRADER, BigInteger.TEN, BigInteger.TWO));
        metrics.onEvent(new ExchangeEvent.EthPurchase(EXCHANGE, TRADER, BigInteger.TWO, BigInteger.ONE));
        metrics.onEvent(new ExchangeEvent.TokenPurchase(EXCHANGE, TRADER, BigInteger.ONE, BigInteger.ONE));

        assertThat(registry.get("amm.swap.executed.total").counter().count()).isEqualTo(3.0);
        assertThat(registry.get("amm.swap.executed.by_exchange")
            .tag("exchange", "exchange-1").tag("side", "eth_to_token").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("amm.swap.executed.by_exchange")
            .tag("side", "token_to_eth").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("amm.swap.eth.amount").summary().totalAmount()).isEqualTo(12.0);
    }

    @Test
    void testLiquidityAndListingEvents() {
        metrics.onEvent(new ExchangeEvent.AddLiquidity(EXCHANGE, TRADER, BigInteger.ONE, BigInteger.ONE));
        metrics.onEvent(new ExchangeEvent.RemoveLiquidity(EXCHANGE, TRADER, BigInteger.ONE, BigInteger.ONE));
        metrics.onEvent(new ExchangeEvent.NewExchange(Address.of("registry"), Address.of("token-1"), EXCHANGE));
        metrics.onEvent(new ExchangeEvent.Transfer(EXCHANGE, TRADER, Address.ZERO, BigInteger.ONE));

        assertThat(registry.get("amm.liquidity.added.total").tag("exchange", "exchange-1").counter().count())
            .isEqualTo(1.0);
        assertThat(registry.get("amm.liquidity.removed.total").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("amm.exchange.created.total").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("amm.pool.active.count").gauge().value()).isEqualTo(1.0);
        assertThat(registry.get("amm.swap.executed.total").counter().count()).isZero();
    }

    @Test
    void testRecordFailure_taggedByReason() {
        metrics.recordFailure("swap", new SlippageExceededError("too low", BigInteger.TEN, BigInteger.ONE));
        metrics.recordFailure("swap", new ValidationError("late", ValidationError.Type.EXPIRED));
        metrics.recordFailure("addLiquidity", new ValidationError("zero"));

        assertThat(registry.get("amm.operation.failed.total").counter().count()).isEqualTo(3.0);
        assertThat(registry.get("amm.operation.failed.by_reason")
            .tag("reason", "slippage_exceeded").tag("operation", "swap").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("amm.operation.failed.by_reason")
            .tag("reason", "deadline_expired").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("amm.operation.failed.by_reason")
            .tag("reason", "invalid_parameters").tag("operation", "addLiquidity").counter().count()).isEqualTo(1.0);
    }

    @Test
    void testRecordPoolLiquidity_updatesGaugesWithoutReRegistering() {
        metrics.recordPoolLiquidity("exchange-1", BigInteger.valueOf(5), BigInteger.valueOf(10));
        metrics.recordPoolLiquidity("exchange-1", BigInteger.valueOf(6), BigInteger.valueOf(9));

        assertThat(registry.get("amm.pool.reserve.amount").tag("asset", "eth").gauge().value()).isEqualTo(6.0);
        assertThat(registry.get("amm.pool.reserve.amount").tag("asset", "token").gauge().value()).isEqualTo(9.0);
        assertThat(registry.get("amm.pool.k_invariant").tag("exchange", "exchange-1").gauge().value())
            .isEqualTo(54.0);
        assertThat(registry.find("amm.pool.k_invariant").gauges()).hasSize(1);
    }
}
