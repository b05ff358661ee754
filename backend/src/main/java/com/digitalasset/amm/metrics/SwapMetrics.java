// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.metrics;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.errors.ValidationError;
import com.digitalasset.amm.event.ExchangeEvent;
import com.digitalasset.amm.event.ExchangeEventListener;
import io.micrometer.core.instrument.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Metrics collector for exchange operations.
 *
 * Provides Micrometer metrics for:
 * - Swap counters (total, by exchange and side)
 * - Liquidity add/remove counters
 * - Rejected operations by error code
 * - Pool reserve and k gauges (registered once, updated after each committed operation)
 *
 * Swap and liquidity counters are fed by committed exchange events, so rolled back
 * operations never count. Tags use exchange addresses and error codes only.
 */
@Component
public class SwapMetrics implements ExchangeEventListener {

    private static final Logger logger = LoggerFactory.getLogger(SwapMetrics.class);

    private final MeterRegistry meterRegistry;
    private final Counter swapsExecuted;
    private final Counter swapsFailed;
    private final Counter exchangesCreated;
    private final DistributionSummary swapEthAmounts;
    private final DistributionSummary swapTokenAmounts;

    // Pool tracking (prevent gauge re-registration)
    private final AtomicInteger activePoolsCount = new AtomicInteger(0);
    private final Map<String, AtomicReference<BigInteger>> poolReserveGauges = new ConcurrentHashMap<>();
    private final Map<String, AtomicReference<BigInteger>> poolKInvariantGauges = new ConcurrentHashMap<>();

    public SwapMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.swapsExecuted = Counter.builder("amm.swap.executed.total")
            .description("Total number of committed swaps (each leg of a routed trade counts)")
            .register(meterRegistry);

        this.swapsFailed = Counter.builder("amm.operation.failed.total")
            .description("Total number of rejected exchange operations")
            .register(meterRegistry);

        this.exchangesCreated = Counter.builder("amm.exchange.created.total")
            .description("Total number of exchanges created by the registry")
            .register(meterRegistry);

        this.swapEthAmounts = DistributionSummary.builder("amm.swap.eth.amount")
            .description("Distribution of native amounts traded per swap")
            .baseUnit("wei")
            .register(meterRegistry);

        this.swapTokenAmounts = DistributionSummary.builder("amm.swap.token.amount")
            .description("Distribution of token amounts traded per swap")
            .baseUnit("tokens")
            .register(meterRegistry);

        Gauge.builder("amm.pool.active.count", activePoolsCount, AtomicInteger::get)
            .description("Number of listed exchanges")
            .register(meterRegistry);
    }

    @Override
    public void onEvent(ExchangeEvent event) {
        if (event instanceof ExchangeEvent.TokenPurchase purchase) {
            recordSwap(purchase.source().value(), "eth_to_token", purchase.ethSold(), purchase.tokensBought());
        } else if (event instanceof ExchangeEvent.EthPurchase purchase) {
            recordSwap(purchase.source().value(), "token_to_eth", purchase.ethBought(), purchase.tokensSold());
        } else if (event instanceof ExchangeEvent.AddLiquidity added) {
            meterRegistry.counter("amm.liquidity.added.total", "exchange", added.source().value()).increment();
        } else if (event instanceof ExchangeEvent.RemoveLiquidity removed) {
            meterRegistry.counter("amm.liquidity.removed.total", "exchange", removed.source().value()).increment();
        } else if (event instanceof ExchangeEvent.NewExchange created) {
            exchangesCreated.increment();
            activePoolsCount.incrementAndGet();
            logger.debug("Tracking exchange {} for token {}", created.exchange(), created.token());
        }
    }

    /**
     * Record a rejected operation.
     */
    public void recordFailure(String operation, DomainError error) {
        swapsFailed.increment();
        meterRegistry.counter("amm.operation.failed.by_reason",
            "reason", normalizeReason(error),
            "operation", operation).increment();
    }

    /**
     * Update pool reserve and k gauges.
     * Gauges are registered once and updated via AtomicReference.
     */
    public void recordPoolLiquidity(String exchange, BigInteger ethReserve, BigInteger tokenReserve) {
        reserveGauge(exchange, "eth").set(ethReserve);
        reserveGauge(exchange, "token").set(tokenReserve);

        BigInteger k = ethReserve.multiply(tokenReserve);
        poolKInvariantGauges.computeIfAbsent(exchange, p -> {
            AtomicReference<BigInteger> ref = new AtomicReference<>(k);
            Gauge.builder("amm.pool.k_invariant", ref, r -> r.get().doubleValue())
                .tag("exchange", exchange)
                .description("Constant product k = ethReserve * tokenReserve")
                .register(meterRegistry);
            return ref;
        }).set(k);
    }

    private void recordSwap(String exchange, String side, BigInteger ethAmount, BigInteger tokenAmount) {
        swapsExecuted.increment();
        meterRegistry.counter("amm.swap.executed.by_exchange",
            "exchange", exchange,
            "side", side).increment();
        swapEthAmounts.record(ethAmount.doubleValue());
        swapTokenAmounts.record(tokenAmount.doubleValue());
    }

    private AtomicReference<BigInteger> reserveGauge(String exchange, String asset) {
        return poolReserveGauges.computeIfAbsent(exchange + ":" + asset, k -> {
            AtomicReference<BigInteger> ref = new AtomicReference<>(BigInteger.ZERO);
            Gauge.builder("amm.pool.reserve.amount", ref, r -> r.get().doubleValue())
                .tag("exchange", exchange)
                .tag("asset", asset)
                .description("Pool reserve amount")
                .register(meterRegistry);
            return ref;
        });
    }

    /**
     * Expired deadlines are reported apart from other parameter errors.
     */
    private String normalizeReason(DomainError error) {
        if (error == null) return "unknown";
        if (error instanceof ValidationError validation && validation.type() == ValidationError.Type.EXPIRED) {
            return "deadline_expired";
        }
        return error.code().toLowerCase(Locale.ROOT);
    }
}
