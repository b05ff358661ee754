// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.config;

import com.digitalasset.amm.event.ExchangeEventListener;
import com.digitalasset.amm.exchange.ExchangeRuntime;
import com.digitalasset.amm.ledger.Address;
import com.digitalasset.amm.ledger.BlockClock;
import com.digitalasset.amm.ledger.InMemoryNativeLedger;
import com.digitalasset.amm.ledger.SystemBlockClock;
import com.digitalasset.amm.ledger.TransactionManager;
import com.digitalasset.amm.registry.ExchangeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the in-memory runtime: one transaction manager, the native ledger, the block
 * clock and a single registry at {@code amm.registry.address}.
 */
@Configuration
public class ExchangeConfig {

    private static final Logger logger = LoggerFactory.getLogger(ExchangeConfig.class);

    @Value("${amm.block-clock.offset:0}")
    private long blockClockOffset;

    @Value("${amm.registry.address:registry}")
    private String registryAddress;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BlockClock blockClock(Clock clock) {
        return new SystemBlockClock(clock, blockClockOffset);
    }

    @Bean
    public TransactionManager transactionManager(ObjectProvider<ExchangeEventListener> listeners) {
        TransactionManager transactions = new TransactionManager();
        listeners.orderedStream().forEach(listener -> {
            transactions.addListener(listener);
            logger.info("Registered exchange event listener {}", listener.getClass().getSimpleName());
        });
        return transactions;
    }

    @Bean
    public InMemoryNativeLedger nativeLedger(TransactionManager transactionManager) {
        return new InMemoryNativeLedger(transactionManager);
    }

    @Bean
    public ExchangeRuntime exchangeRuntime(TransactionManager transactionManager,
                                           InMemoryNativeLedger nativeLedger,
                                           BlockClock blockClock) {
        return new ExchangeRuntime(transactionManager, nativeLedger, blockClock);
    }

    @Bean
    public ExchangeRegistry exchangeRegistry(ExchangeRuntime exchangeRuntime) {
        ExchangeRegistry registry = exchangeRuntime.deployRegistry(Address.of(registryAddress));
        logger.info("Exchange registry deployed at {} (block clock offset {}s)", registry.address(), blockClockOffset);
        return registry;
    }
}
