// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.exchange;

import com.digitalasset.amm.ledger.Address;
import com.digitalasset.amm.ledger.BlockClock;
import com.digitalasset.amm.ledger.InMemoryTokenLedger;
import com.digitalasset.amm.ledger.NativeLedger;
import com.digitalasset.amm.ledger.TokenLedger;
import com.digitalasset.amm.ledger.TransactionManager;
import com.digitalasset.amm.registry.ExchangeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Execution environment shared by tokens, exchanges and registries: the native ledger,
 * the block clock, the transaction manager and a directory of deployed contracts by address.
 *
 * Exchanges resolve their paired token, their registry and routing targets through
 * {@link #lookup(Address, Class)}.
 */
public final class ExchangeRuntime {

    private static final Logger logger = LoggerFactory.getLogger(ExchangeRuntime.class);

    private final TransactionManager transactions;
    private final NativeLedger nativeLedger;
    private final BlockClock blockClock;
    private final Map<Address, Object> contracts = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();

    public ExchangeRuntime(final TransactionManager transactions,
                           final NativeLedger nativeLedger,
                           final BlockClock blockClock) {
        this.transactions = Objects.requireNonNull(transactions, "transactions");
        this.nativeLedger = Objects.requireNonNull(nativeLedger, "nativeLedger");
        this.blockClock = Objects.requireNonNull(blockClock, "blockClock");
    }

    public TransactionManager transactions() {
        return transactions;
    }

    public NativeLedger nativeLedger() {
        return nativeLedger;
    }

    public BlockClock blockClock() {
        return blockClock;
    }

    /**
     * Allocate a fresh contract address such as {@code exchange-3}.
     */
    public Address nextAddress(final String kind) {
        long n = sequences.computeIfAbsent(kind, k -> new AtomicLong()).incrementAndGet();
        return new Address(kind + "-" + n);
    }

    /**
     * Register a contract under an address; undone if the enclosing transaction rolls back.
     *
     * @throws IllegalStateException if the address is already taken
     */
    public <T> T deploy(final Address address, final T contract) {
        Objects.requireNonNull(contract, "contract");
        return transactions.atomically(() -> {
            if (address.isZero() || contracts.putIfAbsent(address, contract) != null) {
                throw new IllegalStateException("address already in use: " + address);
            }
            transactions.onRollback(() -> contracts.remove(address));
            logger.debug("Deployed {} at {}", contract.getClass().getSimpleName(), address);
            return contract;
        });
    }

    public InMemoryTokenLedger createToken(final String name, final String symbol) {
        Address address = nextAddress("token");
        return deploy(address, new InMemoryTokenLedger(address, name, symbol, transactions));
    }

    /**
     * Deploy an exchange that is not yet set up.
     */
    public Exchange deployExchange() {
        Address address = nextAddress("exchange");
        return deploy(address, new Exchange(this, address));
    }

    public ExchangeRegistry deployRegistry(final Address address) {
        return deploy(address, new ExchangeRegistry(this, address));
    }

    public <T> Optional<T> lookup(final Address address, final Class<T> type) {
        if (address == null) {
            return Optional.empty();
        }
        Object contract = contracts.get(address);
        return type.isInstance(contract) ? Optional.of(type.cast(contract)) : Optional.empty();
    }

    public List<TokenLedger> tokens() {
        return contracts.values().stream()
                .filter(TokenLedger.class::isInstance)
                .map(TokenLedger.class::cast)
                .sorted(Comparator.comparing(t -> t.address().value()))
                .toList();
    }
}
