// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token ledger held in memory; every mutation joins the active transaction.
 */
public class InMemoryTokenLedger implements TokenLedger {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryTokenLedger.class);

    private final Address address;
    private final String name;
    private final String symbol;
    private final TransactionManager transactions;
    private final Map<Address, BigInteger> balances = new ConcurrentHashMap<>();
    private final Map<Address, Map<Address, BigInteger>> allowances = new ConcurrentHashMap<>();
    private volatile BigInteger totalSupply = BigInteger.ZERO;

    public InMemoryTokenLedger(final Address address,
                               final String name,
                               final String symbol,
                               final TransactionManager transactions) {
        this.address = Objects.requireNonNull(address, "address");
        this.name = Objects.requireNonNull(name, "name");
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.transactions = Objects.requireNonNull(transactions, "transactions");
    }

    @Override
    public Address address() {
        return address;
    }

    public String name() {
        return name;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    public BigInteger totalSupply() {
        return totalSupply;
    }

    @Override
    public BigInteger balanceOf(final Address holder) {
        return balances.getOrDefault(holder, BigInteger.ZERO);
    }

    @Override
    public BigInteger allowance(final Address owner, final Address spender) {
        return allowances.getOrDefault(owner, Map.of()).getOrDefault(spender, BigInteger.ZERO);
    }

    @Override
    public boolean transfer(final Address sender, final Address to, final BigInteger amount) {
        if (!isValid(sender, to, amount)) {
            return false;
        }
        return transactions.atomically(() -> move(sender, to, amount));
    }

    @Override
    public boolean transferFrom(final Address spender, final Address from, final Address to, final BigInteger amount) {
        if (!isValid(from, to, amount) || spender == null) {
            return false;
        }
        return transactions.atomically(() -> {
            BigInteger allowed = allowance(from, spender);
            if (allowed.compareTo(amount) < 0) {
                logger.debug("{}: transferFrom of {} by {} exceeds allowance {}", symbol, amount, spender, allowed);
                return false;
            }
            if (!move(from, to, amount)) {
                return false;
            }
            setAllowance(from, spender, allowed.subtract(amount));
            return true;
        });
    }

    @Override
    public boolean approve(final Address owner, final Address spender, final BigInteger amount) {
        if (owner == null || spender == null || amount == null || amount.signum() < 0) {
            return false;
        }
        return transactions.atomically(() -> {
            setAllowance(owner, spender, amount);
            return true;
        });
    }

    /**
     * Create new tokens for a holder (funding).
     */
    public void mint(final Address holder, final BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("mint amount must be positive");
        }
        transactions.atomically(() -> {
            BigInteger previousSupply = totalSupply;
            transactions.onRollback(() -> totalSupply = previousSupply);
            totalSupply = previousSupply.add(amount);
            adjust(holder, amount);
            return null;
        });
    }

    private boolean move(final Address from, final Address to, final BigInteger amount) {
        BigInteger available = balanceOf(from);
        if (available.compareTo(amount) < 0) {
            logger.debug("{}: transfer of {} from {} exceeds balance {}", symbol, amount, from, available);
            return false;
        }
        if (amount.signum() > 0) {
            adjust(from, amount.negate());
            adjust(to, amount);
        }
        return true;
    }

    private void adjust(final Address holder, final BigInteger delta) {
        BigInteger previous = balanceOf(holder);
        transactions.onRollback(() -> balances.put(holder, previous));
        balances.put(holder, previous.add(delta));
    }

    private void setAllowance(final Address owner, final Address spender, final BigInteger amount) {
        BigInteger previous = allowance(owner, spender);
        Map<Address, BigInteger> granted = allowances.computeIfAbsent(owner, k -> new ConcurrentHashMap<>());
        transactions.onRollback(() -> granted.put(spender, previous));
        granted.put(spender, amount);
    }

    private static boolean isValid(final Address from, final Address to, final BigInteger amount) {
        return from != null && to != null && amount != null && amount.signum() >= 0;
    }

    @Override
    public String toString() {
        return symbol + "@" + address;
    }
}
