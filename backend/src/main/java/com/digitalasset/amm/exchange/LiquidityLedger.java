// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.exchange;

import com.digitalasset.amm.common.ExchangeException;
import com.digitalasset.amm.common.errors.InsufficientBalanceError;
import com.digitalasset.amm.common.errors.InvalidRecipientError;
import com.digitalasset.amm.event.ExchangeEvent;
import com.digitalasset.amm.ledger.Address;
import com.digitalasset.amm.ledger.TransactionManager;
import com.digitalasset.amm.util.Uint256;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pool shares of one exchange: each holder's proportional claim on the reserves.
 *
 * Mutations must run inside a transaction of the owning runtime; they record their own
 * undo actions and emit {@code Transfer}/{@code Approval} events.
 */
public final class LiquidityLedger {

    private final Address exchange;
    private final TransactionManager transactions;
    private final Map<Address, BigInteger> balances = new ConcurrentHashMap<>();
    private final Map<Address, Map<Address, BigInteger>> allowances = new ConcurrentHashMap<>();
    private volatile BigInteger totalSupply = BigInteger.ZERO;

    LiquidityLedger(final Address exchange, final TransactionManager transactions) {
        this.exchange = exchange;
        this.transactions = transactions;
    }

    public BigInteger totalSupply() {
        return totalSupply;
    }

    public BigInteger balanceOf(final Address holder) {
        return balances.getOrDefault(holder, BigInteger.ZERO);
    }

    public BigInteger allowance(final Address owner, final Address spender) {
        return allowances.getOrDefault(owner, Map.of()).getOrDefault(spender, BigInteger.ZERO);
    }

    void mint(final Address to, final BigInteger amount) {
        setTotalSupply(Uint256.add(totalSupply, amount));
        setBalance(to, Uint256.add(balanceOf(to), amount));
        transactions.emit(new ExchangeEvent.Transfer(exchange, Address.ZERO, to, amount));
    }

    void burn(final Address from, final BigInteger amount) {
        requireBalance(from, amount);
        setBalance(from, balanceOf(from).subtract(amount));
        setTotalSupply(Uint256.sub(totalSupply, amount));
        transactions.emit(new ExchangeEvent.Transfer(exchange, from, Address.ZERO, amount));
    }

    void transfer(final Address from, final Address to, final BigInteger amount) {
        Uint256.of(amount);
        if (to == null || to.isZero()) {
            throw new ExchangeException(new InvalidRecipientError("pool shares cannot be sent to the zero address"));
        }
        requireBalance(from, amount);
        setBalance(from, balanceOf(from).subtract(amount));
        setBalance(to, balanceOf(to).add(amount));
        transactions.emit(new ExchangeEvent.Transfer(exchange, from, to, amount));
    }

    void transferFrom(final Address spender, final Address from, final Address to, final BigInteger amount) {
        BigInteger allowed = allowance(from, spender);
        if (allowed.compareTo(Uint256.of(amount)) < 0) {
            throw new ExchangeException(new InsufficientBalanceError(
                    "allowance of " + spender + " for " + from + " is " + allowed + ", requested " + amount));
        }
        transfer(from, to, amount);
        setAllowance(from, spender, allowed.subtract(amount));
    }

    void approve(final Address owner, final Address spender, final BigInteger amount) {
        Uint256.of(amount);
        setAllowance(owner, spender, amount);
        transactions.emit(new ExchangeEvent.Approval(exchange, owner, spender, amount));
    }

    private void requireBalance(final Address holder, final BigInteger amount) {
        BigInteger available = balanceOf(holder);
        if (available.compareTo(amount) < 0) {
            throw new ExchangeException(new InsufficientBalanceError(
                    holder + " holds " + available + " pool shares, requested " + amount));
        }
    }

    private void setTotalSupply(final BigInteger value) {
        BigInteger previous = totalSupply;
        transactions.onRollback(() -> totalSupply = previous);
        totalSupply = value;
    }

    private void setBalance(final Address holder, final BigInteger value) {
        BigInteger previous = balanceOf(holder);
        transactions.onRollback(() -> balances.put(holder, previous));
        balances.put(holder, value);
    }

    private void setAllowance(final Address owner, final Address spender, final BigInteger value) {
        BigInteger previous = allowance(owner, spender);
        Map<Address, BigInteger> granted = allowances.computeIfAbsent(owner, k -> new ConcurrentHashMap<>());
        transactions.onRollback(() -> granted.put(spender, previous));
        granted.put(spender, value);
    }
}
