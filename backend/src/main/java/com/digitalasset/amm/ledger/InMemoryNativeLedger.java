// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Native currency balances held in memory; every mutation joins the active transaction.
 */
public class InMemoryNativeLedger implements NativeLedger {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryNativeLedger.class);

    private final TransactionManager transactions;
    private final Map<Address, BigInteger> balances = new ConcurrentHashMap<>();
    private final Set<Address> rejectingAccounts = ConcurrentHashMap.newKeySet();

    public InMemoryNativeLedger(final TransactionManager transactions) {
        this.transactions = Objects.requireNonNull(transactions, "transactions");
    }

    @Override
    public BigInteger balanceOf(final Address account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public boolean transfer(final Address from, final Address to, final BigInteger amount) {
        if (amount == null || amount.signum() < 0 || from == null || to == null) {
            return false;
        }
        return transactions.atomically(() -> {
            if (amount.signum() == 0) {
                return true;
            }
            if (rejectingAccounts.contains(to)) {
                logger.debug("Native transfer of {} to {} refused by recipient", amount, to);
                return false;
            }
            if (balanceOf(from).compareTo(amount) < 0) {
                logger.debug("Native transfer of {} from {} exceeds balance {}", amount, from, balanceOf(from));
                return false;
            }
            adjust(from, amount.negate());
            adjust(to, amount);
            return true;
        });
    }

    /**
     * Credit new native currency to an account (funding).
     */
    public void mint(final Address account, final BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("mint amount must be positive");
        }
        transactions.atomically(() -> {
            adjust(account, amount);
            return null;
        });
    }

    /**
     * Make an account refuse (or accept again) incoming native payments.
     */
    public void setRejectsPayments(final Address account, final boolean rejects) {
        if (rejects) {
            rejectingAccounts.add(account);
        } else {
            rejectingAccounts.remove(account);
        }
    }

    private void adjust(final Address account, final BigInteger delta) {
        BigInteger previous = balanceOf(account);
        transactions.onRollback(() -> balances.put(account, previous));
        balances.put(account, previous.add(delta));
    }
}
