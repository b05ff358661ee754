// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.ledger;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.ExchangeException;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.common.errors.ValidationError;
import com.digitalasset.amm.event.ExchangeEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Transaction Manager Tests")
class TransactionManagerTest {

    private static final Address SOURCE = Address.of("exchange-1");
    private static final Address ALICE = Address.of("alice");
    private static final Address BOB = Address.of("bob");

    private TransactionManager transactions;
    private InMemoryNativeLedger ledger;
    private List<ExchangeEvent> published;

    @BeforeEach
    void setUp() {
        transactions = new TransactionManager();
        ledger = new InMemoryNativeLedger(transactions);
        published = new ArrayList<>();
        transactions.addListener(published::add);
        ledger.mint(ALICE, BigInteger.valueOf(100));
    }

    @Test
    @DisplayName("Committed operation keeps its effects and publishes its events")
    void testCommit() {
        // Act
        Result<Boolean, DomainError> result = transactions.execute("pay", () -> {
            ledger.transfer(ALICE, BOB, BigInteger.TEN);
            transactions.emit(new ExchangeEvent.Transfer(SOURCE, ALICE, BOB, BigInteger.TEN));
            return true;
        });

        // Assert
        assertThat(result.isOk()).isTrue();
        assertThat(ledger.balanceOf(BOB)).isEqualTo(BigInteger.TEN);
        assertThat(published).hasSize(1);
    }

    @Test
    @DisplayName("Domain failure rolls back balances and drops buffered events")
    void testRollbackOnDomainError() {
        // Act
        Result<Boolean, DomainError> result = transactions.execute("pay", () -> {
            ledger.transfer(ALICE, BOB, BigInteger.TEN);
            transactions.emit(new ExchangeEvent.Transfer(SOURCE, ALICE, BOB, BigInteger.TEN));
            throw new ExchangeException(new ValidationError("rejected after transfer"));
        });

        // Assert
        assertThat(result.isErr()).isTrue();
        assertThat(result.getErrorUnsafe()).isInstanceOf(ValidationError.class);
        assertThat(ledger.balanceOf(ALICE)).isEqualTo(BigInteger.valueOf(100));
        assertThat(ledger.balanceOf(BOB)).isZero();
        assertThat(published).isEmpty();
    }

    @Test
    @DisplayName("Nested failure undoes only the nested segment when the outer call recovers")
    void testNestedSavepoint() {
        // Act
        transactions.execute("outer", () -> {
            ledger.transfer(ALICE, BOB, BigInteger.ONE);
            Result<Boolean, DomainError> inner = transactions.execute("inner", () -> {
                ledger.transfer(ALICE, BOB, BigInteger.TEN);
                transactions.emit(new ExchangeEvent.Transfer(SOURCE, ALICE, BOB, BigInteger.TEN));
                throw new ExchangeException(new ValidationError("inner rejected"));
            });
            assertThat(inner.isErr()).isTrue();
            return true;
        });

        // Assert
        assertThat(ledger.balanceOf(BOB)).isEqualTo(BigInteger.ONE);
        assertThat(published).isEmpty();
    }

    @Test
    @DisplayName("Nested failure rethrown by the outer call undoes everything")
    void testNestedFailurePropagates() {
        ValidationError innerError = new ValidationError("inner rejected");

        Result<Boolean, DomainError> result = transactions.execute("outer", () -> {
            ledger.transfer(ALICE, BOB, BigInteger.ONE);
            return transactions.<Boolean>execute("inner", () -> {
                throw new ExchangeException(innerError);
            }).orElseThrow(ExchangeException::new);
        });

        assertThat(result.getErrorUnsafe()).isSameAs(innerError);
        assertThat(ledger.balanceOf(BOB)).isZero();
    }

    @Test
    @DisplayName("Unexpected runtime exceptions roll back and propagate")
    void testUnexpectedExceptionPropagates() {
        assertThatThrownBy(() -> transactions.execute("boom", () -> {
            ledger.transfer(ALICE, BOB, BigInteger.TEN);
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(ledger.balanceOf(BOB)).isZero();
        assertThat(transactions.inTransaction()).isFalse();
    }

    @Test
    @DisplayName("Listener failure does not undo a committed operation")
    void testListenerFailureIsIsolated() {
        transactions.addListener(event -> {
            throw new IllegalStateException("listener down");
        });

        Result<Boolean, DomainError> result = transactions.execute("pay", () -> {
            transactions.emit(new ExchangeEvent.Transfer(SOURCE, ALICE, BOB, BigInteger.ONE));
            return ledger.transfer(ALICE, BOB, BigInteger.ONE);
        });

        assertThat(result.getValueUnsafe()).isTrue();
        assertThat(ledger.balanceOf(BOB)).isEqualTo(BigInteger.ONE);
        assertThat(published).hasSize(1);
    }

    @Test
    @DisplayName("Journal access outside a transaction is rejected")
    void testOutsideTransaction() {
        assertThatThrownBy(() -> transactions.onRollback(() -> { }))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> transactions.emit(new ExchangeEvent.Transfer(SOURCE, ALICE, BOB, BigInteger.ONE)))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Concurrent transfers are serialized without losing updates")
    void testConcurrentTransfers() throws InterruptedException {
        // Arrange
        int threads = 8;
        int transfersPerThread = 50;
        ledger.mint(ALICE, BigInteger.valueOf(10_000));
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        // Act
        for (int t = 0; t < threads; t++) {
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < transfersPerThread; i++) {
                    transactions.execute("pay", () -> ledger.transfer(ALICE, BOB, BigInteger.ONE));
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();

        // Assert
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
        assertThat(ledger.balanceOf(BOB)).isEqualTo(BigInteger.valueOf(threads * transfersPerThread));
        assertThat(ledger.balanceOf(ALICE).add(ledger.balanceOf(BOB))).isEqualTo(BigInteger.valueOf(10_100));
    }
}
