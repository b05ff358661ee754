// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.ledger;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.ExchangeException;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.event.ExchangeEvent;
import com.digitalasset.amm.event.ExchangeEventListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes every ledger, exchange and registry operation of one runtime and gives each
 * of them all-or-nothing semantics.
 *
 * A single fair lock orders all operations; nested calls (multi-hop routing) re-enter it on
 * the same thread and run inside a savepoint of the caller's journal. Events are buffered
 * and only published once the outermost operation commits.
 */
public final class TransactionManager {

    private static final Logger logger = LoggerFactory.getLogger(TransactionManager.class);

    private final ReentrantLock lock = new ReentrantLock(true);
    private final List<ExchangeEventListener> listeners = new CopyOnWriteArrayList<>();

    // Guarded by lock
    private Journal journal;

    public void addListener(final ExchangeEventListener listener) {
        listeners.add(listener);
    }

    /**
     * Run a domain operation, turning a raised {@link ExchangeException} into {@code Result.err}.
     *
     * @param operation Name used in logs
     * @param body      Operation body; all effects are rolled back if it fails
     */
    public <T> Result<T, DomainError> execute(final String operation, final Supplier<T> body) {
        try {
            return Result.ok(atomically(body));
        } catch (ExchangeException ex) {
            logger.warn("{} rejected: {}", operation, ex.error());
            return Result.err(ex.error());
        }
    }

    /**
     * Run {@code body} under the global lock inside a savepoint. Any runtime exception rolls
     * back to the savepoint and is rethrown.
     */
    public <T> T atomically(final Supplier<T> body) {
        lock.lock();
        try {
            boolean outermost = journal == null;
            if (outermost) {
                journal = new Journal();
            }
            Journal.Savepoint savepoint = journal.savepoint();
            T value;
            try {
                value = body.get();
            } catch (RuntimeException ex) {
                rollback(savepoint, outermost, ex);
                throw ex;
            }
            if (outermost) {
                List<ExchangeEvent> committed = List.copyOf(journal.events());
                journal = null;
                publish(committed);
            }
            return value;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Register an undo action with the active transaction.
     *
     * @throws IllegalStateException if called outside {@link #atomically}
     */
    public void onRollback(final Runnable undo) {
        requireActive().onRollback(undo);
    }

    /**
     * Buffer an event until the outermost operation commits.
     */
    public void emit(final ExchangeEvent event) {
        requireActive().emit(event);
    }

    public boolean inTransaction() {
        return lock.isHeldByCurrentThread() && journal != null;
    }

    private Journal requireActive() {
        if (!inTransaction()) {
            throw new IllegalStateException("no active transaction on this thread");
        }
        return journal;
    }

    private void rollback(final Journal.Savepoint savepoint, final boolean outermost, final RuntimeException cause) {
        try {
            journal.rollbackTo(savepoint);
        } catch (RuntimeException undoFailure) {
            logger.error("Rollback to savepoint {} failed; state may be inconsistent", savepoint, undoFailure);
            cause.addSuppressed(undoFailure);
        } finally {
            if (outermost) {
                journal = null;
            }
        }
    }

    private void publish(final List<ExchangeEvent> events) {
        for (ExchangeEvent event : events) {
            for (ExchangeEventListener listener : listeners) {
                try {
                    listener.onEvent(event);
                } catch (RuntimeException ex) {
                    logger.error("Event listener {} failed on {}", listener, event, ex);
                }
            }
        }
    }
}
