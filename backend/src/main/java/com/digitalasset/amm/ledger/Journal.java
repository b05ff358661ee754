// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.ledger;

import com.digitalasset.amm.event.ExchangeEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Undo log and event buffer of one logical transaction.
 *
 * Savepoints let a nested call discard only its own effects.
 */
final class Journal {

    record Savepoint(int undoMark, int eventMark) {}

    private final List<Runnable> undoActions = new ArrayList<>();
    private final List<ExchangeEvent> events = new ArrayList<>();

    Savepoint savepoint() {
        return new Savepoint(undoActions.size(), events.size());
    }

    void onRollback(final Runnable undo) {
        undoActions.add(undo);
    }

    void emit(final ExchangeEvent event) {
        events.add(event);
    }

    /**
     * Undo everything recorded after the savepoint, newest first.
     */
    void rollbackTo(final Savepoint savepoint) {
        RuntimeException failure = null;
        for (int i = undoActions.size() - 1; i >= savepoint.undoMark(); i--) {
            try {
                undoActions.remove(i).run();
            } catch (RuntimeException ex) {
                if (failure == null) {
                    failure = ex;
                } else {
                    failure.addSuppressed(ex);
                }
            }
        }
        events.subList(savepoint.eventMark(), events.size()).clear();
        if (failure != null) {
            throw failure;
        }
    }

    List<ExchangeEvent> events() {
        return Collections.unmodifiableList(events);
    }
}
