// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.event;

/**
 * Receives events after the outermost operation that emitted them has committed.
 */
@FunctionalInterface
public interface ExchangeEventListener {

    void onEvent(ExchangeEvent event);
}
