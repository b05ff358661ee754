// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.ledger;

import java.time.Clock;
import java.util.Objects;

/**
 * Block clock that follows wall-clock time in epoch seconds, like a block timestamp.
 */
public final class SystemBlockClock implements BlockClock {

    private final Clock clock;
    private final long offsetSeconds;

    public SystemBlockClock(final Clock clock) {
        this(clock, 0L);
    }

    public SystemBlockClock(final Clock clock, final long offsetSeconds) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.offsetSeconds = offsetSeconds;
    }

    @Override
    public long currentBlock() {
        return clock.instant().getEpochSecond() + offsetSeconds;
    }
}
