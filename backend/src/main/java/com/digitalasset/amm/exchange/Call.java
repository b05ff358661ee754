// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.exchange;

import com.digitalasset.amm.ledger.Address;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Who is calling an exchange operation and how much native currency is attached to the call.
 */
public record Call(Address caller, BigInteger value) {

    public Call {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw new IllegalArgumentException("attached value must not be negative");
        }
    }

    public static Call from(final Address caller) {
        return new Call(caller, BigInteger.ZERO);
    }

    public Call withValue(final BigInteger amount) {
        return new Call(caller, amount);
    }

    public boolean hasValue() {
        return value.signum() > 0;
    }
}
