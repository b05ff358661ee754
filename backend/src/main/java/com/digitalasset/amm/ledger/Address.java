// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.ledger;

import java.util.Objects;

/**
 * Identity of an account or contract: a party, a token ledger, an exchange or a registry.
 */
public record Address(String value) {

    public static final Address ZERO = new Address("0x0");

    public Address {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("address must not be blank");
        }
    }

    public static Address of(final String value) {
        return new Address(value.trim());
    }

    public boolean isZero() {
        return ZERO.equals(this);
    }

    @Override
    public String toString() {
        return value;
    }
}
