// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.util;

import com.digitalasset.amm.common.ExchangeException;
import com.digitalasset.amm.common.errors.ArithmeticOverflowError;

import java.math.BigInteger;

/**
 * Checked unsigned 256-bit arithmetic over {@link BigInteger}.
 *
 * Every result must lie in [0, 2^256); anything else fails the enclosing operation with
 * {@link ArithmeticOverflowError} instead of wrapping.
 */
public final class Uint256 {

    public static final BigInteger MAX = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private Uint256() {
        // Utility class
    }

    /**
     * Validate that a value is a representable unsigned 256-bit integer.
     */
    public static BigInteger of(final BigInteger value) {
        if (value == null) {
            throw new ExchangeException(new ArithmeticOverflowError("amount is required"));
        }
        if (value.signum() < 0 || value.compareTo(MAX) > 0) {
            throw new ExchangeException(new ArithmeticOverflowError("value out of uint256 range: " + value));
        }
        return value;
    }

    public static BigInteger add(final BigInteger a, final BigInteger b) {
        return checked(of(a).add(of(b)), "addition");
    }

    public static BigInteger sub(final BigInteger a, final BigInteger b) {
        return checked(of(a).subtract(of(b)), "subtraction");
    }

    public static BigInteger mul(final BigInteger a, final BigInteger b) {
        return checked(of(a).multiply(of(b)), "multiplication");
    }

    /**
     * Floor division.
     */
    public static BigInteger div(final BigInteger a, final BigInteger b) {
        if (of(b).signum() == 0) {
            throw new ExchangeException(new ArithmeticOverflowError("division by zero"));
        }
        return of(a).divide(b);
    }

    public static boolean isPositive(final BigInteger value) {
        return value != null && value.signum() > 0;
    }

    private static BigInteger checked(final BigInteger result, final String operation) {
        if (result.signum() < 0 || result.compareTo(MAX) > 0) {
            throw new ExchangeException(new ArithmeticOverflowError(operation + " out of uint256 range"));
        }
        return result;
    }
}
