// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.util;

import com.digitalasset.amm.common.ExchangeException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Uint256Test {

    @Test
    void testMaxIsRepresentable() {
        assertThat(Uint256.of(Uint256.MAX)).isEqualTo(BigInteger.TWO.pow(256).subtract(BigInteger.ONE));
    }

    @Test
    void testNegativeAndOversizedRejected() {
        assertThatThrownBy(() -> Uint256.of(BigInteger.valueOf(-1)))
            .isInstanceOf(ExchangeException.class)
            .hasMessageContaining("ARITHMETIC_OVERFLOW");
        assertThatThrownBy(() -> Uint256.of(Uint256.MAX.add(BigInteger.ONE)))
            .isInstanceOf(ExchangeException.class);
        assertThatThrownBy(() -> Uint256.of(null))
            .isInstanceOf(ExchangeException.class);
    }

    @Test
    void testAddOverflow() {
        assertThatThrownBy(() -> Uint256.add(Uint256.MAX, BigInteger.ONE))
            .isInstanceOf(ExchangeException.class);
    }

    @Test
    void testSubUnderflow() {
        assertThatThrownBy(() -> Uint256.sub(BigInteger.ONE, BigInteger.TWO))
            .isInstanceOf(ExchangeException.class);
        assertThat(Uint256.sub(BigInteger.TWO, BigInteger.ONE)).isEqualTo(BigInteger.ONE);
    }

    @Test
    void testMulOverflow() {
        assertThatThrownBy(() -> Uint256.mul(Uint256.MAX, BigInteger.TWO))
            .isInstanceOf(ExchangeException.class);
    }

    @Test
    void testDivFloorsAndRejectsZero() {
        assertThat(Uint256.div(BigInteger.valueOf(7), BigInteger.TWO)).isEqualTo(BigInteger.valueOf(3));
        assertThatThrownBy(() -> Uint256.div(BigInteger.ONE, BigInteger.ZERO))
            .isInstanceOf(ExchangeException.class);
    }
}
