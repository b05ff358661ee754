// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.validation;

import com.digitalasset.amm.dto.ExecuteSwapRequest;
import com.digitalasset.amm.dto.SwapDirection;
import com.digitalasset.amm.dto.SwapMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Swap Request Validator Tests")
class SwapRequestValidatorTest {

    private static final long NOW = 1_700_000_000L;

    private SwapRequestValidator validator;

    @BeforeEach
    void setUp() {
        validator = new SwapRequestValidator(() -> NOW);
    }

    @Test
    @DisplayName("Routed trade needs exactly one target")
    void testRoutedTradeTarget() {
        ExecuteSwapRequest request = request(SwapDirection.TOKEN_TO_TOKEN, SwapMode.INPUT);

        assertBadRequest(request);

        request.outputToken = "token-2";
        assertThatCode(() -> validator.validateRoute(request)).doesNotThrowAnyException();

        request.outputExchange = "exchange-2";
        assertBadRequest(request);
    }

    @Test
    @DisplayName("Routed exact-output trade requires ethLimit")
    void testRoutedOutputRequiresEthLimit() {
        ExecuteSwapRequest request = request(SwapDirection.TOKEN_TO_TOKEN, SwapMode.OUTPUT);
        request.outputExchange = "exchange-2";

        assertBadRequest(request);

        request.ethLimit = BigInteger.TEN;
        assertThatCode(() -> validator.validateRoute(request)).doesNotThrowAnyException();
        assertThat(validator.resolveEthLimit(request)).isEqualTo(BigInteger.TEN);
    }

    @Test
    @DisplayName("Single-pool trades reject routing fields and blank values")
    void testSinglePoolRejectsRouting() {
        ExecuteSwapRequest request = request(SwapDirection.ETH_TO_TOKEN, SwapMode.INPUT);
        request.outputToken = "token-2";
        assertBadRequest(request);

        ExecuteSwapRequest blank = request(SwapDirection.TOKEN_TO_ETH, SwapMode.OUTPUT);
        blank.recipient = "  ";
        assertBadRequest(blank);
    }

    @Test
    @DisplayName("Missing deadline defaults to ten minutes ahead")
    void testResolveDeadline() {
        assertThat(validator.resolveDeadline(null)).isEqualTo(NOW + 600);
        assertThat(validator.resolveDeadline(NOW - 5)).isEqualTo(NOW - 5);
        assertThat(validator.resolveEthLimit(request(SwapDirection.TOKEN_TO_TOKEN, SwapMode.INPUT)))
            .isEqualTo(BigInteger.ONE);
    }

    private static ExecuteSwapRequest request(SwapDirection direction, SwapMode mode) {
        return new ExecuteSwapRequest(direction, mode, BigInteger.TEN, BigInteger.ONE);
    }

    private void assertBadRequest(ExecuteSwapRequest request) {
        assertThatThrownBy(() -> validator.validateRoute(request))
            .isInstanceOfSatisfying(ResponseStatusException.class,
                ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST));
    }
}
