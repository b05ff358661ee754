// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.validation;

import com.digitalasset.amm.constants.SwapConstants;
import com.digitalasset.amm.dto.ExecuteSwapRequest;
import com.digitalasset.amm.dto.SwapDirection;
import com.digitalasset.amm.dto.SwapMode;
import com.digitalasset.amm.ledger.BlockClock;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigInteger;

/**
 * Request-shape checks for the REST layer. Amount, bound and deadline semantics are
 * enforced by the exchange itself; this only rejects requests that cannot be mapped
 * onto an exchange operation.
 */
@Component
public class SwapRequestValidator {

    private final BlockClock blockClock;

    public SwapRequestValidator(BlockClock blockClock) {
        this.blockClock = blockClock;
    }

    /**
     * Validate the routing fields against the direction.
     *
     * @throws ResponseStatusException if the route is missing or ambiguous
     */
    public void validateRoute(ExecuteSwapRequest request) {
        boolean hasToken = request.outputToken != null;
        boolean hasExchange = request.outputExchange != null;

        if (request.direction == SwapDirection.TOKEN_TO_TOKEN) {
            if (hasToken == hasExchange) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "TOKEN_TO_TOKEN requires exactly one of outputToken or outputExchange");
            }
            requireNotBlank(hasToken ? request.outputToken : request.outputExchange,
                hasToken ? "outputToken" : "outputExchange");
            if (request.mode == SwapMode.OUTPUT && request.ethLimit == null) {
                throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "ethLimit (maximum native amount routed) is required for TOKEN_TO_TOKEN/OUTPUT");
            }
        } else if (hasToken || hasExchange) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "outputToken/outputExchange are only valid for TOKEN_TO_TOKEN, got " + request.direction);
        }

        if (request.recipient != null) {
            requireNotBlank(request.recipient, "recipient");
        }
    }

    /**
     * Native amount bound of a routed trade. INPUT defaults to accepting any non-zero amount.
     */
    public BigInteger resolveEthLimit(ExecuteSwapRequest request) {
        if (request.ethLimit != null) {
            return request.ethLimit;
        }
        return BigInteger.ONE;
    }

    /**
     * Absolute deadline of a request; {@link SwapConstants#DEFAULT_DEADLINE_SECONDS} from
     * now when the request carries none. Past deadlines are passed through and rejected
     * by the exchange.
     */
    public long resolveDeadline(Long requested) {
        if (requested == null) {
            return blockClock.currentBlock() + SwapConstants.DEFAULT_DEADLINE_SECONDS;
        }
        return requested;
    }

    private void requireNotBlank(String value, String field) {
        if (value.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, field + " must not be blank");
        }
    }
}
