// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.controller;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.constants.SwapConstants;
import com.digitalasset.amm.dto.ExecuteSwapRequest;
import com.digitalasset.amm.dto.ExecuteSwapResponse;
import com.digitalasset.amm.ledger.Address;
import com.digitalasset.amm.service.ExchangeService;
import com.digitalasset.amm.validation.SwapRequestValidator;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * SwapController - Executes swaps against the exchange of the token in the path
 *
 * Flow:
 * 1. Validate the request shape and route
 * 2. Resolve the deadline (default ten minutes from now)
 * 3. Run the matching exchange operation as the X-Party caller
 * 4. Return settled amounts, or the domain error with its status
 */
@RestController
@RequestMapping("/api/exchanges/{token}/swap")
public class SwapController {
    private static final Logger logger = LoggerFactory.getLogger(SwapController.class);
    private final ExchangeService exchangeService;
    private final SwapRequestValidator validator;

    public SwapController(final ExchangeService exchangeService, final SwapRequestValidator validator) {
        this.exchangeService = exchangeService;
        this.validator = validator;
    }

    @PostMapping
    @WithSpan
    public ResponseEntity<?> swap(
        @PathVariable("token") String token,
        @RequestHeader(SwapConstants.PARTY_HEADER) String party,
        @Valid @RequestBody ExecuteSwapRequest req,
        HttpServletRequest request
    ) {
        validator.validateRoute(req);
        long deadline = validator.resolveDeadline(req.deadline);

        logger.info("POST /api/exchanges/{}/swap - trader: {}, {} {}, amount: {}, limit: {}, recipient: {}",
            token, party, req.direction, req.mode, req.amount, req.limit, req.recipient);

        Result<ExecuteSwapResponse, DomainError> result = exchangeService.swap(
            Address.of(party), Address.of(token), req, deadline, validator.resolveEthLimit(req));
        if (result.isOk()) {
            return ResponseEntity.ok(result.getValueUnsafe());
        }
        return DomainErrorStatusMapper.toResponse(result.getErrorUnsafe(), request.getRequestURI());
    }
}
