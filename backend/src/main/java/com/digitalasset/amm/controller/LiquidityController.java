// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.controller;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.constants.SwapConstants;
import com.digitalasset.amm.dto.AddLiquidityRequest;
import com.digitalasset.amm.dto.AddLiquidityResponse;
import com.digitalasset.amm.dto.RemoveLiquidityRequest;
import com.digitalasset.amm.dto.RemoveLiquidityResponse;
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
 * LiquidityController - Deposit into and withdraw from a pool
 *
 * The caller (X-Party) must have approved the exchange for the token side of a deposit.
 */
@RestController
@RequestMapping("/api/exchanges/{token}/liquidity")
public class LiquidityController {
    private static final Logger logger = LoggerFactory.getLogger(LiquidityController.class);
    private final ExchangeService exchangeService;
    private final SwapRequestValidator validator;

    public LiquidityController(final ExchangeService exchangeService, final SwapRequestValidator validator) {
        this.exchangeService = exchangeService;
        this.validator = validator;
    }

    @PostMapping("/add")
    @WithSpan
    public ResponseEntity<?> add(
        @PathVariable("token") String token,
        @RequestHeader(SwapConstants.PARTY_HEADER) String party,
        @Valid @RequestBody AddLiquidityRequest req,
        HttpServletRequest request
    ) {
        logger.info("POST /api/exchanges/{}/liquidity/add - provider: {}, eth: {}, maxTokens: {}, minLiquidity: {}",
            token, party, req.ethAmount, req.maxTokens, req.minLiquidity);
        Result<AddLiquidityResponse, DomainError> result = exchangeService.addLiquidity(
            Address.of(party), Address.of(token), req, validator.resolveDeadline(req.deadline));
        if (result.isOk()) {
            return ResponseEntity.ok(result.getValueUnsafe());
        }
        return DomainErrorStatusMapper.toResponse(result.getErrorUnsafe(), request.getRequestURI());
    }

    @PostMapping("/remove")
    @WithSpan
    public ResponseEntity<?> remove(
        @PathVariable("token") String token,
        @RequestHeader(SwapConstants.PARTY_HEADER) String party,
        @Valid @RequestBody RemoveLiquidityRequest req,
        HttpServletRequest request
    ) {
        logger.info("POST /api/exchanges/{}/liquidity/remove - provider: {}, shares: {}, minEth: {}, minTokens: {}",
            token, party, req.shares, req.minEth, req.minTokens);
        Result<RemoveLiquidityResponse, DomainError> result = exchangeService.removeLiquidity(
            Address.of(party), Address.of(token), req, validator.resolveDeadline(req.deadline));
        if (result.isOk()) {
            return ResponseEntity.ok(result.getValueUnsafe());
        }
        return DomainErrorStatusMapper.toResponse(result.getErrorUnsafe(), request.getRequestURI());
    }
}
