// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.controller;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.dto.CreateExchangeRequest;
import com.digitalasset.amm.dto.PoolDTO;
import com.digitalasset.amm.dto.QuoteResponse;
import com.digitalasset.amm.dto.SwapDirection;
import com.digitalasset.amm.dto.SwapMode;
import com.digitalasset.amm.ledger.Address;
import com.digitalasset.amm.service.ExchangeService;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.math.BigInteger;
import java.util.List;

/**
 * ExchangeController - Exchange listing, pool views and price quotes
 */
@RestController
@RequestMapping("/api/exchanges")
public class ExchangeController {
    private static final Logger logger = LoggerFactory.getLogger(ExchangeController.class);
    private final ExchangeService exchangeService;

    public ExchangeController(final ExchangeService exchangeService) {
        this.exchangeService = exchangeService;
    }

    @PostMapping
    @WithSpan
    public ResponseEntity<?> create(@Valid @RequestBody CreateExchangeRequest req, HttpServletRequest request) {
        logger.info("POST /api/exchanges - token: {}", req.token);
        Result<PoolDTO, DomainError> result = exchangeService.createExchange(Address.of(req.token));
        if (result.isOk()) {
            return ResponseEntity.status(HttpStatus.CREATED).body(result.getValueUnsafe());
        }
        return DomainErrorStatusMapper.toResponse(result.getErrorUnsafe(), request.getRequestURI());
    }

    @GetMapping
    @WithSpan
    public List<PoolDTO> list() {
        return exchangeService.listPools();
    }

    @GetMapping("/{token}")
    @WithSpan
    public ResponseEntity<?> get(@PathVariable("token") String token, HttpServletRequest request) {
        return toResponse(exchangeService.getPool(Address.of(token)), request);
    }

    /**
     * GET /api/exchanges/{token}/quote - Price a swap at the current reserves
     *
     * amount is the exact side: sold for INPUT, bought for OUTPUT.
     */
    @GetMapping("/{token}/quote")
    @WithSpan
    public ResponseEntity<?> quote(
        @PathVariable("token") String token,
        @RequestParam("direction") SwapDirection direction,
        @RequestParam("mode") SwapMode mode,
        @RequestParam("amount") BigInteger amount,
        @RequestParam(name = "outputToken", required = false) String outputToken,
        HttpServletRequest request
    ) {
        if (amount.signum() <= 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "amount must be positive, got: " + amount);
        }
        Address output = outputToken == null || outputToken.isBlank() ? null : Address.of(outputToken);
        return toResponse(exchangeService.quote(Address.of(token), direction, mode, amount, output), request);
    }

    private ResponseEntity<?> toResponse(Result<?, DomainError> result, HttpServletRequest request) {
        if (result.isOk()) {
            return ResponseEntity.ok(result.getValueUnsafe());
        }
        return DomainErrorStatusMapper.toResponse(result.getErrorUnsafe(), request.getRequestURI());
    }
}
