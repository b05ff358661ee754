// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.controller;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.constants.SwapConstants;
import com.digitalasset.amm.dto.ApproveRequest;
import com.digitalasset.amm.dto.BalanceResponse;
import com.digitalasset.amm.dto.CreateTokenRequest;
import com.digitalasset.amm.dto.MintRequest;
import com.digitalasset.amm.dto.TokenDTO;
import com.digitalasset.amm.ledger.Address;
import com.digitalasset.amm.service.LedgerService;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * LedgerController - Token ledgers, dev funding, approvals and balances
 */
@RestController
@RequestMapping("/api/ledger")
public class LedgerController {
    private static final Logger logger = LoggerFactory.getLogger(LedgerController.class);
    private final LedgerService ledgerService;

    public LedgerController(final LedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    @PostMapping("/tokens")
    @WithSpan
    public ResponseEntity<TokenDTO> createToken(@Valid @RequestBody CreateTokenRequest req) {
        logger.info("POST /api/ledger/tokens - name: {}, symbol: {}", req.name, req.symbol);
        return ResponseEntity.status(HttpStatus.CREATED).body(ledgerService.createToken(req.name, req.symbol));
    }

    @GetMapping("/tokens")
    @WithSpan
    public List<TokenDTO> listTokens() {
        return ledgerService.listTokens();
    }

    /**
     * POST /api/ledger/mint - Credit native currency or tokens (disabled unless amm.dev-funding.enabled)
     */
    @PostMapping("/mint")
    @WithSpan
    public ResponseEntity<?> mint(@Valid @RequestBody MintRequest req, HttpServletRequest request) {
        if (!ledgerService.isDevFundingEnabled()) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Dev funding is disabled");
        }
        logger.info("POST /api/ledger/mint - account: {}, token: {}, amount: {}",
            req.account, req.token == null ? "native" : req.token, req.amount);
        Address token = req.token == null || req.token.isBlank() ? null : Address.of(req.token);
        Result<BalanceResponse, DomainError> result = ledgerService.mint(Address.of(req.account), token, req.amount);
        if (result.isOk()) {
            return ResponseEntity.ok(result.getValueUnsafe());
        }
        return DomainErrorStatusMapper.toResponse(result.getErrorUnsafe(), request.getRequestURI());
    }

    @PostMapping("/approve")
    @WithSpan
    public ResponseEntity<?> approve(
        @RequestHeader(SwapConstants.PARTY_HEADER) String party,
        @Valid @RequestBody ApproveRequest req,
        HttpServletRequest request
    ) {
        logger.info("POST /api/ledger/approve - owner: {}, token: {}, spender: {}, amount: {}",
            party, req.token, req.spender, req.amount);
        Result<Boolean, DomainError> result = ledgerService.approve(
            Address.of(party), Address.of(req.token), Address.of(req.spender), req.amount);
        if (result.isOk()) {
            return ResponseEntity.ok(Map.of("approved", result.getValueUnsafe(), "amount", req.amount.toString()));
        }
        return DomainErrorStatusMapper.toResponse(result.getErrorUnsafe(), request.getRequestURI());
    }

    @GetMapping("/balances/{account}")
    @WithSpan
    public BalanceResponse balances(@PathVariable("account") String account) {
        return ledgerService.balances(Address.of(account));
    }
}
