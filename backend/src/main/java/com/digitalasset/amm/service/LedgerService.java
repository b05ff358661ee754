// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.service;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.ExchangeException;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.common.errors.ValidationError;
import com.digitalasset.amm.dto.BalanceResponse;
import com.digitalasset.amm.dto.TokenDTO;
import com.digitalasset.amm.exchange.Exchange;
import com.digitalasset.amm.exchange.ExchangeRuntime;
import com.digitalasset.amm.ledger.Address;
import com.digitalasset.amm.ledger.InMemoryNativeLedger;
import com.digitalasset.amm.ledger.InMemoryTokenLedger;
import com.digitalasset.amm.ledger.TokenLedger;
import com.digitalasset.amm.registry.ExchangeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Token ledgers and native balances behind the exchanges: token deployment, dev funding,
 * approvals and balance views.
 */
@Service
public class LedgerService {

    private static final Logger logger = LoggerFactory.getLogger(LedgerService.class);

    private final ExchangeRuntime runtime;
    private final InMemoryNativeLedger nativeLedger;
    private final ExchangeRegistry registry;
    private final boolean devFundingEnabled;

    public LedgerService(final ExchangeRuntime runtime,
                         final InMemoryNativeLedger nativeLedger,
                         final ExchangeRegistry registry,
                         @Value("${amm.dev-funding.enabled:true}") final boolean devFundingEnabled) {
        this.runtime = runtime;
        this.nativeLedger = nativeLedger;
        this.registry = registry;
        this.devFundingEnabled = devFundingEnabled;
    }

    public boolean isDevFundingEnabled() {
        return devFundingEnabled;
    }

    public TokenDTO createToken(final String name, final String symbol) {
        InMemoryTokenLedger token = runtime.createToken(name.trim(), symbol.trim());
        logger.info("Created token {} ({}) at {}", token.name(), token.symbol(), token.address());
        return toTokenDto(token);
    }

    public List<TokenDTO> listTokens() {
        return runtime.tokens().stream().map(this::toTokenDto).toList();
    }

    /**
     * Credit native currency ({@code token == null}) or tokens to an account.
     */
    public Result<BalanceResponse, DomainError> mint(final Address account, final Address token, final BigInteger amount) {
        Result<Address, DomainError> minted = runtime.transactions().execute("mint", () -> {
            if (token == null) {
                nativeLedger.mint(account, amount);
            } else {
                runtime.lookup(token, InMemoryTokenLedger.class)
                        .orElseThrow(() -> new ExchangeException(new ValidationError("mint: unknown token " + token)))
                        .mint(account, amount);
            }
            return account;
        });
        minted.toOptional().ifPresent(a ->
                logger.info("Funded {} with {} {}", a, amount, token == null ? "native" : token.value()));
        return minted.map(this::balances);
    }

    /**
     * Set the allowance of {@code spender} over the owner's tokens.
     */
    public Result<Boolean, DomainError> approve(final Address owner,
                                               final Address token,
                                               final Address spender,
                                               final BigInteger amount) {
        return runtime.transactions().execute("approve", () -> {
            TokenLedger ledger = runtime.lookup(token, TokenLedger.class)
                    .orElseThrow(() -> new ExchangeException(new ValidationError("approve: unknown token " + token)));
            if (!ledger.approve(owner, spender, amount)) {
                throw new ExchangeException(new ValidationError("approve: allowance of " + amount + " rejected"));
            }
            logger.info("{} approved {} to spend {} {}", owner, spender, amount, ledger.symbol());
            return true;
        });
    }

    public BalanceResponse balances(final Address account) {
        Map<String, String> tokens = new LinkedHashMap<>();
        for (TokenLedger token : runtime.tokens()) {
            BigInteger balance = token.balanceOf(account);
            if (balance.signum() > 0) {
                tokens.put(token.address().value(), balance.toString());
            }
        }
        Map<String, String> shares = new LinkedHashMap<>();
        for (Exchange exchange : registry.exchanges()) {
            BigInteger balance = exchange.balanceOf(account);
            if (balance.signum() > 0) {
                shares.put(exchange.address().value(), balance.toString());
            }
        }
        return new BalanceResponse(account.value(), nativeLedger.balanceOf(account).toString(), tokens, shares);
    }

    private TokenDTO toTokenDto(final TokenLedger token) {
        String name = token instanceof InMemoryTokenLedger inMemory ? inMemory.name() : token.symbol();
        String supply = token instanceof InMemoryTokenLedger inMemory ? inMemory.totalSupply().toString() : null;
        return new TokenDTO(token.address().value(), name, token.symbol(), supply);
    }
}
