// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.registry;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.ExchangeException;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.common.errors.AlreadyConfiguredError;
import com.digitalasset.amm.common.errors.ValidationError;
import com.digitalasset.amm.event.ExchangeEvent;
import com.digitalasset.amm.exchange.Call;
import com.digitalasset.amm.exchange.Exchange;
import com.digitalasset.amm.exchange.ExchangeRuntime;
import com.digitalasset.amm.ledger.Address;
import com.digitalasset.amm.ledger.TokenLedger;
import com.digitalasset.amm.ledger.TransactionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates at most one exchange per token and indexes them by token, by exchange and by id.
 * Ids start at 1 in creation order.
 */
public final class ExchangeRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ExchangeRegistry.class);

    private final ExchangeRuntime runtime;
    private final TransactionManager transactions;
    private final Address address;

    private final Map<Address, Address> tokenToExchange = new ConcurrentHashMap<>();
    private final Map<Address, Address> exchangeToToken = new ConcurrentHashMap<>();
    private final Map<Long, Address> idToToken = new ConcurrentHashMap<>();
    private volatile long tokenCount;

    public ExchangeRegistry(final ExchangeRuntime runtime, final Address address) {
        this.runtime = runtime;
        this.transactions = runtime.transactions();
        this.address = address;
    }

    public Address address() {
        return address;
    }

    /**
     * Deploy and set up a new exchange for {@code tokenId}.
     *
     * @return address of the new exchange
     */
    public Result<Address, DomainError> createExchange(final Address tokenId) {
        return transactions.execute("createExchange", () -> {
            if (tokenId == null || tokenId.isZero()) {
                throw new ExchangeException(new ValidationError("createExchange: token address is required"));
            }
            if (runtime.lookup(tokenId, TokenLedger.class).isEmpty()) {
                throw new ExchangeException(new ValidationError("createExchange: unknown token " + tokenId));
            }
            if (tokenToExchange.containsKey(tokenId)) {
                throw new ExchangeException(new AlreadyConfiguredError(
                        "token " + tokenId + " already listed on " + tokenToExchange.get(tokenId)));
            }

            Exchange exchange = runtime.deployExchange();
            exchange.setup(Call.from(address), tokenId).orElseThrow(ExchangeException::new);

            long id = tokenCount + 1;
            transactions.onRollback(() -> {
                tokenToExchange.remove(tokenId);
                exchangeToToken.remove(exchange.address());
                idToToken.remove(id);
                tokenCount = id - 1;
            });
            tokenToExchange.put(tokenId, exchange.address());
            exchangeToToken.put(exchange.address(), tokenId);
            idToToken.put(id, tokenId);
            tokenCount = id;

            transactions.emit(new ExchangeEvent.NewExchange(address, tokenId, exchange.address()));
            logger.info("Registry {}: created exchange {} for token {} (id {})", address, exchange.address(), tokenId, id);
            return exchange.address();
        });
    }

    public Optional<Address> getExchange(final Address tokenId) {
        return tokenId == null ? Optional.empty() : Optional.ofNullable(tokenToExchange.get(tokenId));
    }

    public Optional<Address> getToken(final Address exchangeAddress) {
        return exchangeAddress == null ? Optional.empty() : Optional.ofNullable(exchangeToToken.get(exchangeAddress));
    }

    public Optional<Address> getTokenWithId(final long id) {
        return Optional.ofNullable(idToToken.get(id));
    }

    public long tokenCount() {
        return tokenCount;
    }

    /**
     * Listed exchanges in id order.
     */
    public List<Exchange> exchanges() {
        List<Exchange> out = new ArrayList<>();
        for (long id = 1; id <= tokenCount; id++) {
            Address token = idToToken.get(id);
            if (token == null) {
                continue;
            }
            runtime.lookup(tokenToExchange.get(token), Exchange.class).ifPresent(out::add);
        }
        return out;
    }
}
