// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.service;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.common.errors.InvalidExchangeError;
import com.digitalasset.amm.constants.SwapConstants;
import com.digitalasset.amm.dto.AddLiquidityRequest;
import com.digitalasset.amm.dto.AddLiquidityResponse;
import com.digitalasset.amm.dto.ExecuteSwapRequest;
import com.digitalasset.amm.dto.ExecuteSwapResponse;
import com.digitalasset.amm.dto.PoolDTO;
import com.digitalasset.amm.dto.QuoteResponse;
import com.digitalasset.amm.dto.RemoveLiquidityRequest;
import com.digitalasset.amm.dto.RemoveLiquidityResponse;
import com.digitalasset.amm.dto.SwapDirection;
import com.digitalasset.amm.dto.SwapMode;
import com.digitalasset.amm.exchange.Call;
import com.digitalasset.amm.exchange.Exchange;
import com.digitalasset.amm.exchange.ExchangeRuntime;
import com.digitalasset.amm.ledger.Address;
import com.digitalasset.amm.ledger.TokenLedger;
import com.digitalasset.amm.metrics.SwapMetrics;
import com.digitalasset.amm.registry.ExchangeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * Maps REST requests onto exchange and registry operations.
 *
 * Every method returns the domain result unchanged; rejected operations are counted in
 * {@link SwapMetrics} and committed ones refresh the pool gauges.
 */
@Service
public class ExchangeService {

    private static final Logger logger = LoggerFactory.getLogger(ExchangeService.class);
    private static final int SPOT_PRICE_SCALE = 18;

    private final ExchangeRuntime runtime;
    private final ExchangeRegistry registry;
    private final SwapMetrics swapMetrics;

    public ExchangeService(final ExchangeRuntime runtime,
                           final ExchangeRegistry registry,
                           final SwapMetrics swapMetrics) {
        this.runtime = runtime;
        this.registry = registry;
        this.swapMetrics = swapMetrics;
    }

    public Result<PoolDTO, DomainError> createExchange(final Address token) {
        Result<PoolDTO, DomainError> result = registry.createExchange(token)
                .flatMap(this::exchangeAt)
                .map(this::toPoolDto);
        return observe("createExchange", result);
    }

    public List<PoolDTO> listPools() {
        return registry.exchanges().stream().map(this::toPoolDto).toList();
    }

    public Result<PoolDTO, DomainError> getPool(final Address token) {
        return exchangeFor(token).map(this::toPoolDto);
    }

    /**
     * Price a swap at the current reserves without executing it.
     *
     * @param outputToken token bought by a TOKEN_TO_TOKEN quote, ignored otherwise
     */
    public Result<QuoteResponse, DomainError> quote(final Address token,
                                                   final SwapDirection direction,
                                                   final SwapMode mode,
                                                   final BigInteger amount,
                                                   final Address outputToken) {
        return exchangeFor(token).flatMap(exchange -> switch (direction) {
            case ETH_TO_TOKEN -> (mode == SwapMode.INPUT
                    ? exchange.getEthToTokenInputPrice(amount)
                    : exchange.getEthToTokenOutputPrice(amount))
                    .map(price -> toQuote(exchange, direction, mode, amount, price, null));
            case TOKEN_TO_ETH -> (mode == SwapMode.INPUT
                    ? exchange.getTokenToEthInputPrice(amount)
                    : exchange.getTokenToEthOutputPrice(amount))
                    .map(price -> toQuote(exchange, direction, mode, amount, price, null));
            case TOKEN_TO_TOKEN -> routedQuote(exchange, mode, amount, outputToken);
        });
    }

    public Result<AddLiquidityResponse, DomainError> addLiquidity(final Address caller,
                                                                 final Address token,
                                                                 final AddLiquidityRequest request,
                                                                 final long deadline) {
        Result<AddLiquidityResponse, DomainError> result = exchangeFor(token).flatMap(exchange -> exchange
                .addLiquidity(Call.from(caller).withValue(request.ethAmount),
                        request.minLiquidity, request.maxTokens, deadline)
                .map(minted -> new AddLiquidityResponse(minted.toString(),
                        exchange.balanceOf(caller).toString(), toPoolDto(exchange))));
        return observe("addLiquidity", result);
    }

    public Result<RemoveLiquidityResponse, DomainError> removeLiquidity(final Address caller,
                                                                       final Address token,
                                                                       final RemoveLiquidityRequest request,
                                                                       final long deadline) {
        Result<RemoveLiquidityResponse, DomainError> result = exchangeFor(token).flatMap(exchange -> exchange
                .removeLiquidity(Call.from(caller), request.shares, request.minEth, request.minTokens, deadline)
                .map(withdrawal -> new RemoveLiquidityResponse(request.shares.toString(),
                        withdrawal.ethAmount().toString(), withdrawal.tokenAmount().toString(),
                        toPoolDto(exchange))));
        return observe("removeLiquidity", result);
    }

    /**
     * Execute a swap on the exchange of {@code token}; without a recipient the caller receives
     * the bought asset.
     */
    public Result<ExecuteSwapResponse, DomainError> swap(final Address caller,
                                                        final Address token,
                                                        final ExecuteSwapRequest request,
                                                        final long deadline,
                                                        final BigInteger ethLimit) {
        Address recipient = request.recipient == null ? null : Address.of(request.recipient);
        Result<ExecuteSwapResponse, DomainError> result = exchangeFor(token).flatMap(exchange -> {
            Result<BigInteger, DomainError> settled = switch (request.direction) {
                case ETH_TO_TOKEN -> ethToToken(exchange, caller, request, deadline, recipient);
                case TOKEN_TO_ETH -> tokenToEth(exchange, caller, request, deadline, recipient);
                case TOKEN_TO_TOKEN -> tokenToToken(exchange, caller, request, deadline, ethLimit, recipient);
            };
            return settled.map(value -> {
                boolean exactInput = request.mode == SwapMode.INPUT;
                BigInteger amountIn = exactInput ? request.amount : value;
                BigInteger amountOut = exactInput ? value : request.amount;
                logger.info("Swap {} {} on {} by {}: in={} out={}",
                        request.direction, request.mode, exchange.address(), caller, amountIn, amountOut);
                return new ExecuteSwapResponse(exchange.address().value(), request.direction, request.mode,
                        amountIn.toString(), amountOut.toString(),
                        (recipient == null ? caller : recipient).value(), toPoolDto(exchange));
            });
        });
        return observe("swap", result);
    }

    private Result<BigInteger, DomainError> ethToToken(final Exchange exchange,
                                                       final Address caller,
                                                       final ExecuteSwapRequest request,
                                                       final long deadline,
                                                       final Address recipient) {
        if (request.mode == SwapMode.INPUT) {
            Call call = Call.from(caller).withValue(request.amount);
            return recipient == null
                    ? exchange.ethToTokenSwapInput(call, request.limit, deadline)
                    : exchange.ethToTokenTransferInput(call, request.limit, deadline, recipient);
        }
        Call call = Call.from(caller).withValue(request.limit);
        return recipient == null
                ? exchange.ethToTokenSwapOutput(call, request.amount, deadline)
                : exchange.ethToTokenTransferOutput(call, request.amount, deadline, recipient);
    }

    private Result<BigInteger, DomainError> tokenToEth(final Exchange exchange,
                                                       final Address caller,
                                                       final ExecuteSwapRequest request,
                                                       final long deadline,
                                                       final Address recipient) {
        Call call = Call.from(caller);
        if (request.mode == SwapMode.INPUT) {
            return recipient == null
                    ? exchange.tokenToEthSwapInput(call, request.amount, request.limit, deadline)
                    : exchange.tokenToEthTransferInput(call, request.amount, request.limit, deadline, recipient);
        }
        return recipient == null
                ? exchange.tokenToEthSwapOutput(call, request.amount, request.limit, deadline)
                : exchange.tokenToEthTransferOutput(call, request.amount, request.limit, deadline, recipient);
    }

    private Result<BigInteger, DomainError> tokenToToken(final Exchange exchange,
                                                         final Address caller,
                                                         final ExecuteSwapRequest request,
                                                         final long deadline,
                                                         final BigInteger ethLimit,
                                                         final Address recipient) {
        Call call = Call.from(caller);
        boolean viaRegistry = request.outputToken != null;
        Address target = Address.of(viaRegistry ? request.outputToken : request.outputExchange);
        Address receiver = recipient == null ? caller : recipient;

        if (request.mode == SwapMode.INPUT) {
            if (viaRegistry) {
                return recipient == null
                        ? exchange.tokenToTokenSwapInput(call, request.amount, request.limit, ethLimit, deadline, target)
                        : exchange.tokenToTokenTransferInput(call, request.amount, request.limit, ethLimit, deadline,
                                receiver, target);
            }
            return recipient == null
                    ? exchange.tokenToExchangeSwapInput(call, request.amount, request.limit, ethLimit, deadline, target)
                    : exchange.tokenToExchangeTransferInput(call, request.amount, request.limit, ethLimit, deadline,
                            receiver, target);
        }
        if (viaRegistry) {
            return recipient == null
                    ? exchange.tokenToTokenSwapOutput(call, request.amount, request.limit, ethLimit, deadline, target)
                    : exchange.tokenToTokenTransferOutput(call, request.amount, request.limit, ethLimit, deadline,
                            receiver, target);
        }
        return recipient == null
                ? exchange.tokenToExchangeSwapOutput(call, request.amount, request.limit, ethLimit, deadline, target)
                : exchange.tokenToExchangeTransferOutput(call, request.amount, request.limit, ethLimit, deadline,
                        receiver, target);
    }

    private Result<QuoteResponse, DomainError> routedQuote(final Exchange source,
                                                          final SwapMode mode,
                                                          final BigInteger amount,
                                                          final Address outputToken) {
        if (outputToken == null) {
            return Result.err(new InvalidExchangeError("TOKEN_TO_TOKEN quote requires an output token"));
        }
        return exchangeFor(outputToken).flatMap(destination -> {
            if (destination == source) {
                return Result.err(new InvalidExchangeError("cannot route a trade back into " + source.address()));
            }
            if (mode == SwapMode.INPUT) {
                return source.getTokenToEthInputPrice(amount).flatMap(eth -> destination
                        .getEthToTokenInputPrice(eth)
                        .map(bought -> toQuote(source, SwapDirection.TOKEN_TO_TOKEN, mode, amount, bought, eth)));
            }
            return destination.getEthToTokenOutputPrice(amount).flatMap(eth -> source
                    .getTokenToEthOutputPrice(eth)
                    .map(sold -> toQuote(source, SwapDirection.TOKEN_TO_TOKEN, mode, amount, sold, eth)));
        });
    }

    private QuoteResponse toQuote(final Exchange exchange,
                                  final SwapDirection direction,
                                  final SwapMode mode,
                                  final BigInteger amount,
                                  final BigInteger price,
                                  final BigInteger ethRouted) {
        BigInteger amountIn = mode == SwapMode.INPUT ? amount : price;
        BigInteger amountOut = mode == SwapMode.INPUT ? price : amount;
        return new QuoteResponse(exchange.address().value(), direction, mode,
                amountIn.toString(), amountOut.toString(), ethRouted == null ? null : ethRouted.toString());
    }

    private Result<Exchange, DomainError> exchangeFor(final Address token) {
        Optional<Exchange> exchange = registry.getExchange(token)
                .flatMap(address -> runtime.lookup(address, Exchange.class));
        if (exchange.isEmpty()) {
            return Result.err(new InvalidExchangeError("no exchange listed for token " + token));
        }
        return Result.ok(exchange.get());
    }

    private Result<Exchange, DomainError> exchangeAt(final Address address) {
        Optional<Exchange> exchange = runtime.lookup(address, Exchange.class);
        if (exchange.isEmpty()) {
            return Result.err(new InvalidExchangeError("no exchange deployed at " + address));
        }
        return Result.ok(exchange.get());
    }

    private PoolDTO toPoolDto(final Exchange exchange) {
        BigInteger ethReserve = exchange.ethReserve();
        BigInteger tokenReserve = exchange.tokenReserve();
        String tokenSymbol = runtime.lookup(exchange.tokenAddress(), TokenLedger.class)
                .map(TokenLedger::symbol)
                .orElse("");
        String spotPrice = ethReserve.signum() == 0
                ? "0"
                : new BigDecimal(tokenReserve)
                        .divide(new BigDecimal(ethReserve), SPOT_PRICE_SCALE, RoundingMode.DOWN)
                        .stripTrailingZeros()
                        .toPlainString();
        return new PoolDTO(exchange.address().value(), exchange.tokenAddress().value(), tokenSymbol,
                ethReserve.toString(), tokenReserve.toString(), exchange.totalSupply().toString(),
                exchange.symbol(), SwapConstants.FEE_BPS, spotPrice);
    }

    private <T> Result<T, DomainError> observe(final String operation, final Result<T, DomainError> result) {
        if (result.isErr()) {
            swapMetrics.recordFailure(operation, result.getErrorUnsafe());
            return result;
        }
        for (Exchange exchange : registry.exchanges()) {
            swapMetrics.recordPoolLiquidity(exchange.address().value(), exchange.ethReserve(), exchange.tokenReserve());
        }
        return result;
    }
}
