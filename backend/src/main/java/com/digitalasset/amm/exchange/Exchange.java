// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.exchange;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.ExchangeException;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.common.errors.AlreadyConfiguredError;
import com.digitalasset.amm.common.errors.AssetTransferFailedError;
import com.digitalasset.amm.common.errors.InsufficientBalanceError;
import com.digitalasset.amm.common.errors.InsufficientLiquidityError;
import com.digitalasset.amm.common.errors.InvalidExchangeError;
import com.digitalasset.amm.common.errors.InvalidRecipientError;
import com.digitalasset.amm.common.errors.InvalidReserveError;
import com.digitalasset.amm.common.errors.NotConfiguredError;
import com.digitalasset.amm.common.errors.SlippageExceededError;
import com.digitalasset.amm.common.errors.ValidationError;
import com.digitalasset.amm.constants.SwapConstants;
import com.digitalasset.amm.event.ExchangeEvent;
import com.digitalasset.amm.ledger.Address;
import com.digitalasset.amm.ledger.TokenLedger;
import com.digitalasset.amm.ledger.TransactionManager;
import com.digitalasset.amm.registry.ExchangeRegistry;
import com.digitalasset.amm.util.AmmMath;
import com.digitalasset.amm.util.Uint256;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.function.Supplier;

/**
 * Constant-product exchange between the native currency (ETH) and one token.
 *
 * Reserves are explicit counters committed together with the transfers that move them.
 * Every public operation runs as one transaction of the owning {@link ExchangeRuntime}:
 * it either completes, or fails with a {@link DomainError} and leaves no trace. Routed
 * token-to-token trades call a second exchange inside the same transaction.
 *
 * Deadlines: swaps accept {@code deadline >= now}; liquidity operations need {@code deadline > now}.
 */
public class Exchange {

    private static final Logger logger = LoggerFactory.getLogger(Exchange.class);

    private final ExchangeRuntime runtime;
    private final TransactionManager transactions;
    private final Address address;
    private final LiquidityLedger shares;

    private volatile Address tokenAddress;
    private volatile Address factoryAddress;
    private volatile TokenLedger token;
    private volatile BigInteger reserveEth = BigInteger.ZERO;
    private volatile BigInteger reserveToken = BigInteger.ZERO;

    Exchange(final ExchangeRuntime runtime, final Address address) {
        this.runtime = runtime;
        this.transactions = runtime.transactions();
        this.address = address;
        this.shares = new LiquidityLedger(address, transactions);
    }

    // ========================================
    // SETUP & STATE
    // ========================================

    /**
     * Pair this exchange with a token. Callable once; the caller becomes the factory.
     *
     * @return the paired token address
     */
    public Result<Address, DomainError> setup(final Call call, final Address tokenId) {
        return transactions.execute("setup", () -> {
            if (tokenAddress != null || factoryAddress != null) {
                throw new ExchangeException(new AlreadyConfiguredError(
                        "exchange " + address + " already paired with " + tokenAddress));
            }
            requireExternalCaller(call, "setup");
            requireNoValue(call, "setup");
            if (tokenId == null || tokenId.isZero()) {
                throw new ExchangeException(new ValidationError("setup: token address is required"));
            }
            TokenLedger ledger = runtime.lookup(tokenId, TokenLedger.class)
                    .orElseThrow(() -> new ExchangeException(new ValidationError("setup: unknown token " + tokenId)));
            transactions.onRollback(() -> {
                token = null;
                tokenAddress = null;
                factoryAddress = null;
            });
            token = ledger;
            tokenAddress = tokenId;
            factoryAddress = call.caller();
            logger.info("Exchange {} set up for token {} by {}", address, tokenId, call.caller());
            return tokenId;
        });
    }

    public boolean isConfigured() {
        return tokenAddress != null;
    }

    public Address address() {
        return address;
    }

    /**
     * Paired token, or {@code null} before setup.
     */
    public Address tokenAddress() {
        return tokenAddress;
    }

    /**
     * Registry that set this exchange up, or {@code null} before setup.
     */
    public Address factoryAddress() {
        return factoryAddress;
    }

    public BigInteger ethReserve() {
        return reserveEth;
    }

    public BigInteger tokenReserve() {
        return reserveToken;
    }

    // ========================================
    // LIQUIDITY
    // ========================================

    /**
     * Deposit the attached ETH and a matching amount of tokens.
     *
     * @param minLiquidity Minimum shares to mint (ignored for the first deposit)
     * @param maxTokens    Maximum tokens to pull; the exact token amount of the first deposit
     * @return shares minted
     */
    public Result<BigInteger, DomainError> addLiquidity(final Call call,
                                                       final BigInteger minLiquidity,
                                                       final BigInteger maxTokens,
                                                       final long deadline) {
        return execute("addLiquidity", call, () -> {
            BigInteger ethAmount = call.value();
            requireParameters(Uint256.isPositive(maxTokens) && ethAmount.signum() > 0, "addLiquidity");
            requireLiquidityDeadline(deadline, "addLiquidity");
            Uint256.of(minLiquidity);

            BigInteger totalLiquidity = shares.totalSupply();
            BigInteger tokenAmount;
            BigInteger minted;
            if (totalLiquidity.signum() > 0) {
                requireParameters(minLiquidity.signum() > 0, "addLiquidity minLiquidity must be greater than 0");
                if (reserveEth.signum() == 0) {
                    throw new ExchangeException(new InvalidReserveError("pool has shares but no native reserve"));
                }
                tokenAmount = Uint256.add(
                        Uint256.div(Uint256.mul(ethAmount, reserveToken), reserveEth), BigInteger.ONE);
                minted = Uint256.div(Uint256.mul(ethAmount, totalLiquidity), reserveEth);
                if (tokenAmount.compareTo(maxTokens) > 0) {
                    throw new ExchangeException(new SlippageExceededError(
                            "addLiquidity token amount above maxTokens", maxTokens, tokenAmount));
                }
                if (minted.compareTo(minLiquidity) < 0) {
                    throw new ExchangeException(new SlippageExceededError(
                            "addLiquidity shares minted below minLiquidity", minLiquidity, minted));
                }
            } else {
                requireParameters(ethAmount.compareTo(SwapConstants.MIN_INITIAL_LIQUIDITY) >= 0,
                        "addLiquidity initial deposit below " + SwapConstants.MIN_INITIAL_LIQUIDITY);
                tokenAmount = maxTokens;
                minted = ethAmount;
            }

            receiveEth(call.caller(), ethAmount);
            pullTokens(call.caller(), tokenAmount);
            setReserves(Uint256.add(reserveEth, ethAmount), Uint256.add(reserveToken, tokenAmount));
            transactions.emit(new ExchangeEvent.AddLiquidity(address, call.caller(), ethAmount, tokenAmount));
            shares.mint(call.caller(), minted);
            logger.info("Exchange {}: {} added {} ETH / {} tokens, minted {} shares",
                    address, call.caller(), ethAmount, tokenAmount, minted);
            return minted;
        });
    }

    /**
     * Burn shares and withdraw the proportional ETH and tokens.
     */
    public Result<LiquidityWithdrawal, DomainError> removeLiquidity(final Call call,
                                                                   final BigInteger amount,
                                                                   final BigInteger minEth,
                                                                   final BigInteger minTokens,
                                                                   final long deadline) {
        return execute("removeLiquidity", call, () -> {
            requireNoValue(call, "removeLiquidity");
            requireParameters(Uint256.isPositive(amount) && Uint256.isPositive(minEth)
                    && Uint256.isPositive(minTokens), "removeLiquidity");
            requireLiquidityDeadline(deadline, "removeLiquidity");

            BigInteger totalLiquidity = shares.totalSupply();
            if (totalLiquidity.signum() == 0) {
                throw new ExchangeException(new InsufficientLiquidityError(
                        "removeLiquidity total liquidity must be greater than 0"));
            }
            requireParameters(amount.compareTo(totalLiquidity) <= 0,
                    "removeLiquidity amount exceeds total liquidity " + totalLiquidity);

            BigInteger ethAmount = Uint256.div(Uint256.mul(amount, reserveEth), totalLiquidity);
            BigInteger tokenAmount = Uint256.div(Uint256.mul(amount, reserveToken), totalLiquidity);
            if (ethAmount.compareTo(minEth) < 0) {
                throw new ExchangeException(new SlippageExceededError(
                        "removeLiquidity ETH amount below minEth", minEth, ethAmount));
            }
            if (tokenAmount.compareTo(minTokens) < 0) {
                throw new ExchangeException(new SlippageExceededError(
                        "removeLiquidity token amount below minTokens", minTokens, tokenAmount));
            }

            if (shares.balanceOf(call.caller()).compareTo(amount) < 0) {
                throw new ExchangeException(new InsufficientBalanceError(
                        "removeLiquidity " + call.caller() + " holds fewer than " + amount + " shares"));
            }
            setReserves(Uint256.sub(reserveEth, ethAmount), Uint256.sub(reserveToken, tokenAmount));
            sendEth(call.caller(), ethAmount);
            sendTokens(call.caller(), tokenAmount);
            transactions.emit(new ExchangeEvent.RemoveLiquidity(address, call.caller(), ethAmount, tokenAmount));
            shares.burn(call.caller(), amount);
            logger.info("Exchange {}: {} removed {} shares for {} ETH / {} tokens",
                    address, call.caller(), amount, ethAmount, tokenAmount);
            return new LiquidityWithdrawal(ethAmount, tokenAmount);
        });
    }

    // ========================================
    // ETH -> TOKEN
    // ========================================

    /**
     * Default swap for a call that selects no operation: sell all attached ETH, accept any
     * non-zero output, valid for the current block only.
     */
    public Result<BigInteger, DomainError> receive(final Call call) {
        return execute("receive", call, () -> ethToTokenInput(call, SwapConstants.FALLBACK_MIN_TOKENS,
                runtime.blockClock().currentBlock(), call.caller()));
    }

    /**
     * Sell the attached ETH for at least {@code minTokens}.
     *
     * @return tokens bought
     */
    public Result<BigInteger, DomainError> ethToTokenSwapInput(final Call call,
                                                              final BigInteger minTokens,
                                                              final long deadline) {
        return execute("ethToTokenSwapInput", call,
                () -> ethToTokenInput(call, minTokens, deadline, call.caller()));
    }

    public Result<BigInteger, DomainError> ethToTokenTransferInput(final Call call,
                                                                  final BigInteger minTokens,
                                                                  final long deadline,
                                                                  final Address recipient) {
        return execute("ethToTokenTransferInput", call, () -> {
            requireRecipient(recipient, "ethToTokenTransferInput");
            return ethToTokenInput(call, minTokens, deadline, recipient);
        });
    }

    /**
     * Buy exactly {@code tokensBought}, paying at most the attached ETH; the rest is refunded.
     *
     * @return ETH sold
     */
    public Result<BigInteger, DomainError> ethToTokenSwapOutput(final Call call,
                                                               final BigInteger tokensBought,
                                                               final long deadline) {
        return execute("ethToTokenSwapOutput", call,
                () -> ethToTokenOutput(call, tokensBought, deadline, call.caller()));
    }

    public Result<BigInteger, DomainError> ethToTokenTransferOutput(final Call call,
                                                                   final BigInteger tokensBought,
                                                                   final long deadline,
                                                                   final Address recipient) {
        return execute("ethToTokenTransferOutput", call, () -> {
            requireRecipient(recipient, "ethToTokenTransferOutput");
            return ethToTokenOutput(call, tokensBought, deadline, recipient);
        });
    }

    // ========================================
    // TOKEN -> ETH
    // ========================================

    /**
     * Sell exactly {@code tokensSold} for at least {@code minEth}.
     *
     * @return ETH bought
     */
    public Result<BigInteger, DomainError> tokenToEthSwapInput(final Call call,
                                                              final BigInteger tokensSold,
                                                              final BigInteger minEth,
                                                              final long deadline) {
        return execute("tokenToEthSwapInput", call,
                () -> tokenToEthInput(call, tokensSold, minEth, deadline, call.caller()));
    }

    public Result<BigInteger, DomainError> tokenToEthTransferInput(final Call call,
                                                                  final BigInteger tokensSold,
                                                                  final BigInteger minEth,
                                                                  final long deadline,
                                                                  final Address recipient) {
        return execute("tokenToEthTransferInput", call, () -> {
            requireRecipient(recipient, "tokenToEthTransferInput");
            return tokenToEthInput(call, tokensSold, minEth, deadline, recipient);
        });
    }

    /**
     * Buy exactly {@code ethBought}, selling at most {@code maxTokens}.
     *
     * @return tokens sold
     */
    public Result<BigInteger, DomainError> tokenToEthSwapOutput(final Call call,
                                                               final BigInteger ethBought,
                                                               final BigInteger maxTokens,
                                                               final long deadline) {
        return execute("tokenToEthSwapOutput", call,
                () -> tokenToEthOutput(call, ethBought, maxTokens, deadline, call.caller()));
    }

    public Result<BigInteger, DomainError> tokenToEthTransferOutput(final Call call,
                                                                   final BigInteger ethBought,
                                                                   final BigInteger maxTokens,
                                                                   final long deadline,
                                                                   final Address recipient) {
        return execute("tokenToEthTransferOutput", call, () -> {
            requireRecipient(recipient, "tokenToEthTransferOutput");
            return tokenToEthOutput(call, ethBought, maxTokens, deadline, recipient);
        });
    }

    // ========================================
    // TOKEN -> TOKEN (via registry)
    // ========================================

    /**
     * Sell exactly {@code tokensSold} of this exchange's token for at least
     * {@code minTokensBought} of {@code outputToken}, routed through ETH.
     *
     * @return tokens of {@code outputToken} bought
     */
    public Result<BigInteger, DomainError> tokenToTokenSwapInput(final Call call,
                                                                final BigInteger tokensSold,
                                                                final BigInteger minTokensBought,
                                                                final BigInteger minEthBought,
                                                                final long deadline,
                                                                final Address outputToken) {
        return execute("tokenToTokenSwapInput", call, () -> tokenToTokenInput(call, tokensSold, minTokensBought,
                minEthBought, deadline, call.caller(), exchangeForToken(outputToken)));
    }

    public Result<BigInteger, DomainError> tokenToTokenTransferInput(final Call call,
                                                                    final BigInteger tokensSold,
                                                                    final BigInteger minTokensBought,
                                                                    final BigInteger minEthBought,
                                                                    final long deadline,
                                                                    final Address recipient,
                                                                    final Address outputToken) {
        return execute("tokenToTokenTransferInput", call, () -> {
            requireRecipient(recipient, "tokenToTokenTransferInput");
            return tokenToTokenInput(call, tokensSold, minTokensBought, minEthBought, deadline,
                    recipient, exchangeForToken(outputToken));
        });
    }

    /**
     * Buy exactly {@code tokensBought} of {@code outputToken}, selling at most
     * {@code maxTokensSold} and routing at most {@code maxEthSold}.
     *
     * @return tokens of this exchange's token sold
     */
    public Result<BigInteger, DomainError> tokenToTokenSwapOutput(final Call call,
                                                                 final BigInteger tokensBought,
                                                                 final BigInteger maxTokensSold,
                                                                 final BigInteger maxEthSold,
                                                                 final long deadline,
                                                                 final Address outputToken) {
        return execute("tokenToTokenSwapOutput", call, () -> tokenToTokenOutput(call, tokensBought, maxTokensSold,
                maxEthSold, deadline, call.caller(), exchangeForToken(outputToken)));
    }

    public Result<BigInteger, DomainError> tokenToTokenTransferOutput(final Call call,
                                                                     final BigInteger tokensBought,
                                                                     final BigInteger maxTokensSold,
                                                                     final BigInteger maxEthSold,
                                                                     final long deadline,
                                                                     final Address recipient,
                                                                     final Address outputToken) {
        return execute("tokenToTokenTransferOutput", call, () -> {
            requireRecipient(recipient, "tokenToTokenTransferOutput");
            return tokenToTokenOutput(call, tokensBought, maxTokensSold, maxEthSold, deadline,
                    recipient, exchangeForToken(outputToken));
        });
    }

    // ========================================
    // TOKEN -> TOKEN (explicit exchange)
    // ========================================

    /**
     * Like {@link #tokenToTokenSwapInput} but routed to an explicit exchange, which may
     * belong to another registry.
     */
    public Result<BigInteger, DomainError> tokenToExchangeSwapInput(final Call call,
                                                                   final BigInteger tokensSold,
                                                                   final BigInteger minTokensBought,
                                                                   final BigInteger minEthBought,
                                                                   final long deadline,
                                                                   final Address exchangeAddress) {
        return execute("tokenToExchangeSwapInput", call, () -> tokenToTokenInput(call, tokensSold, minTokensBought,
                minEthBought, deadline, call.caller(), exchangeAt(exchangeAddress)));
    }

    public Result<BigInteger, DomainError> tokenToExchangeTransferInput(final Call call,
                                                                       final BigInteger tokensSold,
                                                                       final BigInteger minTokensBought,
                                                                       final BigInteger minEthBought,
                                                                       final long deadline,
                                                                       final Address recipient,
                                                                       final Address exchangeAddress) {
        return execute("tokenToExchangeTransferInput", call, () -> {
            requireRecipient(recipient, "tokenToExchangeTransferInput");
            return tokenToTokenInput(call, tokensSold, minTokensBought, minEthBought, deadline,
                    recipient, exchangeAt(exchangeAddress));
        });
    }

    public Result<BigInteger, DomainError> tokenToExchangeSwapOutput(final Call call,
                                                                    final BigInteger tokensBought,
                                                                    final BigInteger maxTokensSold,
                                                                    final BigInteger maxEthSold,
                                                                    final long deadline,
                                                                    final Address exchangeAddress) {
        return execute("tokenToExchangeSwapOutput", call, () -> tokenToTokenOutput(call, tokensBought, maxTokensSold,
                maxEthSold, deadline, call.caller(), exchangeAt(exchangeAddress)));
    }

    public Result<BigInteger, DomainError> tokenToExchangeTransferOutput(final Call call,
                                                                        final BigInteger tokensBought,
                                                                        final BigInteger maxTokensSold,
                                                                        final BigInteger maxEthSold,
                                                                        final long deadline,
                                                                        final Address recipient,
                                                                        final Address exchangeAddress) {
        return execute("tokenToExchangeTransferOutput", call, () -> {
            requireRecipient(recipient, "tokenToExchangeTransferOutput");
            return tokenToTokenOutput(call, tokensBought, maxTokensSold, maxEthSold, deadline,
                    recipient, exchangeAt(exchangeAddress));
        });
    }

    // ========================================
    // PRICE GETTERS
    // ========================================

    /**
     * Tokens received for selling {@code ethSold}.
     */
    public Result<BigInteger, DomainError> getEthToTokenInputPrice(final BigInteger ethSold) {
        return execute("getEthToTokenInputPrice", () -> {
            requireParameters(Uint256.isPositive(ethSold), "getEthToTokenInputPrice");
            return AmmMath.priceForExactInput(ethSold, reserveEth, reserveToken);
        });
    }

    /**
     * ETH needed to buy {@code tokensBought}.
     */
    public Result<BigInteger, DomainError> getEthToTokenOutputPrice(final BigInteger tokensBought) {
        return execute("getEthToTokenOutputPrice", () -> {
            requireParameters(Uint256.isPositive(tokensBought), "getEthToTokenOutputPrice");
            return AmmMath.priceForExactOutput(tokensBought, reserveEth, reserveToken);
        });
    }

    /**
     * ETH received for selling {@code tokensSold}.
     */
    public Result<BigInteger, DomainError> getTokenToEthInputPrice(final BigInteger tokensSold) {
        return execute("getTokenToEthInputPrice", () -> {
            requireParameters(Uint256.isPositive(tokensSold), "getTokenToEthInputPrice");
            return AmmMath.priceForExactInput(tokensSold, reserveToken, reserveEth);
        });
    }

    /**
     * Tokens needed to buy {@code ethBought}.
     */
    public Result<BigInteger, DomainError> getTokenToEthOutputPrice(final BigInteger ethBought) {
        return execute("getTokenToEthOutputPrice", () -> {
            requireParameters(Uint256.isPositive(ethBought), "getTokenToEthOutputPrice");
            return AmmMath.priceForExactOutput(ethBought, reserveToken, reserveEth);
        });
    }

    // ========================================
    // POOL SHARES
    // ========================================

    public String name() {
        return SwapConstants.SHARE_NAME;
    }

    public String symbol() {
        return SwapConstants.SHARE_SYMBOL;
    }

    public int decimals() {
        return SwapConstants.SHARE_DECIMALS;
    }

    public BigInteger totalSupply() {
        return shares.totalSupply();
    }

    public BigInteger balanceOf(final Address holder) {
        return shares.balanceOf(holder);
    }

    public BigInteger allowance(final Address owner, final Address spender) {
        return shares.allowance(owner, spender);
    }

    public Result<Boolean, DomainError> transfer(final Call call, final Address to, final BigInteger value) {
        return transactions.execute("transfer", () -> {
            requireExternalCaller(call, "transfer");
            requireNoValue(call, "transfer");
            shares.transfer(call.caller(), to, value);
            return true;
        });
    }

    public Result<Boolean, DomainError> transferFrom(final Call call,
                                                     final Address from,
                                                     final Address to,
                                                     final BigInteger value) {
        return transactions.execute("transferFrom", () -> {
            requireExternalCaller(call, "transferFrom");
            requireNoValue(call, "transferFrom");
            shares.transferFrom(call.caller(), from, to, value);
            return true;
        });
    }

    public Result<Boolean, DomainError> approve(final Call call, final Address spender, final BigInteger value) {
        return transactions.execute("approve", () -> {
            requireExternalCaller(call, "approve");
            requireNoValue(call, "approve");
            shares.approve(call.caller(), spender, value);
            return true;
        });
    }

    // ========================================
    // SWAP BODIES
    // ========================================

    private BigInteger ethToTokenInput(final Call call,
                                       final BigInteger minTokens,
                                       final long deadline,
                                       final Address recipient) {
        BigInteger ethSold = call.value();
        requireParameters(ethSold.signum() > 0 && Uint256.isPositive(minTokens), "ethToTokenInput");
        requireSwapDeadline(deadline, "ethToTokenInput");

        BigInteger tokensBought = AmmMath.priceForExactInput(ethSold, reserveEth, reserveToken);
        if (tokensBought.compareTo(minTokens) < 0) {
            throw new ExchangeException(new SlippageExceededError(
                    "ethToTokenInput tokens bought below minTokens", minTokens, tokensBought));
        }

        receiveEth(call.caller(), ethSold);
        setReserves(Uint256.add(reserveEth, ethSold), Uint256.sub(reserveToken, tokensBought));
        sendTokens(recipient, tokensBought);
        transactions.emit(new ExchangeEvent.TokenPurchase(address, call.caller(), ethSold, tokensBought));
        logger.info("Exchange {}: {} sold {} ETH for {} tokens to {}",
                address, call.caller(), ethSold, tokensBought, recipient);
        return tokensBought;
    }

    private BigInteger ethToTokenOutput(final Call call,
                                        final BigInteger tokensBought,
                                        final long deadline,
                                        final Address recipient) {
        BigInteger maxEth = call.value();
        requireParameters(Uint256.isPositive(tokensBought) && maxEth.signum() > 0, "ethToTokenOutput");
        requireSwapDeadline(deadline, "ethToTokenOutput");

        BigInteger ethSold = AmmMath.priceForExactOutput(tokensBought, reserveEth, reserveToken);
        if (ethSold.compareTo(maxEth) > 0) {
            throw new ExchangeException(new SlippageExceededError(
                    "ethToTokenOutput ETH required above attached value", maxEth, ethSold));
        }

        receiveEth(call.caller(), maxEth);
        setReserves(Uint256.add(reserveEth, ethSold), Uint256.sub(reserveToken, tokensBought));
        sendEth(call.caller(), maxEth.subtract(ethSold));
        sendTokens(recipient, tokensBought);
        transactions.emit(new ExchangeEvent.TokenPurchase(address, call.caller(), ethSold, tokensBought));
        logger.info("Exchange {}: {} bought {} tokens for {} ETH to {}",
                address, call.caller(), tokensBought, ethSold, recipient);
        return ethSold;
    }

    private BigInteger tokenToEthInput(final Call call,
                                       final BigInteger tokensSold,
                                       final BigInteger minEth,
                                       final long deadline,
                                       final Address recipient) {
        requireNoValue(call, "tokenToEthInput");
        requireParameters(Uint256.isPositive(tokensSold) && Uint256.isPositive(minEth), "tokenToEthInput");
        requireSwapDeadline(deadline, "tokenToEthInput");

        BigInteger ethBought = AmmMath.priceForExactInput(tokensSold, reserveToken, reserveEth);
        if (ethBought.compareTo(minEth) < 0) {
            throw new ExchangeException(new SlippageExceededError(
                    "tokenToEthInput ETH bought below minEth", minEth, ethBought));
        }

        setReserves(Uint256.sub(reserveEth, ethBought), Uint256.add(reserveToken, tokensSold));
        sendEth(recipient, ethBought);
        pullTokens(call.caller(), tokensSold);
        transactions.emit(new ExchangeEvent.EthPurchase(address, call.caller(), tokensSold, ethBought));
        logger.info("Exchange {}: {} sold {} tokens for {} ETH to {}",
                address, call.caller(), tokensSold, ethBought, recipient);
        return ethBought;
    }

    private BigInteger tokenToEthOutput(final Call call,
                                        final BigInteger ethBought,
                                        final BigInteger maxTokens,
                                        final long deadline,
                                        final Address recipient) {
        requireNoValue(call, "tokenToEthOutput");
        requireParameters(Uint256.isPositive(ethBought), "tokenToEthOutput");
        requireSwapDeadline(deadline, "tokenToEthOutput");
        Uint256.of(maxTokens);

        BigInteger tokensSold = AmmMath.priceForExactOutput(ethBought, reserveToken, reserveEth);
        if (tokensSold.compareTo(maxTokens) > 0) {
            throw new ExchangeException(new SlippageExceededError(
                    "tokenToEthOutput tokens required above maxTokens", maxTokens, tokensSold));
        }

        setReserves(Uint256.sub(reserveEth, ethBought), Uint256.add(reserveToken, tokensSold));
        sendEth(recipient, ethBought);
        pullTokens(call.caller(), tokensSold);
        transactions.emit(new ExchangeEvent.EthPurchase(address, call.caller(), tokensSold, ethBought));
        logger.info("Exchange {}: {} bought {} ETH for {} tokens to {}",
                address, call.caller(), ethBought, tokensSold, recipient);
        return tokensSold;
    }

    private BigInteger tokenToTokenInput(final Call call,
                                         final BigInteger tokensSold,
                                         final BigInteger minTokensBought,
                                         final BigInteger minEthBought,
                                         final long deadline,
                                         final Address recipient,
                                         final Supplier<Exchange> target) {
        requireNoValue(call, "tokenToTokenInput");
        requireParameters(Uint256.isPositive(tokensSold) && Uint256.isPositive(minTokensBought)
                && Uint256.isPositive(minEthBought), "tokenToTokenInput");
        requireSwapDeadline(deadline, "tokenToTokenInput");
        Exchange destination = requireDestination(target.get());

        BigInteger ethBought = AmmMath.priceForExactInput(tokensSold, reserveToken, reserveEth);
        if (ethBought.compareTo(minEthBought) < 0) {
            throw new ExchangeException(new SlippageExceededError(
                    "tokenToTokenInput ETH bought below minEthBought", minEthBought, ethBought));
        }

        pullTokens(call.caller(), tokensSold);
        setReserves(Uint256.sub(reserveEth, ethBought), Uint256.add(reserveToken, tokensSold));
        BigInteger tokensBought = destination
                .ethToTokenTransferInput(Call.from(address).withValue(ethBought), minTokensBought, deadline, recipient)
                .orElseThrow(ExchangeException::new);
        transactions.emit(new ExchangeEvent.EthPurchase(address, call.caller(), tokensSold, ethBought));
        logger.info("Exchange {}: {} sold {} tokens via {} ETH for {} tokens on {} to {}",
                address, call.caller(), tokensSold, ethBought, tokensBought, destination.address(), recipient);
        return tokensBought;
    }

    private BigInteger tokenToTokenOutput(final Call call,
                                          final BigInteger tokensBought,
                                          final BigInteger maxTokensSold,
                                          final BigInteger maxEthSold,
                                          final long deadline,
                                          final Address recipient,
                                          final Supplier<Exchange> target) {
        requireNoValue(call, "tokenToTokenOutput");
        requireParameters(Uint256.isPositive(tokensBought) && Uint256.isPositive(maxEthSold), "tokenToTokenOutput");
        requireSwapDeadline(deadline, "tokenToTokenOutput");
        Uint256.of(maxTokensSold);
        Exchange destination = requireDestination(target.get());

        BigInteger ethBought = destination.getEthToTokenOutputPrice(tokensBought).orElseThrow(ExchangeException::new);
        BigInteger tokensSold = AmmMath.priceForExactOutput(ethBought, reserveToken, reserveEth);
        if (tokensSold.compareTo(maxTokensSold) > 0) {
            throw new ExchangeException(new SlippageExceededError(
                    "tokenToTokenOutput tokens required above maxTokensSold", maxTokensSold, tokensSold));
        }
        if (ethBought.compareTo(maxEthSold) > 0) {
            throw new ExchangeException(new SlippageExceededError(
                    "tokenToTokenOutput ETH routed above maxEthSold", maxEthSold, ethBought));
        }

        pullTokens(call.caller(), tokensSold);
        setReserves(Uint256.sub(reserveEth, ethBought), Uint256.add(reserveToken, tokensSold));
        destination.ethToTokenTransferOutput(Call.from(address).withValue(ethBought), tokensBought, deadline, recipient)
                .orElseThrow(ExchangeException::new);
        transactions.emit(new ExchangeEvent.EthPurchase(address, call.caller(), tokensSold, ethBought));
        logger.info("Exchange {}: {} sold {} tokens via {} ETH for {} tokens on {} to {}",
                address, call.caller(), tokensSold, ethBought, tokensBought, destination.address(), recipient);
        return tokensSold;
    }

    // ========================================
    // HELPERS
    // ========================================

    private <T> Result<T, DomainError> execute(final String operation, final Call call, final Supplier<T> body) {
        return execute(operation, () -> {
            requireExternalCaller(call, operation);
            return body.get();
        });
    }

    private <T> Result<T, DomainError> execute(final String operation, final Supplier<T> body) {
        return transactions.execute(operation, () -> {
            if (!isConfigured()) {
                throw new ExchangeException(new NotConfiguredError(
                        operation + ": exchange " + address + " has not been set up"));
            }
            return body.get();
        });
    }

    private Supplier<Exchange> exchangeForToken(final Address outputToken) {
        return () -> runtime.lookup(factoryAddress, ExchangeRegistry.class)
                .flatMap(registry -> registry.getExchange(outputToken))
                .flatMap(exchangeAddress -> runtime.lookup(exchangeAddress, Exchange.class))
                .orElse(null);
    }

    private Supplier<Exchange> exchangeAt(final Address exchangeAddress) {
        return () -> runtime.lookup(exchangeAddress, Exchange.class).orElse(null);
    }

    private Exchange requireDestination(final Exchange destination) {
        if (destination == null) {
            throw new ExchangeException(new InvalidExchangeError("no exchange found for routing target"));
        }
        if (destination == this) {
            throw new ExchangeException(new InvalidExchangeError("cannot route a trade back into " + address));
        }
        return destination;
    }

    private void requireRecipient(final Address recipient, final String operation) {
        if (recipient == null || recipient.isZero() || recipient.equals(address)) {
            throw new ExchangeException(new InvalidRecipientError(operation + " invalid recipient address " + recipient));
        }
    }

    private void requireExternalCaller(final Call call, final String operation) {
        if (call.caller().equals(address)) {
            throw new ExchangeException(new ValidationError(
                    operation + " cannot be called by exchange " + address + " itself"));
        }
    }

    private static void requireParameters(final boolean valid, final String operation) {
        if (!valid) {
            throw new ExchangeException(new ValidationError(operation + " invalid parameters"));
        }
    }

    private static void requireNoValue(final Call call, final String operation) {
        if (call.hasValue()) {
            throw new ExchangeException(new ValidationError(operation + " does not accept native currency"));
        }
    }

    private void requireSwapDeadline(final long deadline, final String operation) {
        long now = runtime.blockClock().currentBlock();
        if (deadline < now) {
            throw new ExchangeException(new ValidationError(
                    operation + " deadline " + deadline + " has passed (now " + now + ")", ValidationError.Type.EXPIRED));
        }
    }

    private void requireLiquidityDeadline(final long deadline, final String operation) {
        long now = runtime.blockClock().currentBlock();
        if (deadline <= now) {
            throw new ExchangeException(new ValidationError(
                    operation + " deadline " + deadline + " must be after now (" + now + ")",
                    ValidationError.Type.EXPIRED));
        }
    }

    private void setReserves(final BigInteger ethReserve, final BigInteger tokenReserve) {
        BigInteger previousEth = reserveEth;
        BigInteger previousToken = reserveToken;
        transactions.onRollback(() -> {
            reserveEth = previousEth;
            reserveToken = previousToken;
        });
        reserveEth = ethReserve;
        reserveToken = tokenReserve;
    }

    private void receiveEth(final Address from, final BigInteger amount) {
        moveEth(from, address, amount);
    }

    private void sendEth(final Address to, final BigInteger amount) {
        moveEth(address, to, amount);
    }

    private void moveEth(final Address from, final Address to, final BigInteger amount) {
        if (amount.signum() == 0) {
            return;
        }
        boolean settled;
        try {
            settled = runtime.nativeLedger().transfer(from, to, amount);
        } catch (RuntimeException ex) {
            throw new ExchangeException(new AssetTransferFailedError(
                    "native transfer of " + amount + " from " + from + " to " + to + " aborted: " + ex.getMessage()), ex);
        }
        if (!settled) {
            throw new ExchangeException(new AssetTransferFailedError(
                    "native transfer of " + amount + " from " + from + " to " + to + " failed"));
        }
    }

    private void sendTokens(final Address to, final BigInteger amount) {
        boolean settled;
        try {
            settled = token.transfer(address, to, amount);
        } catch (RuntimeException ex) {
            throw new ExchangeException(new AssetTransferFailedError(
                    "token transfer of " + amount + " to " + to + " aborted: " + ex.getMessage()), ex);
        }
        if (!settled) {
            throw new ExchangeException(new AssetTransferFailedError(
                    "token transfer of " + amount + " to " + to + " failed"));
        }
    }

    private void pullTokens(final Address from, final BigInteger amount) {
        boolean settled;
        try {
            settled = token.transferFrom(address, from, address, amount);
        } catch (RuntimeException ex) {
            throw new ExchangeException(new AssetTransferFailedError(
                    "token transferFrom of " + amount + " from " + from + " aborted: " + ex.getMessage()), ex);
        }
        if (!settled) {
            throw new ExchangeException(new AssetTransferFailedError(
                    "token transferFrom of " + amount + " from " + from + " failed"));
        }
    }

    @Override
    public String toString() {
        return "Exchange{" + address + ", token=" + tokenAddress + "}";
    }
}
