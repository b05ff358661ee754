// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.event;

import com.digitalasset.amm.ledger.Address;

import java.math.BigInteger;

/**
 * Observable side effects of committed exchange and registry operations.
 *
 * Field order of each record matches the published event signature after {@code source}.
 */
public sealed interface ExchangeEvent {

    /**
     * Contract that emitted the event.
     */
    Address source();

    record TokenPurchase(Address source, Address buyer, BigInteger ethSold, BigInteger tokensBought)
            implements ExchangeEvent {}

    record EthPurchase(Address source, Address buyer, BigInteger tokensSold, BigInteger ethBought)
            implements ExchangeEvent {}

    record AddLiquidity(Address source, Address provider, BigInteger ethAmount, BigInteger tokenAmount)
            implements ExchangeEvent {}

    record RemoveLiquidity(Address source, Address provider, BigInteger ethAmount, BigInteger tokenAmount)
            implements ExchangeEvent {}

    /**
     * Pool share movement; mint and burn use {@link Address#ZERO} on the missing side.
     */
    record Transfer(Address source, Address from, Address to, BigInteger value)
            implements ExchangeEvent {}

    record Approval(Address source, Address owner, Address spender, BigInteger value)
            implements ExchangeEvent {}

    record NewExchange(Address source, Address token, Address exchange)
            implements ExchangeEvent {}
}
