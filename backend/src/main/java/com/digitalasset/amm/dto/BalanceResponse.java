// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

import java.util.Map;

/**
 * Native, token and pool-share balances of one account.
 * Token and share maps are keyed by token address and exchange address.
 */
public class BalanceResponse {
    public final String account;
    public final String eth;
    public final Map<String, String> tokens;
    public final Map<String, String> shares;

    public BalanceResponse(String account, String eth, Map<String, String> tokens, Map<String, String> shares) {
        this.account = account;
        this.eth = eth;
        this.tokens = tokens;
        this.shares = shares;
    }
}
