// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigInteger;

/**
 * MintRequest - Credit native currency (no token) or tokens of a ledger to an account
 */
public class MintRequest {
    @NotBlank(message = "account is required")
    public String account;

    /**
     * Token ledger address; absent for native currency.
     */
    public String token;

    @NotNull(message = "amount is required")
    @Positive(message = "amount must be positive")
    public BigInteger amount;

    // Default constructor for Jackson
    public MintRequest() {}

    public MintRequest(String account, String token, BigInteger amount) {
        this.account = account;
        this.token = token;
        this.amount = amount;
    }
}
