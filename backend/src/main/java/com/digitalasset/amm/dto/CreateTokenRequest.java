// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * CreateTokenRequest - Request to deploy a new token ledger
 */
public class CreateTokenRequest {
    @NotBlank(message = "name is required")
    @Size(max = 64, message = "name must be at most 64 characters")
    public String name;

    @NotBlank(message = "symbol is required")
    @Size(max = 16, message = "symbol must be at most 16 characters")
    public String symbol;

    // Default constructor for Jackson
    public CreateTokenRequest() {}

    public CreateTokenRequest(String name, String symbol) {
        this.name = name;
        this.symbol = symbol;
    }
}
