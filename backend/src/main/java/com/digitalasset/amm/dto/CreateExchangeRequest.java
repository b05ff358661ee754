// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * CreateExchangeRequest - List a token on the registry
 */
public class CreateExchangeRequest {
    @NotBlank(message = "token is required")
    public String token;

    // Default constructor for Jackson
    public CreateExchangeRequest() {}

    public CreateExchangeRequest(String token) {
        this.token = token;
    }
}
