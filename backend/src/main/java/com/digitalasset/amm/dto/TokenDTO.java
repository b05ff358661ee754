// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

/**
 * Token ledger summary
 */
public class TokenDTO {
    public final String address;
    public final String name;
    public final String symbol;
    public final String totalSupply;

    public TokenDTO(String address, String name, String symbol, String totalSupply) {
        this.address = address;
        this.name = name;
        this.symbol = symbol;
        this.totalSupply = totalSupply;
    }
}
