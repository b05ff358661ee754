// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.common;

/**
 * Base type for domain-level errors.
 *
 * Every rejected exchange, registry or ledger operation reports exactly one of these;
 * the code is stable and the HTTP status is what the REST layer answers with.
 */
public abstract class DomainError {

    private final String code;
    private final String message;
    private final int httpStatus;

    protected DomainError(final String code, final String message, final int httpStatus) {
        this.code = code;
        this.message = message;
        this.httpStatus = httpStatus;
    }

    public String code() {
        return code;
    }

    public String message() {
        return message;
    }

    public int httpStatus() {
        return httpStatus;
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
