// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.common;

import java.util.Objects;

/**
 * Carries a {@link DomainError} from the point of failure to the transaction boundary,
 * where the journal is rolled back and the error is handed to the caller as a {@link Result}.
 */
public class ExchangeException extends RuntimeException {

    private final transient DomainError error;

    public ExchangeException(final DomainError error) {
        super(Objects.requireNonNull(error, "error").toString());
        this.error = error;
    }

    public ExchangeException(final DomainError error, final Throwable cause) {
        super(Objects.requireNonNull(error, "error").toString(), cause);
        this.error = error;
    }

    public DomainError error() {
        return error;
    }
}
