package com.digitalasset.amm.common.errors;

import com.digitalasset.amm.common.DomainError;

public final class InvalidExchangeError extends DomainError {

    public InvalidExchangeError(final String details) {
        super("INVALID_EXCHANGE", details, 400);
    }
}
