package com.digitalasset.amm.common.errors;

import com.digitalasset.amm.common.DomainError;

public final class InvalidReserveError extends DomainError {

    public InvalidReserveError(final String details) {
        super("INVALID_RESERVE", details, 409);
    }
}
