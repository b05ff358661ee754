package com.digitalasset.amm.common.errors;

import com.digitalasset.amm.common.DomainError;

public final class InsufficientBalanceError extends DomainError {

    public InsufficientBalanceError(final String details) {
        super("INSUFFICIENT_BALANCE", details, 422);
    }
}
