package com.digitalasset.amm.common.errors;

import com.digitalasset.amm.common.DomainError;

public final class InsufficientLiquidityError extends DomainError {

    public InsufficientLiquidityError(final String details) {
        super("INSUFFICIENT_LIQUIDITY", details, 422);
    }
}
