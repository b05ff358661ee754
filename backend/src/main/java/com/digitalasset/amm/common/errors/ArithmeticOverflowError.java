package com.digitalasset.amm.common.errors;

import com.digitalasset.amm.common.DomainError;

public final class ArithmeticOverflowError extends DomainError {

    public ArithmeticOverflowError(final String details) {
        super("ARITHMETIC_OVERFLOW", details, 422);
    }
}
