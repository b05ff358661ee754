package com.digitalasset.amm.common.errors;

import com.digitalasset.amm.common.DomainError;

import java.math.BigInteger;

public final class SlippageExceededError extends DomainError {

    private final BigInteger bound;
    private final BigInteger actual;

    public SlippageExceededError(final String details, final BigInteger bound, final BigInteger actual) {
        super("SLIPPAGE_EXCEEDED", details + " (bound=" + bound + ", actual=" + actual + ")", 422);
        this.bound = bound;
        this.actual = actual;
    }

    public BigInteger bound() {
        return bound;
    }

    public BigInteger actual() {
        return actual;
    }
}
