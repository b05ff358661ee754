package com.digitalasset.amm.common.errors;

import com.digitalasset.amm.common.DomainError;

/**
 * Invalid call parameters: zero amounts, missing bounds, attached value on a
 * non-payable operation, or a deadline that has already passed.
 */
public final class ValidationError extends DomainError {

    public enum Type {
        REQUEST,
        EXPIRED
    }

    private final Type type;

    public ValidationError(final String details) {
        this(details, Type.REQUEST);
    }

    public ValidationError(final String details, final Type type) {
        super("INVALID_PARAMETERS", details, 400);
        this.type = type;
    }

    public Type type() {
        return type;
    }
}
