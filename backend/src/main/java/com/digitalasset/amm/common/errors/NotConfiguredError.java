package com.digitalasset.amm.common.errors;

import com.digitalasset.amm.common.DomainError;

public final class NotConfiguredError extends DomainError {

    public NotConfiguredError(final String details) {
        super("NOT_CONFIGURED", details, 409);
    }
}
