package com.digitalasset.amm.common.errors;

import com.digitalasset.amm.common.DomainError;

public final class AlreadyConfiguredError extends DomainError {

    public AlreadyConfiguredError(final String details) {
        super("ALREADY_CONFIGURED", details, 409);
    }
}
