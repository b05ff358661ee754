package com.digitalasset.amm.common.errors;

import com.digitalasset.amm.common.DomainError;

public final class InvalidRecipientError extends DomainError {

    public InvalidRecipientError(final String details) {
        super("INVALID_RECIPIENT", details, 400);
    }
}
