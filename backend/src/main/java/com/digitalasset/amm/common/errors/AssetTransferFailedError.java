package com.digitalasset.amm.common.errors;

import com.digitalasset.amm.common.DomainError;

public final class AssetTransferFailedError extends DomainError {

    public AssetTransferFailedError(final String details) {
        super("ASSET_TRANSFER_FAILED", details, 422);
    }
}
