// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.common.errors;

import com.digitalasset.amm.common.DomainError;

public final class TransferFailedError extends DomainError {

    private final String asset;

    public TransferFailedError(final String asset, final String details) {
        super("TRANSFER_FAILED", details);
        this.asset = asset;
    }

    public String asset() {
        return asset;
    }
}
