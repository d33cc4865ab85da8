// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.common.errors;

import com.digitalasset.amm.common.DomainError;

public final class InsufficientLiquidityError extends DomainError {

    public InsufficientLiquidityError(final String details) {
        super("INSUFFICIENT_LIQUIDITY", details);
    }
}
