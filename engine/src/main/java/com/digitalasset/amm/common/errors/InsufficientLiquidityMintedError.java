// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.common.errors;

import com.digitalasset.amm.common.DomainError;

/**
 * The deposit is too small to mint a single claim token.
 */
public final class InsufficientLiquidityMintedError extends DomainError {

    public InsufficientLiquidityMintedError(final String details) {
        super("INSUFFICIENT_LIQUIDITY_MINTED", details);
    }
}
