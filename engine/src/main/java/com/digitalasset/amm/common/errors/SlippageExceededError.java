// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.common.errors;

import com.digitalasset.amm.common.DomainError;

/**
 * A computed amount falls below the minimum the caller accepts.
 */
public final class SlippageExceededError extends DomainError {

    public SlippageExceededError(final String details) {
        super("SLIPPAGE_EXCEEDED", details);
    }
}
