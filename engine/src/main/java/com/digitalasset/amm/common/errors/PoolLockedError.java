// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.common.errors;

import com.digitalasset.amm.common.DomainError;

/**
 * A call re-entered the pool while another operation on the same thread still holds it.
 */
public final class PoolLockedError extends DomainError {

    public PoolLockedError(final String details) {
        super("LOCKED", details);
    }
}
