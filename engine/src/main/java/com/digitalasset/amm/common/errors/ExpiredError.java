// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.common.errors;

import com.digitalasset.amm.common.DomainError;

/**
 * The caller-supplied deadline lies before the current time.
 */
public final class ExpiredError extends DomainError {

    public ExpiredError(final String details) {
        super("EXPIRED", details);
    }
}
