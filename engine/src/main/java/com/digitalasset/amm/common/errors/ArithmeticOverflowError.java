// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.common.errors;

import com.digitalasset.amm.common.DomainError;

/**
 * An intermediate or final amount left the unsigned 256-bit range.
 */
public final class ArithmeticOverflowError extends DomainError {

    public ArithmeticOverflowError(final String details) {
        super("ARITHMETIC_OVERFLOW", details);
    }
}
