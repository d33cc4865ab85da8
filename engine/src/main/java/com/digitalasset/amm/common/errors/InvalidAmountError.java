// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.common.errors;

import com.digitalasset.amm.common.DomainError;

public final class InvalidAmountError extends DomainError {

    public InvalidAmountError(final String details) {
        super("INVALID_AMOUNT", details);
    }
}
