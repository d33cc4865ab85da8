// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.common;

/**
 * Unchecked carrier for a {@link DomainError}, for callers that prefer exceptions over {@link Result}.
 */
public class PoolOperationException extends RuntimeException {

    private final transient DomainError error;

    public PoolOperationException(final DomainError error) {
        super(error.code() + ": " + error.message());
        this.error = error;
    }

    public DomainError error() {
        return error;
    }

    public String code() {
        return error.code();
    }
}
