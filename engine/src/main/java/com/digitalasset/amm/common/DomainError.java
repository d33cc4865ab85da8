// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.common;

/**
 * Base type for pool rejections. Every rejection is an expected outcome the caller handles;
 * none of them leaves a partial effect behind.
 */
public abstract class DomainError {

    private final String code;
    private final String message;

    protected DomainError(final String code, final String message) {
        this.code = code;
        this.message = message;
    }

    public String code() {
        return code;
    }

    public String message() {
        return message;
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }
}
