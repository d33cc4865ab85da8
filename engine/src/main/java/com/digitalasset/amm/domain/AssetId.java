// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.domain;

import java.util.Objects;

/**
 * Identity of a fungible asset kind, e.g. "WETH" or a token address.
 */
public record AssetId(String value) {

    public AssetId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("asset id must not be blank");
        }
        value = value.trim();
    }

    public static AssetId of(final String value) {
        return new AssetId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
