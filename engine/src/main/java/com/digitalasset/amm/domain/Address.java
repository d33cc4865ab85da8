// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.domain;

import java.util.Objects;

/**
 * A balance holder on the asset ledger: a user, or the pool itself.
 */
public record Address(String value) {

    public Address {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("address must not be blank");
        }
        value = value.trim();
    }

    public static Address of(final String value) {
        return new Address(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
