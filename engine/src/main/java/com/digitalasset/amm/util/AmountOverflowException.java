// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.util;

/**
 * Thrown by {@link AmmMath} when a value leaves the unsigned 256-bit range.
 */
public class AmountOverflowException extends ArithmeticException {

    public AmountOverflowException(final String message) {
        super(message);
    }
}
