// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.constants;

import java.math.BigInteger;

/**
 * Centralized constants for pool arithmetic.
 *
 * All amounts are unsigned integers in the smallest unit of their asset.
 */
public final class PoolConstants {

    private PoolConstants() {
        // Prevent instantiation
    }

    // ========================================
    // PRECISION & SCALE
    // ========================================

    /**
     * Fixed-point scale of {@code getPrice} results (10^18).
     */
    public static final BigInteger PRICE_SCALE = BigInteger.TEN.pow(18);

    /**
     * Largest representable amount, 2^256 - 1. Any intermediate product above it is rejected.
     */
    public static final BigInteger MAX_UINT256 = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

    // ========================================
    // FEE STRUCTURE
    // ========================================

    /**
     * Default swap fee in basis points (0.3% = 30 bps), equal to the 997/1000 split.
     */
    public static final int DEFAULT_FEE_BPS = 30;

    /**
     * Highest fee the pool accepts (10%).
     */
    public static final int MAX_FEE_BPS = 1000;

    /**
     * Basis points representation of 100% (10000 bps = 100%).
     */
    public static final int BPS_100_PERCENT = 10000;

    public static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(BPS_100_PERCENT);

    // ========================================
    // HISTORY
    // ========================================

    /**
     * Default number of events the journal keeps.
     */
    public static final int DEFAULT_HISTORY_SIZE = 1000;
}
