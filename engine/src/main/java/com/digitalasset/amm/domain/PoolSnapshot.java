// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.domain;

import java.math.BigInteger;

/**
 * Reserves and claim supply read together under the pool guard.
 */
public record PoolSnapshot(
        AssetId assetA,
        AssetId assetB,
        BigInteger reserveA,
        BigInteger reserveB,
        BigInteger totalClaimSupply
) {

    public boolean isEmpty() {
        return reserveA.signum() == 0 && reserveB.signum() == 0;
    }

    public BigInteger k() {
        return reserveA.multiply(reserveB);
    }

    public BigInteger reserveOf(final AssetId asset) {
        if (assetA.equals(asset)) {
            return reserveA;
        }
        if (assetB.equals(asset)) {
            return reserveB;
        }
        throw new IllegalArgumentException("asset " + asset + " is not part of pool " + assetA + "/" + assetB);
    }
}
