// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.ledger;

import com.digitalasset.amm.domain.Pool;

import java.util.Objects;

/**
 * The three ledgers a pool touches: one per pool asset plus its own claim token.
 */
public record PoolLedgers(AssetLedger ledgerA, AssetLedger ledgerB, AssetLedger claimLedger) {

    public PoolLedgers {
        Objects.requireNonNull(ledgerA, "ledgerA");
        Objects.requireNonNull(ledgerB, "ledgerB");
        Objects.requireNonNull(claimLedger, "claimLedger");
    }

    public AssetLedger ledger(final Pool.Side side) {
        return side == Pool.Side.A ? ledgerA : ledgerB;
    }

    public void verifyMatches(final Pool pool) {
        if (!ledgerA.asset().equals(pool.assetA()) || !ledgerB.asset().equals(pool.assetB())) {
            throw new IllegalArgumentException("ledgers " + ledgerA.asset() + "/" + ledgerB.asset()
                    + " do not match pool " + pool.pairName());
        }
    }
}
