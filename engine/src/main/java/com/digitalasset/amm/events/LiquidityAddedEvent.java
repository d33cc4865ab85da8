// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.events;

import com.digitalasset.amm.domain.Address;
import com.digitalasset.amm.domain.AssetId;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Deposit event; amounts are in pool order (assetA, assetB).
 */
public record LiquidityAddedEvent(
        Address user,
        AssetId assetA,
        AssetId assetB,
        BigInteger amountA,
        BigInteger amountB,
        BigInteger liquidity,
        Instant at
) implements PoolEvent {

    @Override
    public String operation() {
        return "add_liquidity";
    }
}
