// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.events;

import com.digitalasset.amm.domain.Address;
import com.digitalasset.amm.domain.AssetId;

import java.math.BigInteger;
import java.time.Instant;

public record SwapExecutedEvent(
        Address user,
        AssetId tokenIn,
        AssetId tokenOut,
        BigInteger amountIn,
        BigInteger amountOut,
        Instant at
) implements PoolEvent {

    @Override
    public String operation() {
        return "swap";
    }
}
