// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

import com.digitalasset.amm.domain.Address;
import com.digitalasset.amm.domain.AssetId;

import java.math.BigInteger;
import java.time.Instant;

public record RemoveLiquidityCommand(
        AssetId tokenA,
        AssetId tokenB,
        BigInteger liquidity,
        BigInteger amountAMin,
        BigInteger amountBMin,
        Address sender,
        Address to,
        Instant deadline
) {
}
