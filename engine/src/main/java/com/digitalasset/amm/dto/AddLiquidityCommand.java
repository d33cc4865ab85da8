// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

import com.digitalasset.amm.domain.Address;
import com.digitalasset.amm.domain.AssetId;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Deposit request. {@code tokenA}/{@code tokenB} may be given in either order; the amounts follow
 * the caller's order.
 */
public record AddLiquidityCommand(
        AssetId tokenA,
        AssetId tokenB,
        BigInteger amountADesired,
        BigInteger amountBDesired,
        BigInteger amountAMin,
        BigInteger amountBMin,
        Address sender,
        Address to,
        Instant deadline
) {
}
