// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

import com.digitalasset.amm.domain.Address;
import com.digitalasset.amm.domain.AssetId;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * Exact-input swap along {@code path = [tokenIn, tokenOut]}.
 */
public record SwapCommand(
        BigInteger amountIn,
        BigInteger amountOutMin,
        List<AssetId> path,
        Address sender,
        Address to,
        Instant deadline
) {

    public SwapCommand {
        path = path == null ? List.of() : List.copyOf(path);
    }
}
