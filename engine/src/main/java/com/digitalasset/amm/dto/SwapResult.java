// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

import com.digitalasset.amm.domain.AssetId;

import java.math.BigInteger;

public record SwapResult(AssetId tokenIn, AssetId tokenOut, BigInteger amountIn, BigInteger amountOut) {
}
