// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

import java.math.BigInteger;

/**
 * Amounts actually deposited, in the caller's token order, and the claim tokens minted.
 */
public record AddLiquidityResult(BigInteger amountA, BigInteger amountB, BigInteger liquidity) {
}
