// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.dto;

import java.math.BigInteger;

public record RemoveLiquidityResult(BigInteger amountA, BigInteger amountB, BigInteger liquidity) {
}
