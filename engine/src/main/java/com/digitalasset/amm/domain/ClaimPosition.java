// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.domain;

import java.math.BigInteger;

/**
 * A holder's claim-token balance and what it would redeem at current reserves.
 *
 * @param shareBps share of the total claim supply in basis points, truncated
 */
public record ClaimPosition(
        Address owner,
        BigInteger liquidity,
        BigInteger totalClaimSupply,
        long shareBps,
        BigInteger redeemableA,
        BigInteger redeemableB
) {
}
