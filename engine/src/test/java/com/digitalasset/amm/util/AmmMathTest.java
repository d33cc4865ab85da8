// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.util;

import com.digitalasset.amm.constants.PoolConstants;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AMM Math Tests")
class AmmMathTest {

    private static BigInteger big(long value) {
        return BigInteger.valueOf(value);
    }

    @Test
    @DisplayName("sqrt returns exact floor for small and perfect-square inputs")
    void testSqrtExactValues() {
        assertEquals(big(0), AmmMath.sqrt(big(0)));
        assertEquals(big(1), AmmMath.sqrt(big(1)));
        assertEquals(big(1), AmmMath.sqrt(big(2)));
        assertEquals(big(1), AmmMath.sqrt(big(3)));
        assertEquals(big(2), AmmMath.sqrt(big(4)));
        assertEquals(big(2), AmmMath.sqrt(big(8)));
        assertEquals(big(3), AmmMath.sqrt(big(9)));
        assertEquals(big(1000), AmmMath.sqrt(big(1_000_000)));
        assertEquals(big(2000), AmmMath.sqrt(big(4_000_000)));
        assertEquals(BigInteger.TEN.pow(18), AmmMath.sqrt(BigInteger.TEN.pow(36)));
    }

    @Test
    @DisplayName("sqrt is the floor root: z^2 <= y < (z+1)^2")
    void testSqrtFloorProperty() {
        for (long y = 0; y < 5000; y++) {
            BigInteger z = AmmMath.sqrt(big(y));
            assertTrue(z.multiply(z).compareTo(big(y)) <= 0, "z^2 <= y for y=" + y);
            BigInteger next = z.add(BigInteger.ONE);
            assertTrue(next.multiply(next).compareTo(big(y)) > 0, "(z+1)^2 > y for y=" + y);
        }
        BigInteger max = PoolConstants.MAX_UINT256;
        BigInteger root = AmmMath.sqrt(max);
        assertTrue(root.multiply(root).compareTo(max) <= 0);
        assertTrue(root.add(BigInteger.ONE).pow(2).compareTo(max) > 0);
    }

    @Test
    @DisplayName("sqrt rejects negative input")
    void testSqrtNegative() {
        assertThrows(IllegalArgumentException.class, () -> AmmMath.sqrt(big(-1)));
    }

    @Test
    @DisplayName("getAmountOut at 30 bps matches the 997/1000 formula")
    void testAmountOutMatches997Formula() {
        long[][] cases = {
            {1000, 100_000, 100_000},
            {100, 1000, 4000},
            {1, 1000, 4000},
            {123_456_789, 987_654_321_000L, 5_555_555_555L},
            {5_000_000, 7, 9_000_000_000L},
        };
        for (long[] c : cases) {
            BigInteger amountIn = big(c[0]);
            BigInteger reserveIn = big(c[1]);
            BigInteger reserveOut = big(c[2]);
            BigInteger withFee = amountIn.multiply(big(997));
            BigInteger expected = withFee.multiply(reserveOut)
                .divide(reserveIn.multiply(big(1000)).add(withFee));
            assertEquals(expected, AmmMath.getAmountOut(amountIn, reserveIn, reserveOut, 30),
                "amountIn=" + c[0] + " reserves=" + c[1] + "/" + c[2]);
        }
    }

    @Test
    @DisplayName("getAmountOut known values")
    void testAmountOutKnownValues() {
        assertEquals(big(987), AmmMath.getAmountOut(big(1000), big(100_000), big(100_000), 30));
        assertEquals(big(362), AmmMath.getAmountOut(big(100), big(1000), big(4000), 30));
        // Fee-less variant
        assertEquals(big(363), AmmMath.getAmountOut(big(100), big(1000), big(4000), 0));
    }

    @Test
    @DisplayName("getAmountOut rejects empty reserves")
    void testAmountOutEmptyReserves() {
        assertThrows(IllegalArgumentException.class,
            () -> AmmMath.getAmountOut(big(1), BigInteger.ZERO, big(10), 30));
    }

    @Test
    @DisplayName("getAmountIn is the smallest input that buys the requested output")
    void testAmountInInvertsAmountOut() {
        BigInteger reserveIn = big(1000);
        BigInteger reserveOut = big(4000);
        for (long out = 1; out < 3000; out += 37) {
            BigInteger amountIn = AmmMath.getAmountIn(big(out), reserveIn, reserveOut, 30);
            assertTrue(AmmMath.getAmountOut(amountIn, reserveIn, reserveOut, 30).compareTo(big(out)) >= 0,
                "amountIn " + amountIn + " must buy " + out);
        }
        assertEquals(big(100), AmmMath.getAmountIn(big(362), reserveIn, reserveOut, 30));
        assertThrows(IllegalArgumentException.class,
            () -> AmmMath.getAmountIn(reserveOut, reserveIn, reserveOut, 30));
    }

    @Test
    @DisplayName("quote keeps the reserve ratio")
    void testQuote() {
        assertEquals(big(400), AmmMath.quote(big(100), big(1000), big(4000)));
        assertEquals(big(25), AmmMath.quote(big(100), big(4000), big(1000)));
        assertThrows(IllegalArgumentException.class, () -> AmmMath.quote(big(1), BigInteger.ZERO, big(1)));
    }

    @Test
    @DisplayName("price is scaled by 10^18")
    void testPrice() {
        assertEquals(big(4).multiply(PoolConstants.PRICE_SCALE), AmmMath.price(big(1000), big(4000)));
        assertEquals(big(250_000_000_000_000_000L), AmmMath.price(big(4000), big(1000)));
    }

    @Test
    @DisplayName("bootstrap mint is sqrt of the product, later mints are proportional")
    void testLiquidityMinted() {
        assertEquals(big(2000), AmmMath.liquidityMinted(big(1000), big(4000), BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO));
        assertEquals(big(200), AmmMath.liquidityMinted(big(100), big(400), big(1000), big(4000), big(2000)));
        // Unbalanced deposit is credited at the smaller share
        assertEquals(big(100), AmmMath.liquidityMinted(big(100), big(200), big(1000), big(4000), big(2000)));
    }

    @Test
    @DisplayName("proportional share truncates")
    void testProportionalShare() {
        assertEquals(big(500), AmmMath.proportionalShare(big(1000), big(1000), big(2000)));
        assertEquals(big(0), AmmMath.proportionalShare(big(1), big(1), big(2)));
        assertThrows(IllegalArgumentException.class, () -> AmmMath.proportionalShare(big(1), big(1), BigInteger.ZERO));
    }

    @Test
    @DisplayName("Arithmetic above 2^256 - 1 is rejected")
    void testOverflow() {
        BigInteger max = PoolConstants.MAX_UINT256;
        assertEquals(max, AmmMath.add(max, BigInteger.ZERO));
        assertThrows(AmountOverflowException.class, () -> AmmMath.add(max, BigInteger.ONE));
        assertThrows(AmountOverflowException.class, () -> AmmMath.mul(max, big(2)));
        assertThrows(AmountOverflowException.class, () -> AmmMath.sub(big(1), big(2)));
        assertThrows(AmountOverflowException.class,
            () -> AmmMath.getAmountOut(max, big(1000), big(1000), 30));
        assertTrue(AmmMath.fitsUint256(max));
        assertFalse(AmmMath.fitsUint256(max.add(BigInteger.ONE)));
        assertFalse(AmmMath.fitsUint256(big(-1)));
    }
}
