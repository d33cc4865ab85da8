// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.util;

import com.digitalasset.amm.constants.PoolConstants;

import java.math.BigInteger;

/**
 * Integer AMM math shared by the pool engine.
 *
 * Every division truncates toward zero, which rounds in the pool's favour. Every multiplication
 * and addition is range-checked against {@link PoolConstants#MAX_UINT256}.
 */
public final class AmmMath {

    private static final BigInteger TWO = BigInteger.TWO;
    private static final BigInteger THREE = BigInteger.valueOf(3);

    private AmmMath() {
        // Utility class
    }

    /**
     * Floor of the square root, by Babylonian iteration.
     *
     * @param y non-negative radicand
     * @return largest {@code z} with {@code z * z <= y}
     */
    public static BigInteger sqrt(final BigInteger y) {
        if (y.signum() < 0) {
            throw new IllegalArgumentException("sqrt of negative value: " + y);
        }
        BigInteger z = BigInteger.ZERO;
        if (y.compareTo(THREE) > 0) {
            z = y;
            BigInteger x = y.divide(TWO).add(BigInteger.ONE);
            while (x.compareTo(z) < 0) {
                z = x;
                x = y.divide(x).add(x).divide(TWO);
            }
        } else if (y.signum() != 0) {
            z = BigInteger.ONE;
        }
        return z;
    }

    public static BigInteger min(final BigInteger x, final BigInteger y) {
        return x.compareTo(y) <= 0 ? x : y;
    }

    /**
     * Amount of the other asset that keeps the reserve ratio: {@code amountA * reserveB / reserveA}.
     */
    public static BigInteger quote(final BigInteger amountA, final BigInteger reserveA, final BigInteger reserveB) {
        if (reserveA.signum() <= 0 || reserveB.signum() <= 0) {
            throw new IllegalArgumentException("quote needs non-zero reserves, got " + reserveA + "/" + reserveB);
        }
        return mul(amountA, reserveB).divide(reserveA);
    }

    /**
     * Output of an exact-input swap, fee taken from the input side.
     * <pre>
     * amountInWithFee = amountIn * (10000 - feeBps)
     * amountOut       = amountInWithFee * reserveOut / (reserveIn * 10000 + amountInWithFee)
     * </pre>
     * At 30 bps this is the 997/1000 formula; at 0 bps it is the fee-less constant product.
     */
    public static BigInteger getAmountOut(final BigInteger amountIn,
                                          final BigInteger reserveIn,
                                          final BigInteger reserveOut,
                                          final int feeBps) {
        if (reserveIn.signum() <= 0 || reserveOut.signum() <= 0) {
            throw new IllegalArgumentException("swap needs non-zero reserves, got " + reserveIn + "/" + reserveOut);
        }
        BigInteger amountInWithFee = mul(amountIn, feeMultiplier(feeBps));
        BigInteger numerator = mul(amountInWithFee, reserveOut);
        BigInteger denominator = add(mul(reserveIn, PoolConstants.BPS_DENOMINATOR), amountInWithFee);
        return numerator.divide(denominator);
    }

    /**
     * Smallest input that yields at least {@code amountOut}; rounds up by one unit.
     */
    public static BigInteger getAmountIn(final BigInteger amountOut,
                                         final BigInteger reserveIn,
                                         final BigInteger reserveOut,
                                         final int feeBps) {
        if (reserveIn.signum() <= 0 || reserveOut.compareTo(amountOut) <= 0) {
            throw new IllegalArgumentException("output " + amountOut + " not available from reserves " + reserveIn + "/" + reserveOut);
        }
        BigInteger numerator = mul(mul(reserveIn, amountOut), PoolConstants.BPS_DENOMINATOR);
        BigInteger denominator = mul(reserveOut.subtract(amountOut), feeMultiplier(feeBps));
        return add(numerator.divide(denominator), BigInteger.ONE);
    }

    /**
     * Fixed-point price of one unit of the base asset: {@code reserveQuote * 10^18 / reserveBase}.
     */
    public static BigInteger price(final BigInteger reserveBase, final BigInteger reserveQuote) {
        if (reserveBase.signum() <= 0) {
            throw new IllegalArgumentException("price needs a non-zero base reserve");
        }
        return mul(reserveQuote, PoolConstants.PRICE_SCALE).divide(reserveBase);
    }

    /**
     * Claim tokens minted for a deposit.
     * Bootstrap: {@code sqrt(amountA * amountB)}. Otherwise the smaller of the two proportional shares.
     */
    public static BigInteger liquidityMinted(final BigInteger amountA,
                                             final BigInteger amountB,
                                             final BigInteger reserveA,
                                             final BigInteger reserveB,
                                             final BigInteger totalSupply) {
        if (totalSupply.signum() == 0 || (reserveA.signum() == 0 && reserveB.signum() == 0)) {
            return sqrt(mul(amountA, amountB));
        }
        return min(
                mul(amountA, totalSupply).divide(reserveA),
                mul(amountB, totalSupply).divide(reserveB));
    }

    /**
     * Share of a reserve redeemed by burning {@code liquidity}: {@code liquidity * balance / totalSupply}.
     */
    public static BigInteger proportionalShare(final BigInteger liquidity, final BigInteger balance, final BigInteger totalSupply) {
        if (totalSupply.signum() <= 0) {
            throw new IllegalArgumentException("no claim supply outstanding");
        }
        return mul(liquidity, balance).divide(totalSupply);
    }

    public static BigInteger mul(final BigInteger x, final BigInteger y) {
        return checked(x.multiply(y), "mul");
    }

    public static BigInteger add(final BigInteger x, final BigInteger y) {
        return checked(x.add(y), "add");
    }

    /**
     * Subtraction that refuses to go below zero.
     */
    public static BigInteger sub(final BigInteger x, final BigInteger y) {
        BigInteger result = x.subtract(y);
        if (result.signum() < 0) {
            throw new AmountOverflowException("sub underflow: " + x + " - " + y);
        }
        return result;
    }

    public static boolean fitsUint256(final BigInteger value) {
        return value.signum() >= 0 && value.compareTo(PoolConstants.MAX_UINT256) <= 0;
    }

    private static BigInteger feeMultiplier(final int feeBps) {
        if (feeBps < 0 || feeBps >= PoolConstants.BPS_100_PERCENT) {
            throw new IllegalArgumentException("fee must be within [0, 10000) bps, got " + feeBps);
        }
        return BigInteger.valueOf(PoolConstants.BPS_100_PERCENT - feeBps);
    }

    private static BigInteger checked(final BigInteger value, final String op) {
        if (value.compareTo(PoolConstants.MAX_UINT256) > 0) {
            throw new AmountOverflowException(op + " overflow: result exceeds 2^256 - 1");
        }
        return value;
    }
}
