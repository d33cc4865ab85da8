// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.domain;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable state of the single token-pair pool.
 *
 * Only {@code PairPoolEngine} writes the reserves, and only while it holds the pool guard.
 * The claim supply is not stored here: the claim-token ledger is its single source.
 */
public final class Pool {

    private final AssetId assetA;
    private final AssetId assetB;
    private final Address address;
    private BigInteger reserveA = BigInteger.ZERO;
    private BigInteger reserveB = BigInteger.ZERO;

    public Pool(final AssetId assetA, final AssetId assetB, final Address address) {
        this.assetA = Objects.requireNonNull(assetA, "assetA");
        this.assetB = Objects.requireNonNull(assetB, "assetB");
        this.address = Objects.requireNonNull(address, "address");
        if (assetA.equals(assetB)) {
            throw new IllegalArgumentException("pool assets must differ, both are " + assetA);
        }
    }

    public AssetId assetA() {
        return assetA;
    }

    public AssetId assetB() {
        return assetB;
    }

    public Address address() {
        return address;
    }

    public BigInteger reserveA() {
        return reserveA;
    }

    public BigInteger reserveB() {
        return reserveB;
    }

    /**
     * Resolve a caller-supplied pair against the pool.
     *
     * @return {@link Side#A} when {@code first} is assetA and {@code second} is assetB,
     *         {@link Side#B} for the reversed order, empty when the pair does not match
     */
    public Optional<Side> orientation(final AssetId first, final AssetId second) {
        if (assetA.equals(first) && assetB.equals(second)) {
            return Optional.of(Side.A);
        }
        if (assetB.equals(first) && assetA.equals(second)) {
            return Optional.of(Side.B);
        }
        return Optional.empty();
    }

    public BigInteger reserve(final Side side) {
        return side == Side.A ? reserveA : reserveB;
    }

    public AssetId asset(final Side side) {
        return side == Side.A ? assetA : assetB;
    }

    public void updateReserves(final BigInteger newReserveA, final BigInteger newReserveB) {
        if (newReserveA.signum() < 0 || newReserveB.signum() < 0) {
            throw new IllegalStateException("reserves cannot be negative: " + newReserveA + "/" + newReserveB);
        }
        this.reserveA = newReserveA;
        this.reserveB = newReserveB;
    }

    public PoolSnapshot snapshot(final BigInteger totalClaimSupply) {
        return new PoolSnapshot(assetA, assetB, reserveA, reserveB, totalClaimSupply);
    }

    public String pairName() {
        return assetA + "-" + assetB;
    }

    public enum Side {
        A,
        B;

        public Side other() {
            return this == A ? B : A;
        }
    }
}
