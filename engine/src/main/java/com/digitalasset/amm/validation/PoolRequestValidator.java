// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.validation;

import com.digitalasset.amm.common.DomainError;
import com.digitalasset.amm.common.Result;
import com.digitalasset.amm.common.errors.ExpiredError;
import com.digitalasset.amm.common.errors.InvalidAmountError;
import com.digitalasset.amm.common.errors.InvalidPairError;
import com.digitalasset.amm.common.errors.SlippageExceededError;
import com.digitalasset.amm.domain.AssetId;
import com.digitalasset.amm.domain.Pool;
import com.digitalasset.amm.util.AmmMath;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Precondition checks shared by all pool operations.
 *
 * Each check returns the rejection it found, or empty when the input passes. None of them
 * touches pool or ledger state.
 */
public class PoolRequestValidator {

    private final Clock clock;

    public PoolRequestValidator(final Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * The deadline is inclusive: a call made exactly at the deadline is accepted.
     */
    public Optional<DomainError> deadlineNotExpired(final Instant deadline) {
        if (deadline == null) {
            return Optional.of(new InvalidAmountError("deadline is required"));
        }
        Instant now = now();
        if (now.isAfter(deadline)) {
            return Optional.of(new ExpiredError("deadline " + deadline + " has passed (now: " + now + ")"));
        }
        return Optional.empty();
    }

    /**
     * Resolve a two-asset pair against the pool, accepting either order.
     */
    public Result<Pool.Side, DomainError> pair(final Pool pool, final AssetId first, final AssetId second) {
        if (first == null || second == null) {
            return Result.err(new InvalidPairError("both pair assets are required"));
        }
        if (first.equals(second)) {
            return Result.err(new InvalidPairError("pair assets must be different, both are: " + first));
        }
        return pool.orientation(first, second)
                .<Result<Pool.Side, DomainError>>map(Result::ok)
                .orElseGet(() -> Result.err(new InvalidPairError(
                        "pair " + first + "/" + second + " does not match pool " + pool.pairName())));
    }

    /**
     * A swap path must be exactly {@code [tokenIn, tokenOut]} over the pool's two assets.
     *
     * @return the side of the input asset
     */
    public Result<Pool.Side, DomainError> path(final Pool pool, final List<AssetId> path) {
        if (path == null || path.size() != 2) {
            return Result.err(new InvalidPairError(
                    "path must contain exactly two assets, got " + (path == null ? 0 : path.size())));
        }
        return pair(pool, path.get(0), path.get(1));
    }

    public Optional<DomainError> positive(final String name, final BigInteger amount) {
        if (amount == null) {
            return Optional.of(new InvalidAmountError(name + " is required"));
        }
        if (amount.signum() <= 0) {
            return Optional.of(new InvalidAmountError(name + " must be positive, got: " + amount));
        }
        return withinRange(name, amount);
    }

    public Optional<DomainError> nonNegative(final String name, final BigInteger amount) {
        if (amount == null) {
            return Optional.of(new InvalidAmountError(name + " is required"));
        }
        if (amount.signum() < 0) {
            return Optional.of(new InvalidAmountError(name + " cannot be negative, got: " + amount));
        }
        return withinRange(name, amount);
    }

    public Optional<DomainError> minNotAboveDesired(final String name, final BigInteger min, final BigInteger desired) {
        if (min.compareTo(desired) > 0) {
            return Optional.of(new InvalidAmountError(
                    name + " minimum " + min + " exceeds desired amount " + desired));
        }
        return Optional.empty();
    }

    public Optional<DomainError> minOutputMet(final String name, final BigInteger actual, final BigInteger min) {
        if (actual.compareTo(min) < 0) {
            return Optional.of(new SlippageExceededError(
                    name + " (" + actual + ") is less than minimum required (" + min + ")"));
        }
        return Optional.empty();
    }

    private Optional<DomainError> withinRange(final String name, final BigInteger amount) {
        if (!AmmMath.fitsUint256(amount)) {
            return Optional.of(new InvalidAmountError(name + " exceeds the 256-bit amount range"));
        }
        return Optional.empty();
    }
}
