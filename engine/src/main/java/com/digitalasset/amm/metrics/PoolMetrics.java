// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.metrics;

import com.digitalasset.amm.domain.PoolSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Micrometer metrics for pool operations.
 *
 * Provides:
 * - executed/rejected counters, tagged by operation (and rejection code)
 * - execution timer per operation
 * - reserve, claim-supply and k gauges, registered once and updated via AtomicReference
 *
 * Tags are limited to the pair, the operation name and the error code, so cardinality is bounded.
 */
public class PoolMetrics {

    private final MeterRegistry meterRegistry;
    private final String pair;
    private final Counter swapsExecuted;
    private final DistributionSummary swapInputAmounts;
    private final DistributionSummary swapOutputAmounts;

    private final Map<String, AtomicReference<BigInteger>> gauges = new ConcurrentHashMap<>();

    public PoolMetrics(final MeterRegistry meterRegistry, final String pair) {
        this.meterRegistry = meterRegistry;
        this.pair = pair;

        this.swapsExecuted = Counter.builder("amm.swap.executed.total")
            .description("Total number of swaps executed successfully")
            .tag("pair", pair)
            .register(meterRegistry);

        this.swapInputAmounts = DistributionSummary.builder("amm.swap.input.amount")
            .description("Distribution of swap input amounts")
            .baseUnit("units")
            .tag("pair", pair)
            .register(meterRegistry);

        this.swapOutputAmounts = DistributionSummary.builder("amm.swap.output.amount")
            .description("Distribution of swap output amounts")
            .baseUnit("units")
            .tag("pair", pair)
            .register(meterRegistry);
    }

    /**
     * Record a successful operation and how long it held the pool.
     */
    public void recordExecuted(String operation, long elapsedNanos) {
        meterRegistry.counter("amm.pool.operation.executed",
            "pair", pair,
            "operation", operation).increment();

        Timer.builder("amm.pool.operation.time")
            .description("Time spent inside the pool guard")
            .tag("pair", pair)
            .tag("operation", operation)
            .register(meterRegistry)
            .record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Record a rejected operation. The code is the DomainError code, a closed set.
     */
    public void recordRejected(String operation, String code) {
        meterRegistry.counter("amm.pool.operation.rejected",
            "pair", pair,
            "operation", operation,
            "reason", code).increment();
    }

    /**
     * Record an event whose listeners threw after the operation had committed.
     */
    public void recordEventDeliveryFailed(String eventType) {
        meterRegistry.counter("amm.pool.event.delivery.failed",
            "pair", pair,
            "event", eventType).increment();
    }

    public void recordSwap(BigInteger amountIn, BigInteger amountOut) {
        swapsExecuted.increment();
        swapInputAmounts.record(amountIn.doubleValue());
        swapOutputAmounts.record(amountOut.doubleValue());
    }

    /**
     * Update pool liquidity gauges.
     */
    public void recordPoolLiquidity(PoolSnapshot snapshot) {
        gauge("amm.pool.reserve.amount", snapshot.assetA().value(), "Pool reserve amount").set(snapshot.reserveA());
        gauge("amm.pool.reserve.amount", snapshot.assetB().value(), "Pool reserve amount").set(snapshot.reserveB());
        gauge("amm.pool.claim.supply", null, "Outstanding claim tokens").set(snapshot.totalClaimSupply());
        gauge("amm.pool.k_invariant", null, "Constant product k = reserveA * reserveB").set(snapshot.k());
    }

    private AtomicReference<BigInteger> gauge(String name, String token, String description) {
        String key = token == null ? name : name + ":" + token;
        return gauges.computeIfAbsent(key, k -> {
            AtomicReference<BigInteger> ref = new AtomicReference<>(BigInteger.ZERO);
            Gauge.Builder<AtomicReference<BigInteger>> builder =
                Gauge.builder(name, ref, r -> r.get().doubleValue())
                    .tag("pair", pair)
                    .description(description);
            if (token != null) {
                builder.tag("token", token);
            }
            builder.register(meterRegistry);
            return ref;
        });
    }
}
