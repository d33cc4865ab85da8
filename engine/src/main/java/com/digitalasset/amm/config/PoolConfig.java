// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.config;

import com.digitalasset.amm.domain.Address;
import com.digitalasset.amm.domain.AssetId;
import com.digitalasset.amm.domain.Pool;
import com.digitalasset.amm.ledger.InMemoryAssetLedger;
import com.digitalasset.amm.ledger.PoolLedgers;
import com.digitalasset.amm.metrics.PoolMetrics;
import com.digitalasset.amm.service.PairPoolEngine;
import com.digitalasset.amm.service.PoolEventJournal;
import com.digitalasset.amm.validation.PoolRequestValidator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires one pool, its ledgers and the engine from {@link PoolProperties}.
 */
@Configuration
@EnableConfigurationProperties(PoolProperties.class)
public class PoolConfig {

    private static final Logger LOG = LoggerFactory.getLogger(PoolConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Fallback registry when no metrics export is configured.
     */
    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public Pool pool(PoolProperties properties) {
        return new Pool(
                AssetId.of(properties.getAssetA()),
                AssetId.of(properties.getAssetB()),
                Address.of(properties.getAddress()));
    }

    /**
     * Reference ledgers for both assets and the claim token. The claim token is named
     * {@code LP-<assetA>-<assetB>}.
     */
    @Bean
    public PoolLedgers poolLedgers(Pool pool) {
        AssetId claimAsset = AssetId.of("LP-" + pool.pairName());
        LOG.info("Creating in-memory ledgers for {}, {} and {}", pool.assetA(), pool.assetB(), claimAsset);
        return new PoolLedgers(
                new InMemoryAssetLedger(pool.assetA()),
                new InMemoryAssetLedger(pool.assetB()),
                new InMemoryAssetLedger(claimAsset));
    }

    @Bean
    public PoolRequestValidator poolRequestValidator(Clock clock) {
        return new PoolRequestValidator(clock);
    }

    @Bean
    public PoolMetrics poolMetrics(MeterRegistry meterRegistry, Pool pool) {
        return new PoolMetrics(meterRegistry, pool.pairName());
    }

    @Bean
    public PairPoolEngine pairPoolEngine(
            Pool pool,
            PoolLedgers poolLedgers,
            PoolProperties properties,
            PoolRequestValidator validator,
            ApplicationEventPublisher eventPublisher,
            PoolMetrics poolMetrics
    ) {
        return new PairPoolEngine(pool, poolLedgers, properties.getFeeBps(), validator, eventPublisher, poolMetrics);
    }

    @Bean
    public PoolEventJournal poolEventJournal(PoolProperties properties) {
        return new PoolEventJournal(properties.getHistorySize());
    }
}
