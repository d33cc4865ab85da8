// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.service;

import com.digitalasset.amm.domain.Address;
import com.digitalasset.amm.domain.AssetId;
import com.digitalasset.amm.events.PoolEvent;
import com.digitalasset.amm.events.SwapExecutedEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Pool event journal")
class PoolEventJournalTest {

    private static SwapExecutedEvent swap(long amountIn) {
        return new SwapExecutedEvent(Address.of("bob"), AssetId.of("ETH"), AssetId.of("USDC"),
            BigInteger.valueOf(amountIn), BigInteger.ONE, Instant.EPOCH.plusSeconds(amountIn));
    }

    @Test
    @DisplayName("returns newest events first")
    void newestFirst() {
        PoolEventJournal journal = new PoolEventJournal(10);
        journal.onPoolEvent(swap(1));
        journal.onPoolEvent(swap(2));
        journal.onPoolEvent(swap(3));

        List<PoolEvent> recent = journal.recent(2);

        assertThat(recent).containsExactly(swap(3), swap(2));
    }

    @Test
    @DisplayName("drops the oldest entries beyond capacity")
    void bounded() {
        PoolEventJournal journal = new PoolEventJournal(3);
        for (long i = 1; i <= 5; i++) {
            journal.onPoolEvent(swap(i));
        }

        assertThat(journal.size()).isEqualTo(3);
        assertThat(journal.recent(100)).containsExactly(swap(5), swap(4), swap(3));
    }

    @Test
    @DisplayName("non-positive limits return nothing")
    void emptyLimit() {
        PoolEventJournal journal = new PoolEventJournal(3);
        journal.onPoolEvent(swap(1));

        assertThat(journal.recent(0)).isEmpty();
        assertThat(journal.recent(-5)).isEmpty();
    }

    @Test
    @DisplayName("capacity must be positive")
    void invalidCapacity() {
        assertThatThrownBy(() -> new PoolEventJournal(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
