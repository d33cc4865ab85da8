// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.events;

import com.digitalasset.amm.domain.Address;

import java.time.Instant;

/**
 * Observable record of one successful pool operation. Exactly one is published per success.
 */
public sealed interface PoolEvent permits LiquidityAddedEvent, LiquidityRemovedEvent, SwapExecutedEvent {

    Address user();

    Instant at();

    /**
     * Short operation name, used as a metrics tag and in the journal.
     */
    String operation();
}
