// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.config;

import com.digitalasset.amm.domain.Pool;
import com.digitalasset.amm.domain.PoolSnapshot;
import com.digitalasset.amm.ledger.AssetLedger;
import com.digitalasset.amm.ledger.PoolLedgers;
import com.digitalasset.amm.service.PairPoolEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Startup check of the configured pool.
 *
 * Logs the pool configuration and warns when recorded reserves differ from what the ledgers
 * hold for the pool address. Drift is not fatal; {@link PairPoolEngine#sync()} resolves it.
 */
@Component
public class StartupValidation {

    private static final Logger logger = LoggerFactory.getLogger(StartupValidation.class);

    private final PairPoolEngine engine;
    private final PoolLedgers ledgers;

    public StartupValidation(PairPoolEngine engine, PoolLedgers ledgers) {
        this.engine = engine;
        this.ledgers = ledgers;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validatePool() {
        logger.info("Pool {}-{} at {} (fee {} bps, claim token {})",
                engine.assetA(), engine.assetB(), engine.poolAddress(), engine.feeBps(), ledgers.claimLedger().asset());
        checkReserves();
    }

    /**
     * @return true if both reserves match the pool's ledger balances
     */
    boolean checkReserves() {
        PoolSnapshot snapshot = engine.getReserves();
        boolean consistent = true;
        for (Pool.Side side : Pool.Side.values()) {
            AssetLedger ledger = ledgers.ledger(side);
            BigInteger reserve = snapshot.reserveOf(ledger.asset());
            BigInteger balance = ledger.balanceOf(engine.poolAddress());
            if (!reserve.equals(balance)) {
                logger.warn("Reserve {} is {} but ledger holds {}", ledger.asset(), reserve, balance);
                consistent = false;
            }
        }
        if (consistent) {
            logger.info("Reserves {}/{} match ledger balances", snapshot.reserveA(), snapshot.reserveB());
        }
        return consistent;
    }
}
