// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.ledger;

import com.digitalasset.amm.domain.Address;
import com.digitalasset.amm.domain.AssetId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * In-process reference ledger with ERC20 transfer and allowance semantics.
 *
 * Used by the application context for the two pool assets and for the claim token.
 * Balances never go negative; a transfer that would overdraw returns {@code false}.
 */
public class InMemoryAssetLedger implements AssetLedger {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryAssetLedger.class);

    private final AssetId asset;
    private final Map<Address, BigInteger> balances = new HashMap<>();
    private final Map<Address, Map<Address, BigInteger>> allowances = new HashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;

    public InMemoryAssetLedger(final AssetId asset) {
        this.asset = Objects.requireNonNull(asset, "asset");
    }

    @Override
    public AssetId asset() {
        return asset;
    }

    @Override
    public synchronized BigInteger balanceOf(final Address holder) {
        return balances.getOrDefault(holder, BigInteger.ZERO);
    }

    @Override
    public synchronized BigInteger allowance(final Address owner, final Address spender) {
        return allowances.getOrDefault(owner, Map.of()).getOrDefault(spender, BigInteger.ZERO);
    }

    @Override
    public synchronized BigInteger totalSupply() {
        return totalSupply;
    }

    @Override
    public synchronized boolean approve(final Address owner, final Address spender, final BigInteger amount) {
        if (amount.signum() < 0) {
            return false;
        }
        allowances.computeIfAbsent(owner, k -> new HashMap<>()).put(spender, amount);
        LOG.debug("[{}] approve owner={} spender={} amount={}", asset, owner, spender, amount);
        return true;
    }

    @Override
    public synchronized boolean transfer(final Address from, final Address to, final BigInteger amount) {
        if (amount.signum() < 0 || balanceOf(from).compareTo(amount) < 0) {
            LOG.debug("[{}] transfer rejected from={} to={} amount={} balance={}", asset, from, to, amount, balanceOf(from));
            return false;
        }
        move(from, to, amount);
        return true;
    }

    @Override
    public synchronized boolean transferFrom(final Address spender, final Address owner, final Address to, final BigInteger amount) {
        BigInteger allowed = allowance(owner, spender);
        if (amount.signum() < 0 || allowed.compareTo(amount) < 0 || balanceOf(owner).compareTo(amount) < 0) {
            LOG.debug("[{}] transferFrom rejected spender={} owner={} amount={} allowance={} balance={}",
                    asset, spender, owner, amount, allowed, balanceOf(owner));
            return false;
        }
        allowances.computeIfAbsent(owner, k -> new HashMap<>()).put(spender, allowed.subtract(amount));
        move(owner, to, amount);
        return true;
    }

    @Override
    public synchronized void mint(final Address to, final BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("mint amount cannot be negative: " + amount);
        }
        balances.merge(to, amount, BigInteger::add);
        totalSupply = totalSupply.add(amount);
        LOG.debug("[{}] mint to={} amount={} supply={}", asset, to, amount, totalSupply);
    }

    @Override
    public synchronized void burn(final Address from, final BigInteger amount) {
        BigInteger balance = balanceOf(from);
        if (amount.signum() < 0 || balance.compareTo(amount) < 0) {
            throw new IllegalStateException("cannot burn " + amount + " " + asset + " from " + from + ", balance " + balance);
        }
        balances.put(from, balance.subtract(amount));
        totalSupply = totalSupply.subtract(amount);
        LOG.debug("[{}] burn from={} amount={} supply={}", asset, from, amount, totalSupply);
    }

    @Override
    public synchronized void increaseAllowance(final Address owner, final Address spender, final BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("allowance increase cannot be negative: " + amount);
        }
        allowances.computeIfAbsent(owner, k -> new HashMap<>()).merge(spender, amount, BigInteger::add);
        LOG.debug("[{}] increaseAllowance owner={} spender={} amount={}", asset, owner, spender, amount);
    }

    @Override
    public synchronized boolean reverseTransfer(final Address from, final Address to, final BigInteger amount) {
        if (amount.signum() < 0 || balanceOf(to).compareTo(amount) < 0) {
            LOG.debug("[{}] reverseTransfer rejected from={} to={} amount={} balance={}", asset, from, to, amount, balanceOf(to));
            return false;
        }
        move(to, from, amount);
        return true;
    }

    private void move(final Address from, final Address to, final BigInteger amount) {
        balances.put(from, balanceOf(from).subtract(amount));
        balances.merge(to, amount, BigInteger::add);
        LOG.debug("[{}] moved {} from={} to={}", asset, amount, from, to);
    }
}
