// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.ledger;

import com.digitalasset.amm.domain.Address;
import com.digitalasset.amm.domain.AssetId;

import java.math.BigInteger;

/**
 * Balance and allowance ledger for one fungible asset kind (ERC20-like).
 *
 * The pool consumes this contract; it does not reimplement it. Transfers report failure by
 * returning {@code false}. Implementations may also throw, which the pool treats the same way.
 */
public interface AssetLedger {

    AssetId asset();

    BigInteger balanceOf(Address holder);

    BigInteger allowance(Address owner, Address spender);

    BigInteger totalSupply();

    boolean approve(Address owner, Address spender, BigInteger amount);

    /**
     * Move {@code amount} from {@code from} to {@code to}, authorised by {@code from} itself.
     */
    boolean transfer(Address from, Address to, BigInteger amount);

    /**
     * Move {@code amount} from {@code owner} to {@code to} on behalf of {@code spender},
     * consuming the allowance {@code owner} granted to {@code spender}.
     */
    boolean transferFrom(Address spender, Address owner, Address to, BigInteger amount);

    void mint(Address to, BigInteger amount);

    void burn(Address from, BigInteger amount);

    /**
     * Raise the allowance {@code owner} granted to {@code spender} by {@code amount}.
     */
    void increaseAllowance(Address owner, Address spender, BigInteger amount);

    /**
     * Move {@code amount} back from {@code to} to {@code from}, reversing an earlier
     * {@link #transfer} between the same holders. Needs no authorisation from {@code to};
     * only used to compensate a transfer of a pool operation that was later rejected.
     */
    boolean reverseTransfer(Address from, Address to, BigInteger amount);
}
