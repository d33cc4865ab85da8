// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Compensating actions for the ledger writes one pool operation has completed so far.
 *
 * Rolling back runs them newest first and touches only the entries the operation itself
 * changed, so writes other callers made to the same ledgers in the meantime are kept.
 */
public class LedgerUndoLog {

    private static final Logger LOG = LoggerFactory.getLogger(LedgerUndoLog.class);

    private final String owner;
    private final Deque<Entry> entries = new ArrayDeque<>();

    public LedgerUndoLog(final String owner) {
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    public void record(final String description, final Runnable undo) {
        entries.push(new Entry(Objects.requireNonNull(description, "description"), Objects.requireNonNull(undo, "undo")));
    }

    public int size() {
        return entries.size();
    }

    /**
     * Undo every recorded write, newest first.
     *
     * @return {@code true} if every compensation succeeded
     */
    public boolean rollback() {
        boolean clean = true;
        while (!entries.isEmpty()) {
            Entry entry = entries.pop();
            try {
                entry.undo().run();
                LOG.debug("[{}] undid '{}'", owner, entry.description());
            } catch (RuntimeException e) {
                clean = false;
                LOG.error("[{}] could not undo '{}', ledgers need manual reconciliation", owner, entry.description(), e);
            }
        }
        return clean;
    }

    private record Entry(String description, Runnable undo) {}
}
