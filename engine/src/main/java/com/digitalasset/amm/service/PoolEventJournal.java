// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.amm.service;

import com.digitalasset.amm.events.PoolEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded in-memory history of pool events, newest first.
 */
public class PoolEventJournal {

    private static final Logger LOG = LoggerFactory.getLogger(PoolEventJournal.class);

    private final int maxRecords;
    private final Deque<PoolEvent> history = new ArrayDeque<>();

    public PoolEventJournal(final int maxRecords) {
        if (maxRecords <= 0) {
            throw new IllegalArgumentException("maxRecords must be positive, got " + maxRecords);
        }
        this.maxRecords = maxRecords;
    }

    @EventListener
    public synchronized void onPoolEvent(final PoolEvent event) {
        history.addFirst(event);
        while (history.size() > maxRecords) {
            history.removeLast();
        }
        LOG.debug("Journaled {} by {} ({} entries)", event.operation(), event.user(), history.size());
    }

    public synchronized List<PoolEvent> recent(final int limit) {
        int size = Math.max(0, Math.min(limit, history.size()));
        List<PoolEvent> list = new ArrayList<>(size);
        for (PoolEvent event : history) {
            if (list.size() >= size) {
                break;
            }
            list.add(event);
        }
        return list;
    }

    public synchronized int size() {
        return history.size();
    }

    public int capacity() {
        return maxRecords;
    }
}
