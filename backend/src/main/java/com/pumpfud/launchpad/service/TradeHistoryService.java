// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.service;

import com.pumpfud.launchpad.constants.LaunchpadConstants;
import com.pumpfud.launchpad.model.TradeReceipt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded per-token feed of committed trades, newest first.
 */
@Service
public class TradeHistoryService {

    private static final Logger LOG = LoggerFactory.getLogger(TradeHistoryService.class);

    private final Map<Long, Deque<TradeHistoryEntry>> feeds = new ConcurrentHashMap<>();
    private final int maxRecords;

    public TradeHistoryService() {
        this(LaunchpadConstants.MAX_TRADE_HISTORY);
    }

    TradeHistoryService(int maxRecords) {
        this.maxRecords = maxRecords;
    }

    public TradeHistoryEntry record(TradeReceipt receipt, Instant executedAt) {
        TradeHistoryEntry entry = new TradeHistoryEntry();
        entry.id = UUID.randomUUID().toString();
        entry.tokenId = receipt.tokenId();
        entry.side = receipt.side().name();
        entry.trader = receipt.trader();
        entry.baseAmount = receipt.baseAmount().toString();
        entry.tokenAmount = receipt.tokenAmount().toString();
        entry.fee = receipt.fee().toString();
        entry.priceAfter = receipt.priceAfter().toString();
        entry.graduated = receipt.graduated();
        entry.executedAt = executedAt.toString();

        Deque<TradeHistoryEntry> feed = feeds.computeIfAbsent(receipt.tokenId(), id -> new ArrayDeque<>());
        synchronized (feed) {
            feed.addFirst(entry);
            while (feed.size() > maxRecords) {
                feed.removeLast();
            }
        }
        LOG.debug("Trade recorded token={} side={} trader={}", entry.tokenId, entry.side, entry.trader);
        return entry;
    }

    public List<TradeHistoryEntry> getRecent(long tokenId, int limit) {
        Deque<TradeHistoryEntry> feed = feeds.get(tokenId);
        if (feed == null || limit <= 0) {
            return List.of();
        }
        synchronized (feed) {
            List<TradeHistoryEntry> list = new ArrayList<>(Math.min(limit, feed.size()));
            for (TradeHistoryEntry entry : feed) {
                if (list.size() >= limit) break;
                list.add(entry);
            }
            return list;
        }
    }

    public static class TradeHistoryEntry {
        public String id;
        public long tokenId;
        public String side;
        public String trader;
        public String baseAmount;
        public String tokenAmount;
        public String fee;
        public String priceAfter;
        public boolean graduated;
        public String executedAt;
    }
}
