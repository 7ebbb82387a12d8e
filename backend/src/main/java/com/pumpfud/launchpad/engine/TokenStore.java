// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.engine;

import com.pumpfud.launchpad.model.TokenRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * In-memory token table keyed by id.
 *
 * Holds committed snapshots only. A stored record is replaced as a whole on commit and is never
 * modified afterwards.
 */
@Component
public class TokenStore {

    private final Map<Long, TokenRecord> tokens = new ConcurrentHashMap<>();

    public Optional<TokenRecord> find(final long tokenId) {
        return Optional.ofNullable(tokens.get(tokenId));
    }

    public int size() {
        return tokens.size();
    }

    /**
     * Id the next created token receives. Ids are 1-based and dense because only committed
     * creations are stored and creations are serialized.
     */
    long nextId() {
        return tokens.size() + 1L;
    }

    void put(final TokenRecord record) {
        tokens.put(record.getId(), record);
    }

    /**
     * Snapshots matching the filter, ordered by id.
     */
    public List<TokenRecord> select(final Predicate<TokenRecord> filter) {
        return tokens.values().stream()
                .filter(filter)
                .sorted(Comparator.comparingLong(TokenRecord::getId))
                .collect(Collectors.toCollection(ArrayList::new));
    }
}
