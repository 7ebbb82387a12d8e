// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.venue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Named lookup over every {@link LiquidityVenue} bean.
 */
@Component
public class LiquidityVenueRegistry {

    private static final Logger logger = LoggerFactory.getLogger(LiquidityVenueRegistry.class);

    private final Map<String, LiquidityVenue> venues = new TreeMap<>();

    public LiquidityVenueRegistry(final List<LiquidityVenue> available) {
        for (LiquidityVenue venue : available) {
            if (venues.putIfAbsent(venue.name(), venue) != null) {
                throw new IllegalStateException("Duplicate liquidity venue name: " + venue.name());
            }
        }
        logger.info("[Venues] registered={}", venues.keySet());
    }

    public Optional<LiquidityVenue> find(final String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(venues.get(name));
    }

    public boolean contains(final String name) {
        return find(name).isPresent();
    }

    public List<String> names() {
        return List.copyOf(venues.keySet());
    }
}
