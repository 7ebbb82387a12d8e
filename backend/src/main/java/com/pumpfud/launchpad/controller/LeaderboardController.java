// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.controller;

import com.pumpfud.launchpad.dto.TraderStatsResponse;
import com.pumpfud.launchpad.service.TraderStatsService;
import com.pumpfud.launchpad.validation.RequestValidator;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * LeaderboardController - Trader rankings and per-account statistics
 *
 * Rankings are computed from committed trades on every token.
 */
@RestController
@RequestMapping("/api/leaderboard")
public class LeaderboardController {
    private static final Logger logger = LoggerFactory.getLogger(LeaderboardController.class);
    private final TraderStatsService stats;
    private final RequestValidator validator;

    public LeaderboardController(TraderStatsService stats, RequestValidator validator) {
        this.stats = stats;
        this.validator = validator;
    }

    /**
     * GET /api/leaderboard/volume - Traders ranked by buy plus sell value
     */
    @GetMapping("/volume")
    @WithSpan
    public List<TraderStatsResponse> topVolume(@RequestParam(required = false) Integer limit) {
        return stats.getTopVolumeTraders(validator.pageSize(limit)).stream()
            .map(TraderStatsResponse::new)
            .toList();
    }

    /**
     * GET /api/leaderboard/referrers - Referrers ranked by distinct referred traders
     */
    @GetMapping("/referrers")
    @WithSpan
    public List<TraderStatsResponse> topReferrers(@RequestParam(required = false) Integer limit) {
        return stats.getTopReferrers(validator.pageSize(limit)).stream()
            .map(TraderStatsResponse::new)
            .toList();
    }

    /**
     * GET /api/leaderboard/roi - Traders ranked by realized return
     */
    @GetMapping("/roi")
    @WithSpan
    public List<TraderStatsResponse> topRoi(@RequestParam(required = false) Integer limit) {
        return stats.getTopRoiTraders(validator.pageSize(limit)).stream()
            .map(TraderStatsResponse::new)
            .toList();
    }

    @GetMapping("/traders")
    public List<String> traders(
        @RequestParam(required = false) Integer offset,
        @RequestParam(required = false) Integer limit
    ) {
        return stats.getTraders(validator.offset(offset), validator.pageSize(limit));
    }

    @GetMapping("/traders/count")
    public Map<String, Integer> traderCount() {
        return Map.of("count", stats.getTotalTraders());
    }

    @GetMapping("/stats/{account}")
    @WithSpan
    public TraderStatsResponse traderStats(@PathVariable("account") String account) {
        String key = validator.requireAccount("account", account);
        logger.debug("GET /api/leaderboard/stats/{}", key);
        return new TraderStatsResponse(stats.getStats(key));
    }

    @GetMapping("/referrals/{account}")
    public List<String> referrals(@PathVariable("account") String account) {
        return stats.getReferrals(validator.requireAccount("account", account));
    }
}
