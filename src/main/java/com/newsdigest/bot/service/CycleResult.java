package com.newsdigest.bot.service;

import com.newsdigest.bot.entity.CycleOutcome;

public record CycleResult(
        Long cycleId,
        CycleOutcome outcome,
        int itemsConsidered,
        int itemsPosted,
        int sourcesFailed,
        int batchesPublished,
        int batchesFailed
) {
    static CycleResult of(Long cycleId, CycleStats stats) {
        return new CycleResult(cycleId, stats.outcome(), stats.getItemsConsidered(), stats.getItemsPosted(),
                stats.getSourcesFailed(), stats.getBatchesPublished(), stats.getBatchesFailed());
    }
}
