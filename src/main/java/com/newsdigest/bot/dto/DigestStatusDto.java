package com.newsdigest.bot.dto;

import com.newsdigest.bot.entity.ItemState;
import com.newsdigest.bot.service.CyclePhase;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

public record DigestStatusDto(
        CyclePhase phase,
        boolean paused,
        boolean triggerQueued,
        boolean scheduleEnabled,
        long intervalMs,
        LocalDateTime nextScheduledRun,
        Long runningCycleId,
        DigestCycleDTO lastCycle,
        Map<ItemState, Long> itemCounts,
        List<NewsItemDTO> recentFailures
) {
    public DigestStatusDto {
        itemCounts = itemCounts == null ? Map.of() : Map.copyOf(itemCounts);
        recentFailures = recentFailures == null ? List.of() : List.copyOf(recentFailures);
    }
}
