package com.newsdigest.bot.dto;

import com.newsdigest.bot.entity.CycleOutcome;
import com.newsdigest.bot.entity.CycleTrigger;

import java.time.LocalDateTime;

public record DigestCycleDTO(
        Long id,
        CycleTrigger trigger,
        LocalDateTime startedAt,
        LocalDateTime finishedAt,
        CycleOutcome outcome,
        Integer itemsConsidered,
        Integer itemsPosted,
        Integer sourcesFailed,
        Integer batchesPublished,
        Integer batchesFailed,
        String errorSummary
) {}
