package com.newsdigest.bot.dto;

import com.newsdigest.bot.entity.ItemState;

import java.time.LocalDateTime;

public record NewsItemDTO(
        Long id,
        String sourceId,
        String itemKey,
        String title,
        String url,
        ItemState state,
        Integer attempts,
        String lastError,
        LocalDateTime publishedAt,
        LocalDateTime fetchedAt,
        LocalDateTime postedAt
) {}
