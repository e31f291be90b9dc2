package com.newsdigest.bot.mapper;

import com.newsdigest.bot.dto.DigestCycleDTO;
import com.newsdigest.bot.dto.NewsItemDTO;
import com.newsdigest.bot.dto.PageResponse;
import com.newsdigest.bot.entity.DigestCycle;
import com.newsdigest.bot.entity.NewsItem;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Component;

import java.util.function.Function;

@Component
public class DigestMapper {

    public DigestCycleDTO toCycleDto(DigestCycle cycle) {
        return new DigestCycleDTO(
                cycle.getId(),
                cycle.getTrigger(),
                cycle.getStartedAt(),
                cycle.getFinishedAt(),
                cycle.getOutcome(),
                cycle.getItemsConsidered(),
                cycle.getItemsPosted(),
                cycle.getSourcesFailed(),
                cycle.getBatchesPublished(),
                cycle.getBatchesFailed(),
                cycle.getErrorSummary()
        );
    }

    public NewsItemDTO toItemDto(NewsItem item) {
        return new NewsItemDTO(
                item.getId(),
                item.getSourceId(),
                item.getItemKey(),
                item.getTitle(),
                item.getUrl(),
                item.getState(),
                item.getAttempts(),
                item.getLastError(),
                item.getPublishedAt(),
                item.getFetchedAt(),
                item.getPostedAt()
        );
    }

    public <E, D> PageResponse<D> toPage(Page<E> page, Function<E, D> converter) {
        return new PageResponse<>(
                page.getContent().stream().map(converter).toList(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages()
        );
    }
}
