package com.newsdigest.bot.service;

import com.newsdigest.bot.entity.NewsItem;

import java.util.List;

/**
 * 한 번의 요약 + 발행 단위
 */
public record PostBatch(
        String batchId,
        List<NewsItem> items,
        int chars
) {
    public PostBatch {
        items = List.copyOf(items);
    }

    public int size() {
        return items.size();
    }
}
