package com.newsdigest.bot.service;

import com.newsdigest.bot.entity.NewsItem;
import com.newsdigest.bot.service.source.RawItem;
import com.newsdigest.bot.util.ItemKeys;
import com.newsdigest.bot.util.Texts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 수집 후보 중 처음 보는 아이템만 NEW로 저장하고 반환합니다.
 * 반환 순서는 수집 순서를 따릅니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class Deduplicator {

    private static final int MAX_TITLE_LENGTH = 1000;
    private static final int MAX_URL_LENGTH = 2048;

    private final ItemStore itemStore;

    public List<NewsItem> filterNew(String sourceId, List<RawItem> candidates) {
        List<NewsItem> fresh = new ArrayList<>();
        Set<String> keysInFetch = new HashSet<>();
        int skipped = 0;

        for (RawItem candidate : candidates) {
            String itemKey = ItemKeys.keyFor(candidate);
            if (!keysInFetch.add(itemKey) || itemStore.hasSeen(sourceId, itemKey)) {
                skipped++;
                continue;
            }

            NewsItem item = NewsItem.builder()
                    .sourceId(sourceId)
                    .itemKey(itemKey)
                    .title(Texts.truncate(candidate.title() != null && !candidate.title().isBlank()
                            ? candidate.title().trim() : "(untitled)", MAX_TITLE_LENGTH))
                    .url(Texts.truncate(candidate.url(), MAX_URL_LENGTH))
                    .content(candidate.content())
                    .publishedAt(candidate.publishedAt())
                    .build();

            if (itemStore.insertNew(item) == InsertResult.INSERTED) {
                fresh.add(item);
            } else {
                // 다른 스레드가 먼저 저장함
                log.debug("Lost insert race for source={}, key={}", sourceId, itemKey);
                skipped++;
            }
        }

        log.debug("Dedup for source={}: {} new, {} skipped", sourceId, fresh.size(), skipped);
        return fresh;
    }
}
