package com.newsdigest.bot.service;

import com.newsdigest.bot.config.DigestProperties;
import com.newsdigest.bot.entity.NewsItem;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 아이템 목록을 요약 호출 단위로 나눕니다.
 * 아이템 수(max-items)와 문자 수(max-chars) 한도를 넘지 않게 순서대로 채우며, 아이템을 버리지 않습니다.
 * 한도보다 큰 단일 아이템은 단독 배치가 됩니다.
 */
@Component
@RequiredArgsConstructor
public class BatchPlanner {

    private final DigestProperties properties;

    public List<PostBatch> plan(String prefix, List<NewsItem> items) {
        DigestProperties.Batch limits = properties.getBatch();
        List<PostBatch> batches = new ArrayList<>();
        List<NewsItem> current = new ArrayList<>();
        int currentChars = 0;

        for (NewsItem item : items) {
            int cost = cost(item, limits.getMaxItemChars());
            boolean full = current.size() >= limits.getMaxItems()
                    || (!current.isEmpty() && currentChars + cost > limits.getMaxChars());
            if (full) {
                batches.add(new PostBatch(prefix + "-" + (batches.size() + 1), current, currentChars));
                current = new ArrayList<>();
                currentChars = 0;
            }
            current.add(item);
            currentChars += cost;
        }
        if (!current.isEmpty()) {
            batches.add(new PostBatch(prefix + "-" + (batches.size() + 1), current, currentChars));
        }
        return batches;
    }

    /**
     * 프롬프트에 들어가는 문자 수 (본문은 max-item-chars로 잘림)
     */
    static int cost(NewsItem item, int maxItemChars) {
        int title = item.getTitle() != null ? item.getTitle().length() : 0;
        int url = item.getUrl() != null ? item.getUrl().length() : 0;
        int content = item.getContent() != null ? Math.min(item.getContent().length(), maxItemChars) : 0;
        return title + url + content;
    }
}
