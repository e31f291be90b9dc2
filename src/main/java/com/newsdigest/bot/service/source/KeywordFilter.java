package com.newsdigest.bot.service.source;

import java.util.List;
import java.util.Locale;

/**
 * 소스별 키워드 필터. 키워드가 없으면 모두 통과합니다.
 */
public final class KeywordFilter {

    private KeywordFilter() {
    }

    public static List<RawItem> apply(List<String> keywords, List<RawItem> items) {
        if (keywords == null || keywords.isEmpty()) {
            return items;
        }
        List<String> needles = keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .toList();
        if (needles.isEmpty()) {
            return items;
        }
        return items.stream()
                .filter(item -> matches(needles, item))
                .toList();
    }

    private static boolean matches(List<String> needles, RawItem item) {
        String haystack = ((item.title() != null ? item.title() : "") + " "
                + (item.content() != null ? item.content() : "")).toLowerCase(Locale.ROOT);
        return needles.stream().anyMatch(haystack::contains);
    }
}
