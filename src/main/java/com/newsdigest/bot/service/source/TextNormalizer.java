package com.newsdigest.bot.service.source;

import org.jsoup.Jsoup;

final class TextNormalizer {

    private TextNormalizer() {
    }

    /**
     * HTML 태그 제거 후 공백 정리
     */
    static String normalize(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        return Jsoup.parse(html).text()
                .replaceAll("\\s+", " ")
                .trim();
    }
}
