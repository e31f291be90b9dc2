package com.newsdigest.bot.service.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordFilterTest {

    private final List<RawItem> items = List.of(
            new RawItem(null, "Marketplace fees change", "https://e.com/1", "", null),
            new RawItem(null, "Weather", "https://e.com/2", "Sunny, later a SELLER summit", null),
            new RawItem(null, "Sports", "https://e.com/3", null, null)
    );

    @Test
    @DisplayName("키워드가 없으면 모두 통과")
    void noKeywords() {
        assertThat(KeywordFilter.apply(List.of(), items)).hasSize(3);
        assertThat(KeywordFilter.apply(null, items)).hasSize(3);
        assertThat(KeywordFilter.apply(List.of(" "), items)).hasSize(3);
    }

    @Test
    @DisplayName("제목이나 본문에 키워드가 있으면 통과 (대소문자 무시)")
    void matchesTitleOrContent() {
        assertThat(KeywordFilter.apply(List.of("MARKETPLACE", "seller"), items))
                .extracting(RawItem::url)
                .containsExactly("https://e.com/1", "https://e.com/2");
    }
}
