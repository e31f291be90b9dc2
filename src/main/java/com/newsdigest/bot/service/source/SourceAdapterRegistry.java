package com.newsdigest.bot.service.source;

import com.newsdigest.bot.config.DigestProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 설정된 소스마다 유형에 맞는 어댑터를 생성합니다. 어댑터 목록은 설정 순서를 따릅니다.
 */
@Component
@Slf4j
public class SourceAdapterRegistry {

    private final List<SourceAdapter> adapters;

    public SourceAdapterRegistry(DigestProperties properties) {
        Set<String> ids = new HashSet<>();
        for (DigestProperties.Source source : properties.getSources()) {
            if (!ids.add(source.getId())) {
                throw new IllegalStateException("Duplicate source id in digest.sources: " + source.getId());
            }
        }
        this.adapters = properties.activeSources().stream()
                .map(source -> create(source, properties.getFetch()))
                .toList();
        log.info("Registered {} news sources: {}", adapters.size(),
                adapters.stream().map(SourceAdapter::sourceId).toList());
    }

    public List<SourceAdapter> adapters() {
        return adapters;
    }

    static SourceAdapter create(DigestProperties.Source source, DigestProperties.Fetch fetch) {
        return switch (source.getType()) {
            case RSS -> new RssSourceAdapter(source, fetch);
            case WEBSITE -> new WebPageSourceAdapter(source, fetch);
            case TELEGRAM_CHANNEL -> new TelegramChannelSourceAdapter(source, fetch);
        };
    }
}
