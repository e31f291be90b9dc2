package com.newsdigest.bot.service.source;

import com.newsdigest.bot.config.DigestProperties;
import com.newsdigest.bot.exception.SourceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 뉴스 목록 페이지 스크래핑 어댑터 (Jsoup).
 * item-selector로 기사 블록을 찾고 블록 안에서 링크, 제목, 요약을 추출합니다.
 */
@Slf4j
public class WebPageSourceAdapter implements SourceAdapter {

    private final DigestProperties.Source source;
    private final DigestProperties.Fetch fetch;

    public WebPageSourceAdapter(DigestProperties.Source source, DigestProperties.Fetch fetch) {
        this.source = source;
        this.fetch = fetch;
    }

    @Override
    public DigestProperties.Source source() {
        return source;
    }

    @Override
    public List<RawItem> fetch() {
        try {
            Document document = Jsoup.connect(source.getUrl())
                    .userAgent(fetch.getUserAgent())
                    .timeout(fetch.getTimeoutSeconds() * 1000)
                    .followRedirects(true)
                    .get();
            return parse(document);
        } catch (HttpStatusException e) {
            throw new SourceUnavailableException(source.getId(),
                    "Page " + source.getUrl() + " returned HTTP " + e.getStatusCode(), e);
        } catch (IOException | IllegalArgumentException e) {
            throw new SourceUnavailableException(source.getId(),
                    "Error fetching page " + source.getUrl() + ": " + e.getMessage(), e);
        }
    }

    List<RawItem> parse(Document document) {
        List<RawItem> items = new ArrayList<>();
        for (Element block : document.select(source.getItemSelector())) {
            if (items.size() >= source.getLimit()) {
                break;
            }
            Element link = block.selectFirst(source.getLinkSelector());
            if (link == null) {
                continue;
            }
            String url = link.absUrl("href");
            if (url.isBlank()) {
                continue;
            }

            Element titleElement = block.selectFirst(source.getTitleSelector());
            String title = titleElement != null ? titleElement.text().trim() : link.text().trim();
            if (title.isEmpty()) {
                continue;
            }

            Element summary = block.selectFirst(source.getSummarySelector());
            String content = summary != null ? summary.text().trim() : "";

            items.add(new RawItem(null, title, url, content, null));
        }
        log.debug("Found {} items on page: {}", items.size(), source.displayName());
        return items;
    }
}
