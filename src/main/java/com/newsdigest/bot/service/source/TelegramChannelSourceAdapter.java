package com.newsdigest.bot.service.source;

import com.newsdigest.bot.config.DigestProperties;
import com.newsdigest.bot.exception.SourceUnavailableException;
import com.newsdigest.bot.util.Texts;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 공개 텔레그램 채널 어댑터.
 * 채널 웹 미리보기(https://t.me/s/&lt;channel&gt;)를 읽습니다. 메시지 첫 줄을 제목으로 사용합니다.
 */
@Slf4j
public class TelegramChannelSourceAdapter implements SourceAdapter {

    private static final String PREVIEW_BASE = "https://t.me/s/";
    private static final String POST_BASE = "https://t.me/";
    private static final int MAX_TITLE_LENGTH = 200;

    private final DigestProperties.Source source;
    private final DigestProperties.Fetch fetch;

    public TelegramChannelSourceAdapter(DigestProperties.Source source, DigestProperties.Fetch fetch) {
        this.source = source;
        this.fetch = fetch;
    }

    @Override
    public DigestProperties.Source source() {
        return source;
    }

    @Override
    public List<RawItem> fetch() {
        String previewUrl = previewUrl(source.getUrl());
        try {
            Document document = Jsoup.connect(previewUrl)
                    .userAgent(fetch.getUserAgent())
                    .timeout(fetch.getTimeoutSeconds() * 1000)
                    .get();
            return parse(document);
        } catch (HttpStatusException e) {
            throw new SourceUnavailableException(source.getId(),
                    "Channel preview " + previewUrl + " returned HTTP " + e.getStatusCode(), e);
        } catch (IOException e) {
            throw new SourceUnavailableException(source.getId(),
                    "Error fetching channel " + previewUrl + ": " + e.getMessage(), e);
        }
    }

    static String previewUrl(String channel) {
        String value = channel.trim();
        if (value.startsWith("http://") || value.startsWith("https://")) {
            return value.contains("/s/") ? value : value.replaceFirst("t\\.me/", "t.me/s/");
        }
        return PREVIEW_BASE + (value.startsWith("@") ? value.substring(1) : value);
    }

    List<RawItem> parse(Document document) {
        List<RawItem> items = new ArrayList<>();
        List<Element> messages = document.select("div.tgme_widget_message[data-post]");
        // 미리보기 페이지는 오래된 메시지부터 나열됨
        for (int i = messages.size() - 1; i >= 0 && items.size() < source.getLimit(); i--) {
            RawItem item = parseMessage(messages.get(i));
            if (item != null) {
                items.add(item);
            }
        }
        // 수집 순서는 오래된 것부터
        Collections.reverse(items);
        log.debug("Found {} messages in channel: {}", items.size(), source.displayName());
        return items;
    }

    private RawItem parseMessage(Element message) {
        String post = message.attr("data-post");
        Element textElement = message.selectFirst("div.tgme_widget_message_text");
        if (textElement == null) {
            return null;
        }

        Element copy = textElement.clone();
        copy.select("br").forEach(br -> br.replaceWith(new TextNode("\n")));
        String text = copy.wholeText().trim();
        if (text.isEmpty()) {
            return null;
        }

        String firstLine = text.lines().map(String::trim).filter(line -> !line.isEmpty()).findFirst().orElse(text);
        String title = Texts.truncate(firstLine, MAX_TITLE_LENGTH);

        LocalDateTime publishedAt = null;
        Element time = message.selectFirst("time[datetime]");
        if (time != null) {
            try {
                publishedAt = OffsetDateTime.parse(time.attr("datetime"))
                        .atZoneSameInstant(ZoneId.systemDefault())
                        .toLocalDateTime();
            } catch (DateTimeParseException e) {
                log.debug("Unparseable message time '{}' in {}", time.attr("datetime"), post);
            }
        }

        return new RawItem(post, title, POST_BASE + post, text.replaceAll("\\s+", " "), publishedAt);
    }
}
