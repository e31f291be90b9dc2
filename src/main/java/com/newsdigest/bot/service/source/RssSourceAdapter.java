package com.newsdigest.bot.service.source;

import com.newsdigest.bot.config.DigestProperties;
import com.newsdigest.bot.exception.SourceUnavailableException;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndFeed;
import com.rometools.rome.io.FeedException;
import com.rometools.rome.io.SyndFeedInput;
import com.rometools.rome.io.XmlReader;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * RSS/Atom 피드 어댑터 (Rome)
 */
@Slf4j
public class RssSourceAdapter implements SourceAdapter {

    private final DigestProperties.Source source;
    private final DigestProperties.Fetch fetch;

    public RssSourceAdapter(DigestProperties.Source source, DigestProperties.Fetch fetch) {
        this.source = source;
        this.fetch = fetch;
    }

    @Override
    public DigestProperties.Source source() {
        return source;
    }

    @Override
    public List<RawItem> fetch() {
        log.debug("Fetching RSS feed from: {}", source.getUrl());
        HttpURLConnection connection = null;
        try {
            connection = (HttpURLConnection) URI.create(source.getUrl()).toURL().openConnection();
            connection.setRequestProperty("User-Agent", fetch.getUserAgent());
            connection.setRequestProperty("Accept", "application/rss+xml, application/atom+xml, application/xml, text/xml, */*");
            int timeoutMs = fetch.getTimeoutSeconds() * 1000;
            connection.setConnectTimeout(timeoutMs);
            connection.setReadTimeout(timeoutMs);
            connection.setInstanceFollowRedirects(true);

            int status = connection.getResponseCode();
            if (status >= 400) {
                throw new SourceUnavailableException(source.getId(), "RSS feed returned HTTP " + status);
            }
            try (InputStream in = connection.getInputStream()) {
                return parse(in);
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new SourceUnavailableException(source.getId(),
                    "Error fetching RSS feed " + source.getUrl() + ": " + e.getMessage(), e);
        } finally {
            if (connection != null) {
                connection.disconnect();
            }
        }
    }

    List<RawItem> parse(InputStream in) throws IOException {
        SyndFeed feed;
        try {
            feed = new SyndFeedInput().build(new XmlReader(in));
        } catch (FeedException | IllegalArgumentException e) {
            throw new SourceUnavailableException(source.getId(), "Invalid feed: " + e.getMessage(), e);
        }

        List<RawItem> items = new ArrayList<>();
        for (SyndEntry entry : feed.getEntries()) {
            if (items.size() >= source.getLimit()) {
                break;
            }
            RawItem item = parseEntry(entry);
            if (item != null) {
                items.add(item);
            }
        }
        log.debug("Found {} entries in feed: {}", items.size(), source.displayName());
        return items;
    }

    private RawItem parseEntry(SyndEntry entry) {
        String title = TextNormalizer.normalize(entry.getTitle());
        String link = entry.getLink();
        if (title.isEmpty() && (link == null || link.isBlank())) {
            return null;
        }

        String content = "";
        if (entry.getDescription() != null) {
            content = TextNormalizer.normalize(entry.getDescription().getValue());
        }
        if (content.isEmpty() && entry.getContents() != null) {
            for (SyndContent part : entry.getContents()) {
                content = TextNormalizer.normalize(part.getValue());
                if (!content.isEmpty()) {
                    break;
                }
            }
        }

        LocalDateTime publishedAt = null;
        Date pubDate = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();
        if (pubDate != null) {
            publishedAt = LocalDateTime.ofInstant(pubDate.toInstant(), ZoneId.systemDefault());
        }

        return new RawItem(entry.getUri(), title, link, content, publishedAt);
    }
}
