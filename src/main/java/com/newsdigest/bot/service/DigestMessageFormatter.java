package com.newsdigest.bot.service;

import com.newsdigest.bot.client.TelegramChannelClient;
import com.newsdigest.bot.config.DigestProperties;
import com.newsdigest.bot.entity.NewsItem;
import com.newsdigest.bot.util.Texts;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 채널 메시지 구성: 헤더, 요약, 원문 링크 목록.
 * 메시지 길이 한도를 넘으면 링크를 뒤에서부터 빼고, 그래도 넘으면 요약을 자릅니다.
 */
@Component
@RequiredArgsConstructor
public class DigestMessageFormatter {

    private static final String ELLIPSIS = "…";

    private final DigestProperties properties;

    public String format(String summary, List<NewsItem> items) {
        return format(summary, items, TelegramChannelClient.MAX_MESSAGE_LENGTH);
    }

    String format(String summary, List<NewsItem> items, int maxLength) {
        boolean html = isHtml();
        String header = properties.getChannel().getHeader();
        String head = header == null || header.isBlank()
                ? ""
                : (html ? "<b>" + escape(header) + "</b>" : header) + "\n\n";
        String body = html ? escape(summary.trim()) : summary.trim();

        List<String> links = new ArrayList<>();
        int index = 1;
        for (NewsItem item : items) {
            if (item.getUrl() == null || item.getUrl().isBlank()) {
                index++;
                continue;
            }
            String label = index + ". " + (html
                    ? "<a href=\"" + escapeAttribute(item.getUrl()) + "\">" + escape(item.getTitle()) + "</a>"
                    : item.getTitle() + " " + item.getUrl());
            links.add(label);
            index++;
        }

        while (true) {
            String message = assemble(head, body, links);
            if (message.length() <= maxLength) {
                return message;
            }
            if (!links.isEmpty()) {
                links.remove(links.size() - 1);
                continue;
            }
            int room = maxLength - head.length() - ELLIPSIS.length();
            return head + cutSafely(body, Math.max(room, 0)) + ELLIPSIS;
        }
    }

    private String assemble(String head, String body, List<String> links) {
        StringBuilder message = new StringBuilder(head).append(body);
        if (!links.isEmpty()) {
            message.append("\n\n").append(String.join("\n", links));
        }
        return message.toString();
    }

    /**
     * HTML 엔티티 중간에서 자르지 않도록 보정
     */
    private String cutSafely(String text, int length) {
        if (text.length() <= length) {
            return text;
        }
        String cut = Texts.truncate(text, length);
        int amp = cut.lastIndexOf('&');
        if (amp >= 0 && cut.indexOf(';', amp) < 0) {
            cut = cut.substring(0, amp);
        }
        return cut;
    }

    private boolean isHtml() {
        return "HTML".equalsIgnoreCase(properties.getChannel().getParseMode());
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    static String escapeAttribute(String text) {
        return escape(text).replace("\"", "&quot;");
    }
}
