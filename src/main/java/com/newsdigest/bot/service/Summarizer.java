package com.newsdigest.bot.service;

import com.newsdigest.bot.client.CompletionClient;
import com.newsdigest.bot.config.DigestProperties;
import com.newsdigest.bot.entity.NewsItem;
import com.newsdigest.bot.exception.PermanentExternalException;
import com.newsdigest.bot.exception.TransientExternalException;
import com.newsdigest.bot.util.Texts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 배치 하나를 LLM 호출 한 번으로 요약합니다.
 *
 * transient 실패는 llm 재시도 정책으로 재시도되고, 한도를 넘으면 {@link TransientExternalException}이 전파됩니다.
 * permanent 실패는 재시도 없이 {@link PermanentExternalException}으로 전파됩니다.
 */
@Service
@Slf4j
public class Summarizer {

    private final CompletionClient completionClient;
    private final RetryPolicy retryPolicy;
    private final DigestProperties properties;

    public Summarizer(CompletionClient completionClient,
                      @Qualifier("llmRetryPolicy") RetryPolicy retryPolicy,
                      DigestProperties properties) {
        this.completionClient = completionClient;
        this.retryPolicy = retryPolicy;
        this.properties = properties;
    }

    public String summarize(PostBatch batch) {
        DigestProperties.Llm llm = properties.getLlm();
        String prompt = buildPrompt(batch.items());
        log.info("[Summarizer] Summarizing batch {} ({} items, {} chars)", batch.batchId(), batch.size(), prompt.length());

        String summary = retryPolicy.execute(() -> completionClient.complete(llm.getSystemPrompt(), prompt));
        log.debug("[Summarizer] Batch {} summary length={}", batch.batchId(), summary.length());
        return summary;
    }

    String buildPrompt(List<NewsItem> items) {
        int maxItemChars = properties.getBatch().getMaxItemChars();
        StringBuilder prompt = new StringBuilder(properties.getLlm().getInstructions()).append("\n\n");
        int index = 1;
        for (NewsItem item : items) {
            prompt.append(index++).append(". ").append(item.getTitle()).append('\n');
            String content = item.getContent();
            if (content != null && !content.isBlank()) {
                prompt.append(content.length() > maxItemChars ? Texts.truncate(content, maxItemChars) + "..." : content)
                        .append('\n');
            }
            if (item.getUrl() != null) {
                prompt.append("Link: ").append(item.getUrl()).append('\n');
            }
            prompt.append('\n');
        }
        return prompt.toString().trim();
    }
}
