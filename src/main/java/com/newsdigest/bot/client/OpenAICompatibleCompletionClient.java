package com.newsdigest.bot.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsdigest.bot.config.DigestProperties;
import com.newsdigest.bot.exception.ExternalCallException;
import com.newsdigest.bot.exception.ExternalFailureKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * OpenAI 호환 chat/completions 클라이언트.
 * 기본 설정은 Mistral API를 사용하며 OpenAI, OpenRouter, Ollama 등 같은 규격의 엔드포인트와 호환됩니다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenAICompatibleCompletionClient implements CompletionClient {

    static final String SERVICE = "llm";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final DigestProperties properties;

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        DigestProperties.Llm llm = properties.getLlm();
        String url = llm.getBaseUrl().replaceAll("/+$", "") + "/chat/completions";

        Map<String, Object> request = Map.of(
                "model", llm.getModel(),
                "messages", List.of(
                        Map.of("role", "system", "content", systemPrompt),
                        Map.of("role", "user", "content", userPrompt)
                ),
                "temperature", llm.getTemperature(),
                "max_tokens", llm.getMaxTokens(),
                "stream", false
        );

        log.debug("Calling LLM: model={}, promptLength={}", llm.getModel(), userPrompt.length());

        String body;
        try {
            body = webClient.post()
                    .uri(url)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + llm.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(llm.getTimeoutSeconds()))
                    .block();
        } catch (RuntimeException e) {
            throw ExternalErrors.classify(SERVICE, e, ExternalFailureKind.AUTH_ERROR);
        }

        return extractContent(body);
    }

    String extractContent(String body) {
        if (body == null || body.isBlank()) {
            throw ExternalCallException.of(SERVICE, ExternalFailureKind.MALFORMED, "Empty completion response");
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            JsonNode choices = node.path("choices");
            if (choices.isArray() && !choices.isEmpty()) {
                String content = choices.get(0).path("message").path("content").asText("");
                if (!content.isBlank()) {
                    return content.trim();
                }
            }
        } catch (JsonProcessingException e) {
            throw ExternalCallException.of(SERVICE, ExternalFailureKind.MALFORMED,
                    "Unparseable completion response: " + e.getOriginalMessage(), e);
        }
        throw ExternalCallException.of(SERVICE, ExternalFailureKind.MALFORMED, "Completion response has no content");
    }
}
