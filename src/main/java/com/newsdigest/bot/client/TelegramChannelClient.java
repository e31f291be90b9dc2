package com.newsdigest.bot.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.newsdigest.bot.config.DigestProperties;
import com.newsdigest.bot.exception.ExternalCallException;
import com.newsdigest.bot.exception.ExternalFailureKind;
import com.newsdigest.bot.exception.TransientExternalException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Telegram Bot API sendMessage 클라이언트
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelegramChannelClient implements ChannelClient {

    public static final int MAX_MESSAGE_LENGTH = 4096;

    static final String SERVICE = "channel";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final DigestProperties properties;

    @Override
    public DeliveryReceipt send(String text) {
        DigestProperties.Channel channel = properties.getChannel();
        if (text == null || text.isBlank()) {
            throw ExternalCallException.of(SERVICE, ExternalFailureKind.MALFORMED, "Message text is empty");
        }
        if (text.length() > MAX_MESSAGE_LENGTH) {
            throw ExternalCallException.of(SERVICE, ExternalFailureKind.MALFORMED,
                    "Message exceeds " + MAX_MESSAGE_LENGTH + " characters: " + text.length());
        }

        String url = channel.getApiBaseUrl().replaceAll("/+$", "") + "/bot" + channel.getBotToken() + "/sendMessage";

        Map<String, Object> request = new HashMap<>();
        request.put("chat_id", channel.getChatId());
        request.put("text", text);
        request.put("disable_web_page_preview", channel.isDisableWebPagePreview());
        if (channel.getParseMode() != null && !channel.getParseMode().isBlank()) {
            request.put("parse_mode", channel.getParseMode());
        }

        String body;
        try {
            body = webClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(channel.getTimeoutSeconds()))
                    .block();
        } catch (WebClientResponseException e) {
            // 토큰이 URL에 포함되므로 응답 본문의 description만 남김
            int status = e.getStatusCode().value();
            throw rejection(status, readQuietly(e.getResponseBodyAsString()), "Telegram returned HTTP " + status);
        } catch (RuntimeException e) {
            throw ExternalErrors.classify(SERVICE, e, ExternalFailureKind.FORBIDDEN);
        }

        return toReceipt(body, channel.getChatId());
    }

    private DeliveryReceipt toReceipt(String body, String chatId) {
        JsonNode node;
        try {
            node = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            // HTTP 2xx 이므로 메시지는 전송된 것으로 봄
            log.warn("Unparseable Telegram response after HTTP 2xx, treating as delivered: {}", e.getOriginalMessage());
            return new DeliveryReceipt(null, chatId, LocalDateTime.now());
        }
        if (!node.isObject()) {
            log.warn("Empty or non-object Telegram response after HTTP 2xx, treating as delivered");
            return new DeliveryReceipt(null, chatId, LocalDateTime.now());
        }
        if (node.has("ok") && !node.path("ok").asBoolean(false)) {
            throw rejection(node.path("error_code").asInt(400), node, "Telegram rejected message");
        }
        JsonNode result = node.path("result");
        String messageId = result.path("message_id").asText(null);
        String resolvedChat = result.path("chat").path("id").asText(chatId);
        log.debug("Telegram message sent: chat={}, messageId={}", resolvedChat, messageId);
        return new DeliveryReceipt(messageId, resolvedChat, LocalDateTime.now());
    }

    /**
     * Telegram 오류 응답을 예외로 바꿉니다. 429의 parameters.retry_after는 최소 대기 시간으로 실어 보냅니다.
     */
    private ExternalCallException rejection(int status, JsonNode error, String prefix) {
        ExternalFailureKind kind = ExternalErrors.kindForStatus(status, ExternalFailureKind.FORBIDDEN);
        String message = prefix + ": " + error.path("description").asText("no description");
        JsonNode retryAfter = error.path("parameters").path("retry_after");
        if (kind == ExternalFailureKind.RATE_LIMITED && retryAfter.isIntegralNumber() && retryAfter.asLong() > 0) {
            return new TransientExternalException(SERVICE, kind, message, null, Duration.ofSeconds(retryAfter.asLong()));
        }
        return ExternalCallException.of(SERVICE, kind, message);
    }

    private JsonNode readQuietly(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            log.debug("Telegram error body is not JSON: {}", e.getOriginalMessage());
            return MissingNode.getInstance();
        }
    }
}
