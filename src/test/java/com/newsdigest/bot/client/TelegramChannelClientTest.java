package com.newsdigest.bot.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.newsdigest.bot.config.DigestProperties;
import com.newsdigest.bot.exception.ExternalFailureKind;
import com.newsdigest.bot.exception.PermanentExternalException;
import com.newsdigest.bot.exception.TransientExternalException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TelegramChannelClientTest {

    private DigestProperties properties;
    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();
    private final AtomicInteger calls = new AtomicInteger();

    @BeforeEach
    void setUp() {
        properties = new DigestProperties();
        properties.getChannel().setApiBaseUrl("https://telegram.example.com");
        properties.getChannel().setBotToken("123:abc");
        properties.getChannel().setChatId("@digest");
    }

    private TelegramChannelClient clientReturning(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    lastRequest.set(request);
                    calls.incrementAndGet();
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new TelegramChannelClient(webClient, new ObjectMapper(), properties);
    }

    @Test
    @DisplayName("sendMessage 성공 시 message_id와 chat id를 담은 영수증 반환")
    void sendsMessage() {
        TelegramChannelClient client = clientReturning(HttpStatus.OK,
                "{\"ok\":true,\"result\":{\"message_id\":55,\"chat\":{\"id\":-100123}}}");

        DeliveryReceipt receipt = client.send("<b>Digest</b>");

        assertThat(receipt.messageId()).isEqualTo("55");
        assertThat(receipt.chatId()).isEqualTo("-100123");
        assertThat(receipt.sentAt()).isNotNull();
        assertThat(lastRequest.get().url())
                .isEqualTo(URI.create("https://telegram.example.com/bot123:abc/sendMessage"));
    }

    @Test
    @DisplayName("429는 RATE_LIMITED (transient)")
    void rateLimited() {
        TelegramChannelClient client = clientReturning(HttpStatus.TOO_MANY_REQUESTS,
                "{\"ok\":false,\"error_code\":429,\"description\":\"Too Many Requests: retry after 5\"}");

        assertThatThrownBy(() -> client.send("hello"))
                .isInstanceOf(TransientExternalException.class)
                .hasMessageContaining("retry after 5")
                .extracting("kind").isEqualTo(ExternalFailureKind.RATE_LIMITED);
    }

    @Test
    @DisplayName("봇이 채널에 권한이 없으면 FORBIDDEN (permanent), 토큰은 메시지에 남기지 않음")
    void forbidden() {
        TelegramChannelClient client = clientReturning(HttpStatus.FORBIDDEN,
                "{\"ok\":false,\"error_code\":403,\"description\":\"Forbidden: bot is not a member\"}");

        assertThatThrownBy(() -> client.send("hello"))
                .isInstanceOf(PermanentExternalException.class)
                .hasMessageNotContaining("123:abc")
                .extracting("kind").isEqualTo(ExternalFailureKind.FORBIDDEN);
    }

    @Test
    @DisplayName("401은 AUTH_ERROR, 5xx는 SERVER_ERROR")
    void authAndServerErrors() {
        assertThatThrownBy(() -> clientReturning(HttpStatus.UNAUTHORIZED, "{}").send("hello"))
                .isInstanceOf(PermanentExternalException.class)
                .extracting("kind").isEqualTo(ExternalFailureKind.AUTH_ERROR);
        assertThatThrownBy(() -> clientReturning(HttpStatus.BAD_GATEWAY, "").send("hello"))
                .isInstanceOf(TransientExternalException.class)
                .extracting("kind").isEqualTo(ExternalFailureKind.SERVER_ERROR);
    }

    @Test
    @DisplayName("HTTP 200이지만 ok=false이면 error_code로 분류")
    void okFalseBody() {
        TelegramChannelClient client = clientReturning(HttpStatus.OK,
                "{\"ok\":false,\"error_code\":400,\"description\":\"Bad Request: can't parse entities\"}");

        assertThatThrownBy(() -> client.send("hello"))
                .isInstanceOf(PermanentExternalException.class)
                .hasMessageContaining("can't parse entities")
                .extracting("kind").isEqualTo(ExternalFailureKind.MALFORMED);
    }

    @Test
    @DisplayName("4096자를 넘는 메시지는 요청 없이 MALFORMED")
    void rejectsOversizedMessage() {
        TelegramChannelClient client = clientReturning(HttpStatus.OK, "{\"ok\":true}");

        assertThatThrownBy(() -> client.send("x".repeat(TelegramChannelClient.MAX_MESSAGE_LENGTH + 1)))
                .isInstanceOf(PermanentExternalException.class)
                .extracting("kind").isEqualTo(ExternalFailureKind.MALFORMED);
        assertThat(calls).hasValue(0);
    }

    @Test
    @DisplayName("2xx 응답을 해석할 수 없어도 전송된 것으로 처리")
    void unparseableSuccessIsDelivered() {
        TelegramChannelClient client = clientReturning(HttpStatus.OK, "not json");

        DeliveryReceipt receipt = client.send("hello");

        assertThat(receipt.messageId()).isNull();
        assertThat(receipt.chatId()).isEqualTo("@digest");
    }

    @Test
    @DisplayName("2xx 응답 본문이 비어 있거나 객체가 아니어도 전송된 것으로 처리")
    void emptySuccessBodyIsDelivered() {
        DeliveryReceipt empty = clientReturning(HttpStatus.OK, "").send("hello");
        DeliveryReceipt array = clientReturning(HttpStatus.OK, "[]").send("hello");

        assertThat(empty.messageId()).isNull();
        assertThat(empty.chatId()).isEqualTo("@digest");
        assertThat(array.chatId()).isEqualTo("@digest");
        assertThat(calls).hasValue(2);
    }

    @Test
    @DisplayName("429 응답의 parameters.retry_after를 예외에 담음")
    void rateLimitCarriesRetryAfter() {
        TelegramChannelClient client = clientReturning(HttpStatus.TOO_MANY_REQUESTS,
                "{\"ok\":false,\"error_code\":429,\"description\":\"Too Many Requests: retry after 7\","
                        + "\"parameters\":{\"retry_after\":7}}");

        assertThatThrownBy(() -> client.send("hello"))
                .isInstanceOfSatisfying(TransientExternalException.class, e ->
                        assertThat(e.getRetryAfter()).contains(Duration.ofSeconds(7)));
    }

    @Test
    @DisplayName("HTTP 200 ok=false 429도 retry_after를 담음")
    void okFalseRateLimitCarriesRetryAfter() {
        TelegramChannelClient client = clientReturning(HttpStatus.OK,
                "{\"ok\":false,\"error_code\":429,\"description\":\"Too Many Requests\","
                        + "\"parameters\":{\"retry_after\":3}}");

        assertThatThrownBy(() -> client.send("hello"))
                .isInstanceOfSatisfying(TransientExternalException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ExternalFailureKind.RATE_LIMITED);
                    assertThat(e.getRetryAfter()).contains(Duration.ofSeconds(3));
                });
    }

    @Test
    @DisplayName("retry_after가 없으면 비어 있음")
    void rateLimitWithoutRetryAfter() {
        TelegramChannelClient client = clientReturning(HttpStatus.TOO_MANY_REQUESTS, "");

        assertThatThrownBy(() -> client.send("hello"))
                .isInstanceOfSatisfying(TransientExternalException.class, e ->
                        assertThat(e.getRetryAfter()).isEmpty());
    }
}
