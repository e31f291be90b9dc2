package com.newsdigest.bot.config;

import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Shared WebClient for the LLM and channel clients.
 * Per-call response timeouts are applied by each client from its own settings.
 */
@Configuration
public class WebClientConfig {

    @Value("${digest.http.user-agent:NewsDigestBot/1.0}")
    private String userAgent;

    @Value("${digest.http.connect-timeout-ms:10000}")
    private int connectTimeout;

    @Value("${digest.http.max-in-memory-size:2097152}")
    private int maxInMemorySize;

    @Bean
    public WebClient webClient() {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeout)
                .followRedirect(true);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxInMemorySize))
                .defaultHeader("User-Agent", userAgent)
                .build();
    }
}
