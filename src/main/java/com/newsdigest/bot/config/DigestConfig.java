package com.newsdigest.bot.config;

import com.newsdigest.bot.service.RetryPolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(DigestProperties.class)
public class DigestConfig {

    @Bean
    public RetryPolicy.Sleeper retrySleeper() {
        return RetryPolicy.Sleeper.THREAD;
    }

    @Bean
    public RetryPolicy llmRetryPolicy(DigestProperties properties, RetryPolicy.Sleeper retrySleeper) {
        return RetryPolicy.from("llm", properties.getRetry().getLlm(), retrySleeper);
    }

    @Bean
    public RetryPolicy channelRetryPolicy(DigestProperties properties, RetryPolicy.Sleeper retrySleeper) {
        return RetryPolicy.from("channel", properties.getRetry().getChannel(), retrySleeper);
    }
}
