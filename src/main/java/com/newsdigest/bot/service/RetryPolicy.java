package com.newsdigest.bot.service;

import com.newsdigest.bot.config.DigestProperties;
import com.newsdigest.bot.exception.ExternalCallException;
import com.newsdigest.bot.exception.TransientExternalException;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 지수 백오프 재시도 정책.
 *
 * transient 실패만 maxAttempts까지 재시도하고, permanent 실패는 즉시 전파합니다.
 * 서버가 retry-after를 알려주면 그 시간을 최소 대기로 쓰고, maxDelay보다 길면 바로 포기합니다.
 * LLM 호출과 채널 발행이 같은 정책 클래스를 각자의 설정으로 사용합니다.
 */
@Slf4j
@Getter
@Builder
public class RetryPolicy {

    private final String name;

    @Builder.Default
    private final int maxAttempts = 3;

    @Builder.Default
    private final Duration initialDelay = Duration.ofSeconds(1);

    @Builder.Default
    private final double multiplier = 2.0;

    @Builder.Default
    private final Duration maxDelay = Duration.ofSeconds(30);

    @Builder.Default
    private final Predicate<Throwable> retryOn =
            e -> e instanceof ExternalCallException ex && ex.isTransient();

    @Builder.Default
    private final Sleeper sleeper = Sleeper.THREAD;

    public static RetryPolicy from(String name, DigestProperties.Retry settings, Sleeper sleeper) {
        return RetryPolicy.builder()
                .name(name)
                .maxAttempts(settings.getMaxAttempts())
                .initialDelay(Duration.ofMillis(settings.getInitialDelayMs()))
                .multiplier(settings.getMultiplier())
                .maxDelay(Duration.ofMillis(settings.getMaxDelayMs()))
                .sleeper(sleeper)
                .build();
    }

    /**
     * nextAttempt번째 시도 전 대기 시간 (2번째 시도부터 적용)
     */
    public Duration delayBefore(int nextAttempt) {
        double factor = Math.pow(multiplier, Math.max(0, nextAttempt - 2));
        long millis = (long) Math.min(initialDelay.toMillis() * factor, (double) maxDelay.toMillis());
        return Duration.ofMillis(millis);
    }

    public <T> T execute(Supplier<T> call) {
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.get();
            } catch (RuntimeException e) {
                lastFailure = e;
                if (!retryOn.test(e)) {
                    throw e;
                }
                if (attempt == maxAttempts) {
                    break;
                }
                Duration delay = delayBefore(attempt + 1);
                Duration retryAfter = retryAfterOf(e);
                if (retryAfter != null) {
                    if (retryAfter.compareTo(maxDelay) > 0) {
                        log.warn("[Retry:{}] Server asked to wait {} s, longer than max delay {} ms. Leaving it to the next cycle",
                                name, retryAfter.toSeconds(), maxDelay.toMillis());
                        throw e;
                    }
                    if (retryAfter.compareTo(delay) > 0) {
                        delay = retryAfter;
                    }
                }
                log.warn("[Retry:{}] Attempt {}/{} failed: {}. Retrying in {} ms",
                        name, attempt, maxAttempts, e.getMessage(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("[Retry:{}] Interrupted while backing off", name);
                    throw e;
                }
            }
        }
        log.warn("[Retry:{}] Giving up after {} attempts: {}", name, maxAttempts, lastFailure.getMessage());
        throw lastFailure;
    }

    private static Duration retryAfterOf(RuntimeException e) {
        if (e instanceof TransientExternalException transientFailure) {
            return transientFailure.getRetryAfter().orElse(null);
        }
        return null;
    }

    @FunctionalInterface
    public interface Sleeper {
        Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }
}
