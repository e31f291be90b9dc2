package com.newsdigest.bot.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * 재시도로 회복될 수 있는 외부 호출 실패 (rate limit, timeout, 5xx)
 */
public class TransientExternalException extends ExternalCallException {

    /**
     * 서버가 알려준 최소 대기 시간 (Telegram parameters.retry_after). 없으면 null.
     */
    private final Duration retryAfter;

    public TransientExternalException(String service, ExternalFailureKind kind, String message) {
        this(service, kind, message, null, null);
    }

    public TransientExternalException(String service, ExternalFailureKind kind, String message, Throwable cause) {
        this(service, kind, message, cause, null);
    }

    public TransientExternalException(String service, ExternalFailureKind kind, String message, Throwable cause,
                                      Duration retryAfter) {
        super("EXTERNAL_" + kind.name(), service, kind, message, cause);
        if (!kind.isTransient()) {
            throw new IllegalArgumentException("Not a transient failure kind: " + kind);
        }
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
