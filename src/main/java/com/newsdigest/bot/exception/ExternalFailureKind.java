package com.newsdigest.bot.exception;

/**
 * 외부 호출(LLM, 채널) 실패 분류.
 * transient 여부에 따라 재시도 대상이 결정됩니다.
 */
public enum ExternalFailureKind {
    RATE_LIMITED(true),
    TIMEOUT(true),
    SERVER_ERROR(true),
    NETWORK(true),
    AUTH_ERROR(false),
    FORBIDDEN(false),
    MALFORMED(false);

    private final boolean transientFailure;

    ExternalFailureKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
