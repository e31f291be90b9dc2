package com.newsdigest.bot.exception;

/**
 * 소스 수집 실패. 해당 소스만 이번 사이클에서 건너뜁니다.
 */
public class SourceUnavailableException extends DigestException {

    private final String sourceId;

    public SourceUnavailableException(String sourceId, String message) {
        super("SOURCE_UNAVAILABLE", message);
        this.sourceId = sourceId;
    }

    public SourceUnavailableException(String sourceId, String message, Throwable cause) {
        super("SOURCE_UNAVAILABLE", message, cause);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
