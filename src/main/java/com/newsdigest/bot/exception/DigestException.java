package com.newsdigest.bot.exception;

/**
 * 다이제스트 파이프라인 예외 기본 클래스
 */
public class DigestException extends RuntimeException {

    private final String errorCode;

    public DigestException(String message) {
        super(message);
        this.errorCode = "DIGEST_ERROR";
    }

    public DigestException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "DIGEST_ERROR";
    }

    public DigestException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public DigestException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
