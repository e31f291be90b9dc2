package com.newsdigest.bot.exception;

/**
 * 재시도해도 회복되지 않는 외부 호출 실패 (인증, 권한, 잘못된 요청)
 */
public class PermanentExternalException extends ExternalCallException {

    public PermanentExternalException(String service, ExternalFailureKind kind, String message) {
        this(service, kind, message, null);
    }

    public PermanentExternalException(String service, ExternalFailureKind kind, String message, Throwable cause) {
        super("EXTERNAL_" + kind.name(), service, kind, message, cause);
        if (kind.isTransient()) {
            throw new IllegalArgumentException("Not a permanent failure kind: " + kind);
        }
    }
}
