package com.newsdigest.bot.exception;

/**
 * 외부 서비스 호출 실패
 */
public abstract class ExternalCallException extends DigestException {

    private final ExternalFailureKind kind;
    private final String service;

    protected ExternalCallException(String errorCode, String service, ExternalFailureKind kind,
                                    String message, Throwable cause) {
        super(errorCode, message, cause);
        this.service = service;
        this.kind = kind;
    }

    public ExternalFailureKind getKind() {
        return kind;
    }

    public String getService() {
        return service;
    }

    public boolean isTransient() {
        return kind.isTransient();
    }

    /**
     * Builds the right subclass for the given failure kind.
     */
    public static ExternalCallException of(String service, ExternalFailureKind kind, String message) {
        return of(service, kind, message, null);
    }

    public static ExternalCallException of(String service, ExternalFailureKind kind, String message, Throwable cause) {
        if (kind.isTransient()) {
            return new TransientExternalException(service, kind, message, cause);
        }
        return new PermanentExternalException(service, kind, message, cause);
    }
}
