package com.newsdigest.bot.exception;

/**
 * Item Store 불변식 위반 (프로그래밍 오류)
 */
public class StoreInvariantViolationException extends DigestException {

    public StoreInvariantViolationException(String message) {
        super("STORE_INVARIANT_VIOLATION", message);
    }

    protected StoreInvariantViolationException(String errorCode, String message) {
        super(errorCode, message);
    }
}
