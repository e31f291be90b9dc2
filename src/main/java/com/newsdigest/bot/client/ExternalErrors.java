package com.newsdigest.bot.client;

import com.newsdigest.bot.exception.ExternalCallException;
import com.newsdigest.bot.exception.ExternalFailureKind;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * HTTP 호출 실패를 ExternalFailureKind로 분류합니다.
 */
public final class ExternalErrors {

    private ExternalErrors() {
    }

    /**
     * @param forbiddenKind 403을 어떻게 볼지 (채널은 FORBIDDEN, LLM은 AUTH_ERROR)
     */
    public static ExternalFailureKind kindForStatus(int status, ExternalFailureKind forbiddenKind) {
        if (status == 429) {
            return ExternalFailureKind.RATE_LIMITED;
        }
        if (status == 401) {
            return ExternalFailureKind.AUTH_ERROR;
        }
        if (status == 403) {
            return forbiddenKind;
        }
        if (status == 408 || status == 504) {
            return ExternalFailureKind.TIMEOUT;
        }
        if (status >= 500) {
            return ExternalFailureKind.SERVER_ERROR;
        }
        return ExternalFailureKind.MALFORMED;
    }

    public static ExternalCallException classify(String service, Throwable error, ExternalFailureKind forbiddenKind) {
        Throwable cause = Exceptions.unwrap(error);
        if (cause instanceof ExternalCallException external) {
            return external;
        }
        if (cause instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            return ExternalCallException.of(service, kindForStatus(status, forbiddenKind),
                    service + " returned HTTP " + status, response);
        }
        if (isTimeout(cause)) {
            return ExternalCallException.of(service, ExternalFailureKind.TIMEOUT,
                    service + " call timed out", cause);
        }
        if (cause instanceof WebClientRequestException) {
            return ExternalCallException.of(service, ExternalFailureKind.NETWORK,
                    service + " request failed: " + cause.getMessage(), cause);
        }
        return ExternalCallException.of(service, ExternalFailureKind.MALFORMED,
                service + " call failed: " + cause.getMessage(), cause);
    }

    private static boolean isTimeout(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof TimeoutException
                    || current instanceof SocketTimeoutException
                    || current instanceof io.netty.handler.timeout.TimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
