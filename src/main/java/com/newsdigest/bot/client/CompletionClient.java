package com.newsdigest.bot.client;

import com.newsdigest.bot.exception.ExternalCallException;

/**
 * LLM 텍스트 생성 클라이언트
 */
public interface CompletionClient {

    /**
     * @return 생성된 텍스트 (비어 있지 않음)
     * @throws ExternalCallException 실패 분류(RATE_LIMITED, TIMEOUT, AUTH_ERROR, MALFORMED 등)를 담은 예외
     */
    String complete(String systemPrompt, String userPrompt);
}
