package com.newsdigest.bot.client;

import com.newsdigest.bot.exception.ExternalCallException;

/**
 * 메시지 채널 발행 클라이언트. 발행은 멱등하지 않습니다.
 */
public interface ChannelClient {

    /**
     * @throws ExternalCallException 실패 분류(RATE_LIMITED, TIMEOUT, FORBIDDEN 등)를 담은 예외
     */
    DeliveryReceipt send(String text);
}
