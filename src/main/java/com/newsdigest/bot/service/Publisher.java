package com.newsdigest.bot.service;

import com.newsdigest.bot.client.ChannelClient;
import com.newsdigest.bot.client.DeliveryReceipt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * 채널 발행. 재시도 정책은 channel 설정을 따릅니다.
 * 발행은 멱등하지 않으므로 성공 후 아이템 상태 기록은 호출자가 즉시 수행해야 합니다.
 */
@Service
@Slf4j
public class Publisher {

    private final ChannelClient channelClient;
    private final RetryPolicy retryPolicy;

    public Publisher(ChannelClient channelClient,
                     @Qualifier("channelRetryPolicy") RetryPolicy retryPolicy) {
        this.channelClient = channelClient;
        this.retryPolicy = retryPolicy;
    }

    public DeliveryReceipt publish(String text) {
        DeliveryReceipt receipt = retryPolicy.execute(() -> channelClient.send(text));
        log.info("[Publisher] Message delivered: chat={}, messageId={}", receipt.chatId(), receipt.messageId());
        return receipt;
    }
}
