package com.newsdigest.bot.client;

import java.time.LocalDateTime;

public record DeliveryReceipt(
        String messageId,
        String chatId,
        LocalDateTime sentAt
) {
}
