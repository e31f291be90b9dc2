package com.newsdigest.bot.service.source;

import java.time.LocalDateTime;

/**
 * 소스 어댑터가 반환하는 수집 후보 아이템
 *
 * @param nativeId    소스 고유 ID (텔레그램 메시지 ID 등, 없으면 null)
 * @param title       제목
 * @param url         원문 링크
 * @param content     본문 또는 요약 발췌
 * @param publishedAt 발행 시각 (알 수 없으면 null)
 */
public record RawItem(
        String nativeId,
        String title,
        String url,
        String content,
        LocalDateTime publishedAt
) {
}
