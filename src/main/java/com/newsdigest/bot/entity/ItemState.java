package com.newsdigest.bot.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * 뉴스 아이템 처리 상태.
 * 상태는 앞으로만 이동하며 POSTED, FAILED는 종료 상태입니다.
 */
public enum ItemState {
    /**
     * 수집 후 요약 대기
     */
    NEW,

    /**
     * 요약 완료, 채널 발행 대기
     */
    SUMMARIZED,

    /**
     * 채널 발행 완료
     */
    POSTED,

    /**
     * 영구 실패 (재시도하지 않음)
     */
    FAILED;

    public boolean isTerminal() {
        return this == POSTED || this == FAILED;
    }

    /**
     * 이 상태로 이동할 수 있는 이전 상태 목록.
     */
    public Set<ItemState> allowedPredecessors() {
        return switch (this) {
            case NEW -> EnumSet.of(NEW);
            case SUMMARIZED -> EnumSet.of(NEW, SUMMARIZED);
            case POSTED -> EnumSet.of(SUMMARIZED);
            case FAILED -> EnumSet.of(NEW, SUMMARIZED);
        };
    }

    public boolean canTransitionTo(ItemState target) {
        return target.allowedPredecessors().contains(this);
    }
}
