package com.newsdigest.bot.service;

/**
 * 오케스트레이터 진행 단계
 */
public enum CyclePhase {
    IDLE,
    RECONCILING,
    FETCHING,
    DEDUPING,
    SUMMARIZING,
    PUBLISHING,
    FINALIZING
}
