package com.newsdigest.bot.entity;

/**
 * 다이제스트 사이클 결과
 */
public enum CycleOutcome {
    /**
     * 진행 중 (finishedAt 미기록)
     */
    RUNNING,

    /**
     * 모든 소스/배치 성공
     */
    OK,

    /**
     * 일부 소스 또는 배치 실패
     */
    PARTIAL,

    /**
     * 시도한 작업 전부 실패
     */
    FAILED
}
