package com.newsdigest.bot.service;

/**
 * 제어 명령 처리 결과
 */
public enum ControlResult {
    /**
     * 명령 적용됨
     */
    OK,

    /**
     * 이미 요청한 상태
     */
    UNCHANGED,

    /**
     * 진행 중인 사이클 때문에 시간 안에 적용하지 못함
     */
    BUSY,

    /**
     * 트리거가 큐에 들어감
     */
    QUEUED,

    /**
     * 이미 대기 중인 트리거가 있어 합쳐짐
     */
    ALREADY_QUEUED
}
