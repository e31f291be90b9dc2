package com.newsdigest.bot.config;

import com.newsdigest.bot.service.DigestControlService;
import com.newsdigest.bot.service.DigestOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 애플리케이션 시작 시 이전 실행의 상태를 정리합니다.
 * 첫 예약 실행(initial-delay) 전에 실행됩니다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DigestStartupInitializer {

    private final DigestOrchestrator orchestrator;
    private final DigestControlService controlService;

    @Value("${digest.schedule.run-on-startup:false}")
    private boolean runOnStartup;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        log.info("[Digest] Reconciling state from previous run");
        orchestrator.reconcile();
        if (runOnStartup) {
            controlService.triggerStartupCycle();
        }
    }
}
