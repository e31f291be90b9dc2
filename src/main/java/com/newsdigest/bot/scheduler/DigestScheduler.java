package com.newsdigest.bot.scheduler;

import com.newsdigest.bot.entity.CycleTrigger;
import com.newsdigest.bot.service.CycleResult;
import com.newsdigest.bot.service.DigestControlService;
import com.newsdigest.bot.service.DigestOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 다이제스트 스케줄러.
 *
 * fixedDelay 방식이라 긴 사이클은 다음 실행을 뒤로 미룹니다.
 * 일시정지 여부는 사이클 락을 얻은 뒤에 확인하므로 pause가 OK를 반환한 뒤에는 예약 사이클이 시작되지 않습니다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DigestScheduler {

    private final DigestOrchestrator orchestrator;
    private final DigestControlService controlService;

    @Value("${digest.schedule.enabled:true}")
    private boolean scheduleEnabled;

    @Scheduled(fixedDelayString = "${digest.schedule.interval-ms:1800000}",
            initialDelayString = "${digest.schedule.initial-delay-ms:60000}")
    public void runScheduledCycle() {
        if (!scheduleEnabled) {
            return;
        }
        try {
            Optional<CycleResult> result = orchestrator.runCycleUnless(controlService::isPaused, CycleTrigger.SCHEDULED);
            if (result.isEmpty()) {
                log.debug("[Digest] Paused, skipping scheduled cycle");
            }
        } catch (Exception e) {
            log.error("[Digest] Scheduled cycle failed: {}", e.getMessage(), e);
        } finally {
            controlService.scheduledTickFinished(LocalDateTime.now());
        }
    }
}
