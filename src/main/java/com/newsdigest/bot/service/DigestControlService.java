package com.newsdigest.bot.service;

import com.newsdigest.bot.config.DigestProperties;
import com.newsdigest.bot.dto.DigestStatusDto;
import com.newsdigest.bot.entity.CycleTrigger;
import com.newsdigest.bot.mapper.DigestMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 관리자 제어 명령: pause, resume, trigger-now, status.
 *
 * pause/resume은 사이클 락을 잡은 뒤 적용되므로 진행 중인 사이클 중간에 끼어들지 않습니다.
 * trigger-now는 제어 실행자 큐에 들어가 진행 중인 사이클이 끝난 뒤 실행됩니다.
 */
@Service
@Slf4j
public class DigestControlService {

    private final DigestOrchestrator orchestrator;
    private final ItemStore itemStore;
    private final CycleLogService cycleLogService;
    private final DigestMapper digestMapper;
    private final TaskExecutor controlExecutor;
    private final DigestProperties properties;

    private volatile boolean paused;
    private volatile LocalDateTime nextScheduledRun;
    private final AtomicBoolean triggerQueued = new AtomicBoolean(false);

    public DigestControlService(DigestOrchestrator orchestrator,
                                ItemStore itemStore,
                                CycleLogService cycleLogService,
                                DigestMapper digestMapper,
                                @Qualifier("digestControlExecutor") TaskExecutor controlExecutor,
                                DigestProperties properties) {
        this.orchestrator = orchestrator;
        this.itemStore = itemStore;
        this.cycleLogService = cycleLogService;
        this.digestMapper = digestMapper;
        this.controlExecutor = controlExecutor;
        this.properties = properties;
        DigestProperties.Schedule schedule = properties.getSchedule();
        if (schedule.isEnabled()) {
            this.nextScheduledRun = LocalDateTime.now().plus(Duration.ofMillis(schedule.getInitialDelayMs()));
        }
    }

    public boolean isPaused() {
        return paused;
    }

    public ControlResult pause() {
        return setPaused(true);
    }

    public ControlResult resume() {
        return setPaused(false);
    }

    private ControlResult setPaused(boolean target) {
        if (paused == target) {
            return ControlResult.UNCHANGED;
        }
        Duration timeout = Duration.ofSeconds(properties.getControl().getLockTimeoutSeconds());
        boolean applied = orchestrator.runExclusive(timeout, () -> paused = target);
        if (!applied) {
            log.info("[Control] {} rejected, cycle in progress", target ? "Pause" : "Resume");
            return ControlResult.BUSY;
        }
        log.info("[Control] Digest scheduling {}", target ? "paused" : "resumed");
        return ControlResult.OK;
    }

    /**
     * 수동 사이클 요청. 일시정지 상태와 무관하게 실행됩니다.
     */
    public ControlResult triggerNow() {
        return trigger(CycleTrigger.MANUAL);
    }

    ControlResult trigger(CycleTrigger trigger) {
        if (!triggerQueued.compareAndSet(false, true)) {
            log.info("[Control] Trigger already queued, coalescing");
            return ControlResult.ALREADY_QUEUED;
        }
        controlExecutor.execute(() -> {
            triggerQueued.set(false);
            try {
                orchestrator.runCycle(trigger);
            } catch (Exception e) {
                log.error("[Control] Triggered cycle failed: {}", e.getMessage(), e);
            }
        });
        log.info("[Control] {} cycle queued", trigger);
        return ControlResult.QUEUED;
    }

    /**
     * 시작 직후 1회 실행 (digest.schedule.run-on-startup)
     */
    public ControlResult triggerStartupCycle() {
        return trigger(CycleTrigger.STARTUP);
    }

    /**
     * 예약 실행이 끝날 때마다 스케줄러가 호출합니다. fixedDelay 기준으로 다음 실행 시각을 계산합니다.
     */
    public void scheduledTickFinished(LocalDateTime finishedAt) {
        nextScheduledRun = finishedAt.plus(Duration.ofMillis(properties.getSchedule().getIntervalMs()));
    }

    public DigestStatusDto status() {
        DigestProperties.Schedule schedule = properties.getSchedule();
        return new DigestStatusDto(
                orchestrator.getPhase(),
                paused,
                triggerQueued.get(),
                schedule.isEnabled(),
                schedule.getIntervalMs(),
                schedule.isEnabled() ? nextScheduledRun : null,
                orchestrator.getCurrentCycleId(),
                cycleLogService.lastCompleted().map(digestMapper::toCycleDto).orElse(null),
                itemStore.countByState(),
                itemStore.recentFailures(properties.getControl().getRecentFailuresLimit()).stream()
                        .map(digestMapper::toItemDto)
                        .toList()
        );
    }
}
