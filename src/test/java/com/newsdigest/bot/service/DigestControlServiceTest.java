package com.newsdigest.bot.service;

import com.newsdigest.bot.config.DigestProperties;
import com.newsdigest.bot.dto.DigestStatusDto;
import com.newsdigest.bot.entity.CycleTrigger;
import com.newsdigest.bot.entity.ItemState;
import com.newsdigest.bot.entity.NewsItem;
import com.newsdigest.bot.mapper.DigestMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.TaskExecutor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DigestControlServiceTest {

    @Mock
    private DigestOrchestrator orchestrator;

    @Mock
    private ItemStore itemStore;

    @Mock
    private CycleLogService cycleLogService;

    private final List<Runnable> queued = new ArrayList<>();
    private DigestControlService controlService;

    @BeforeEach
    void setUp() {
        TaskExecutor capturingExecutor = queued::add;
        controlService = new DigestControlService(orchestrator, itemStore, cycleLogService,
                new DigestMapper(), capturingExecutor, new DigestProperties());
    }

    private void lockAvailable() {
        when(orchestrator.runExclusive(any(Duration.class), any(Runnable.class))).thenAnswer(invocation -> {
            Runnable action = invocation.getArgument(1);
            action.run();
            return true;
        });
    }

    @Test
    @DisplayName("pause 후 resume은 각각 OK, 반복 요청은 UNCHANGED")
    void pauseAndResume() {
        lockAvailable();

        assertThat(controlService.pause()).isEqualTo(ControlResult.OK);
        assertThat(controlService.isPaused()).isTrue();
        assertThat(controlService.pause()).isEqualTo(ControlResult.UNCHANGED);

        assertThat(controlService.resume()).isEqualTo(ControlResult.OK);
        assertThat(controlService.isPaused()).isFalse();
        assertThat(controlService.resume()).isEqualTo(ControlResult.UNCHANGED);

        verify(orchestrator, times(2)).runExclusive(any(Duration.class), any(Runnable.class));
    }

    @Test
    @DisplayName("사이클 진행 중 락을 얻지 못하면 BUSY, 상태는 그대로")
    void pauseWhileCycleRunningIsBusy() {
        when(orchestrator.runExclusive(any(Duration.class), any(Runnable.class))).thenReturn(false);

        ControlResult result = controlService.pause();

        assertThat(result).isEqualTo(ControlResult.BUSY);
        assertThat(controlService.isPaused()).isFalse();
    }

    @Test
    @DisplayName("trigger-now는 큐에 넣고 이미 대기 중이면 합쳐짐")
    void triggerIsQueuedAndCoalesced() {
        assertThat(controlService.triggerNow()).isEqualTo(ControlResult.QUEUED);
        assertThat(controlService.triggerNow()).isEqualTo(ControlResult.ALREADY_QUEUED);
        assertThat(queued).hasSize(1);
        verify(orchestrator, never()).runCycle(any());

        queued.get(0).run();

        verify(orchestrator).runCycle(CycleTrigger.MANUAL);
        assertThat(controlService.triggerNow()).isEqualTo(ControlResult.QUEUED);
        assertThat(queued).hasSize(2);
    }

    @Test
    @DisplayName("일시정지 중에도 수동 트리거는 실행")
    void triggerRunsWhilePaused() {
        lockAvailable();
        controlService.pause();

        controlService.triggerNow();
        queued.get(0).run();

        verify(orchestrator).runCycle(CycleTrigger.MANUAL);
    }

    @Test
    @DisplayName("트리거된 사이클이 예외를 던져도 다음 트리거를 받을 수 있음")
    void failedTriggeredCycleDoesNotBlockQueue() {
        when(orchestrator.runCycle(CycleTrigger.MANUAL)).thenThrow(new IllegalStateException("boom"));

        controlService.triggerNow();
        queued.get(0).run();

        assertThat(controlService.triggerNow()).isEqualTo(ControlResult.QUEUED);
    }

    @Test
    @DisplayName("시작 사이클은 STARTUP 트리거로 실행")
    void startupCycle() {
        controlService.triggerStartupCycle();
        queued.get(0).run();

        verify(orchestrator).runCycle(CycleTrigger.STARTUP);
    }

    @Test
    @DisplayName("status는 단계, 일시정지 여부, 상태별 건수, 최근 실패를 반환")
    void status() {
        // given
        when(orchestrator.getPhase()).thenReturn(CyclePhase.SUMMARIZING);
        when(orchestrator.getCurrentCycleId()).thenReturn(7L);
        when(cycleLogService.lastCompleted()).thenReturn(Optional.empty());
        Map<ItemState, Long> counts = new EnumMap<>(ItemState.class);
        counts.put(ItemState.POSTED, 12L);
        counts.put(ItemState.FAILED, 1L);
        when(itemStore.countByState()).thenReturn(counts);
        NewsItem failed = NewsItem.builder()
                .id(3L)
                .sourceId("feed")
                .itemKey("k")
                .title("Broken")
                .url("https://e.com/x")
                .state(ItemState.FAILED)
                .attempts(1)
                .lastError("llm AUTH_ERROR: 401")
                .build();
        when(itemStore.recentFailures(anyInt())).thenReturn(List.of(failed));

        // when
        DigestStatusDto status = controlService.status();

        // then
        assertThat(status.phase()).isEqualTo(CyclePhase.SUMMARIZING);
        assertThat(status.paused()).isFalse();
        assertThat(status.runningCycleId()).isEqualTo(7L);
        assertThat(status.scheduleEnabled()).isTrue();
        assertThat(status.intervalMs()).isEqualTo(1_800_000L);
        assertThat(status.nextScheduledRun()).isNotNull();
        assertThat(status.lastCycle()).isNull();
        assertThat(status.itemCounts()).containsEntry(ItemState.POSTED, 12L);
        assertThat(status.recentFailures()).singleElement()
                .satisfies(dto -> assertThat(dto.lastError()).contains("AUTH_ERROR"));
    }

    @Test
    @DisplayName("예약 실행이 끝나면 다음 실행 시각은 종료 시각 + 주기")
    void nextScheduledRunFollowsFixedDelay() {
        DigestProperties properties = new DigestProperties();
        properties.getSchedule().setIntervalMs(600_000);
        DigestControlService service = new DigestControlService(orchestrator, itemStore, cycleLogService,
                new DigestMapper(), queued::add, properties);
        when(cycleLogService.lastCompleted()).thenReturn(Optional.empty());
        LocalDateTime finishedAt = LocalDateTime.of(2026, 10, 19, 9, 0);

        service.scheduledTickFinished(finishedAt);

        DigestStatusDto status = service.status();
        assertThat(status.intervalMs()).isEqualTo(600_000L);
        assertThat(status.nextScheduledRun()).isEqualTo(LocalDateTime.of(2026, 10, 19, 9, 10));
    }

    @Test
    @DisplayName("스케줄이 꺼져 있으면 다음 실행 시각 없음")
    void noNextRunWhenScheduleDisabled() {
        DigestProperties properties = new DigestProperties();
        properties.getSchedule().setEnabled(false);
        DigestControlService service = new DigestControlService(orchestrator, itemStore, cycleLogService,
                new DigestMapper(), queued::add, properties);
        when(cycleLogService.lastCompleted()).thenReturn(Optional.empty());

        DigestStatusDto status = service.status();

        assertThat(status.scheduleEnabled()).isFalse();
        assertThat(status.nextScheduledRun()).isNull();
    }
}
