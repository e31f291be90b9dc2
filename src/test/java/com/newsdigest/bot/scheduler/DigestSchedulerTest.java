package com.newsdigest.bot.scheduler;

import com.newsdigest.bot.entity.CycleOutcome;
import com.newsdigest.bot.entity.CycleTrigger;
import com.newsdigest.bot.service.CycleResult;
import com.newsdigest.bot.service.DigestControlService;
import com.newsdigest.bot.service.DigestOrchestrator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.function.BooleanSupplier;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DigestSchedulerTest {

    @Mock
    private DigestOrchestrator orchestrator;

    @Mock
    private DigestControlService controlService;

    @InjectMocks
    private DigestScheduler scheduler;

    /**
     * 락을 얻은 것처럼 skip 조건을 평가한 뒤 사이클 결과를 돌려줍니다.
     */
    private void orchestratorEvaluatesSkip() {
        when(orchestrator.runCycleUnless(any(BooleanSupplier.class), eq(CycleTrigger.SCHEDULED)))
                .thenAnswer(invocation -> {
                    BooleanSupplier skip = invocation.getArgument(0);
                    if (skip.getAsBoolean()) {
                        return Optional.empty();
                    }
                    return Optional.of(new CycleResult(1L, CycleOutcome.OK, 0, 0, 0, 0, 0));
                });
    }

    @Test
    @DisplayName("예약 실행은 SCHEDULED 사이클을 실행하고 다음 실행 시각을 갱신")
    void runsScheduledCycle() {
        ReflectionTestUtils.setField(scheduler, "scheduleEnabled", true);
        orchestratorEvaluatesSkip();

        scheduler.runScheduledCycle();

        verify(orchestrator).runCycleUnless(any(BooleanSupplier.class), eq(CycleTrigger.SCHEDULED));
        verify(controlService).isPaused();
        verify(controlService).scheduledTickFinished(any(LocalDateTime.class));
    }

    @Test
    @DisplayName("일시정지 여부는 락 안에서 확인하고, 일시정지면 사이클을 건너뜀")
    void skipsWhilePaused() {
        ReflectionTestUtils.setField(scheduler, "scheduleEnabled", true);
        orchestratorEvaluatesSkip();
        when(controlService.isPaused()).thenReturn(true);

        scheduler.runScheduledCycle();

        verify(orchestrator, never()).runCycle(any());
        verify(controlService).scheduledTickFinished(any(LocalDateTime.class));
    }

    @Test
    @DisplayName("스케줄이 꺼져 있으면 건너뜀")
    void skipsWhenDisabled() {
        ReflectionTestUtils.setField(scheduler, "scheduleEnabled", false);

        scheduler.runScheduledCycle();

        verify(orchestrator, never()).runCycleUnless(any(), any());
        verify(controlService, never()).scheduledTickFinished(any());
    }

    @Test
    @DisplayName("사이클 예외는 스케줄러 밖으로 전파하지 않음")
    void swallowsCycleFailure() {
        ReflectionTestUtils.setField(scheduler, "scheduleEnabled", true);
        when(orchestrator.runCycleUnless(any(BooleanSupplier.class), eq(CycleTrigger.SCHEDULED)))
                .thenThrow(new IllegalStateException("boom"));

        scheduler.runScheduledCycle();

        verify(controlService).scheduledTickFinished(any(LocalDateTime.class));
    }
}
