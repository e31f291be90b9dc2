package com.newsdigest.bot.service;

import com.newsdigest.bot.entity.CycleOutcome;
import com.newsdigest.bot.entity.CycleTrigger;
import com.newsdigest.bot.entity.DigestCycle;
import com.newsdigest.bot.repository.DigestCycleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 사이클 실행 기록 관리
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CycleLogService {

    static final String INTERRUPTED = "interrupted";

    private final DigestCycleRepository digestCycleRepository;

    @Transactional
    public DigestCycle start(CycleTrigger trigger) {
        DigestCycle cycle = DigestCycle.builder()
                .trigger(trigger)
                .startedAt(LocalDateTime.now())
                .outcome(CycleOutcome.RUNNING)
                .build();
        return digestCycleRepository.save(cycle);
    }

    /**
     * RUNNING 상태인 기록만 완료 처리합니다.
     *
     * @return 이미 완료된 기록이면 false
     */
    @Transactional
    public boolean complete(Long cycleId, CycleStats stats) {
        int updated = digestCycleRepository.complete(
                cycleId,
                stats.outcome(),
                LocalDateTime.now(),
                stats.getItemsConsidered(),
                stats.getItemsPosted(),
                stats.getSourcesFailed(),
                stats.getBatchesPublished(),
                stats.getBatchesFailed(),
                stats.errorSummary()
        );
        if (updated == 0) {
            log.warn("Cycle {} was already completed, record left unchanged", cycleId);
            return false;
        }
        return true;
    }

    /**
     * 비정상 종료로 RUNNING에 남은 사이클을 FAILED로 닫습니다.
     */
    @Transactional
    public int closeStuckCycles() {
        return digestCycleRepository.closeRunningCycles(LocalDateTime.now(), INTERRUPTED);
    }

    @Transactional(readOnly = true)
    public Optional<DigestCycle> lastCompleted() {
        return digestCycleRepository.findFirstByOutcomeNotOrderByIdDesc(CycleOutcome.RUNNING);
    }

    @Transactional(readOnly = true)
    public Page<DigestCycle> recent(Pageable pageable) {
        return digestCycleRepository.findAllByOrderByIdDesc(pageable);
    }
}
