package com.newsdigest.bot.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 다이제스트 사이클 실행 기록.
 * 시작 시 RUNNING으로 저장되고 종료 시 한 번만 완료 처리됩니다.
 */
@Entity
@Table(name = "digest_cycles", indexes = {
        @Index(name = "idx_digest_cycles_outcome", columnList = "outcome"),
        @Index(name = "idx_digest_cycles_started_at", columnList = "started_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DigestCycle {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "cycle_trigger", nullable = false, length = 16)
    @Builder.Default
    private CycleTrigger trigger = CycleTrigger.SCHEDULED;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "finished_at")
    private LocalDateTime finishedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private CycleOutcome outcome = CycleOutcome.RUNNING;

    @Column(name = "items_considered")
    @Builder.Default
    private Integer itemsConsidered = 0;

    @Column(name = "items_posted")
    @Builder.Default
    private Integer itemsPosted = 0;

    @Column(name = "sources_failed")
    @Builder.Default
    private Integer sourcesFailed = 0;

    @Column(name = "batches_published")
    @Builder.Default
    private Integer batchesPublished = 0;

    @Column(name = "batches_failed")
    @Builder.Default
    private Integer batchesFailed = 0;

    @Column(name = "error_summary", length = 2048)
    private String errorSummary;

    public boolean isRunning() {
        return outcome == CycleOutcome.RUNNING;
    }
}
