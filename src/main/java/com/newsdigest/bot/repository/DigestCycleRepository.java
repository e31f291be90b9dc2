package com.newsdigest.bot.repository;

import com.newsdigest.bot.entity.CycleOutcome;
import com.newsdigest.bot.entity.DigestCycle;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

@Repository
public interface DigestCycleRepository extends JpaRepository<DigestCycle, Long> {

    Page<DigestCycle> findAllByOrderByIdDesc(Pageable pageable);

    Optional<DigestCycle> findFirstByOutcomeNotOrderByIdDesc(CycleOutcome outcome);

    long countByOutcome(CycleOutcome outcome);

    /**
     * Completes a running cycle. A finished record is never touched again.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DigestCycle c SET c.outcome = :outcome, c.finishedAt = :finishedAt, " +
            "c.itemsConsidered = :itemsConsidered, c.itemsPosted = :itemsPosted, " +
            "c.sourcesFailed = :sourcesFailed, c.batchesPublished = :batchesPublished, " +
            "c.batchesFailed = :batchesFailed, c.errorSummary = :errorSummary " +
            "WHERE c.id = :id AND c.outcome = 'RUNNING'")
    int complete(@Param("id") Long id,
                 @Param("outcome") CycleOutcome outcome,
                 @Param("finishedAt") LocalDateTime finishedAt,
                 @Param("itemsConsidered") int itemsConsidered,
                 @Param("itemsPosted") int itemsPosted,
                 @Param("sourcesFailed") int sourcesFailed,
                 @Param("batchesPublished") int batchesPublished,
                 @Param("batchesFailed") int batchesFailed,
                 @Param("errorSummary") String errorSummary);

    /**
     * Closes cycles left RUNNING by a crash
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DigestCycle c SET c.outcome = 'FAILED', c.finishedAt = :now, c.errorSummary = :reason " +
            "WHERE c.outcome = 'RUNNING'")
    int closeRunningCycles(@Param("now") LocalDateTime now, @Param("reason") String reason);
}
