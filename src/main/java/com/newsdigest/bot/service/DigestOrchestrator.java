package com.newsdigest.bot.service;

import com.newsdigest.bot.config.DigestProperties;
import com.newsdigest.bot.entity.CycleTrigger;
import com.newsdigest.bot.entity.DigestCycle;
import com.newsdigest.bot.entity.ItemState;
import com.newsdigest.bot.entity.NewsItem;
import com.newsdigest.bot.exception.ExternalCallException;
import com.newsdigest.bot.exception.SourceUnavailableException;
import com.newsdigest.bot.exception.StoreInvariantViolationException;
import com.newsdigest.bot.service.source.KeywordFilter;
import com.newsdigest.bot.service.source.RawItem;
import com.newsdigest.bot.service.source.SourceAdapter;
import com.newsdigest.bot.service.source.SourceAdapterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * 다이제스트 사이클 실행기.
 *
 * 수집(FETCHING) → 중복 제거(DEDUPING) → 요약(SUMMARIZING) → 발행(PUBLISHING) → 기록(FINALIZING).
 * 모든 사이클은 하나의 락 안에서 실행되어 서로 겹치지 않습니다.
 * 이전 사이클에서 남은 NEW/SUMMARIZED 아이템은 새 아이템 앞에 붙어 다시 처리됩니다.
 */
@Service
@Slf4j
public class DigestOrchestrator {

    private final ItemStore itemStore;
    private final Deduplicator deduplicator;
    private final SourceAdapterRegistry sourceAdapterRegistry;
    private final BatchPlanner batchPlanner;
    private final Summarizer summarizer;
    private final DigestMessageFormatter messageFormatter;
    private final Publisher publisher;
    private final CycleLogService cycleLogService;
    private final FatalErrorHandler fatalErrorHandler;
    private final AsyncTaskExecutor fetchExecutor;
    private final DigestProperties properties;

    private final ReentrantLock cycleLock = new ReentrantLock(true);
    private volatile CyclePhase phase = CyclePhase.IDLE;
    private volatile Long currentCycleId;

    public DigestOrchestrator(ItemStore itemStore,
                              Deduplicator deduplicator,
                              SourceAdapterRegistry sourceAdapterRegistry,
                              BatchPlanner batchPlanner,
                              Summarizer summarizer,
                              DigestMessageFormatter messageFormatter,
                              Publisher publisher,
                              CycleLogService cycleLogService,
                              FatalErrorHandler fatalErrorHandler,
                              @Qualifier("sourceFetchExecutor") AsyncTaskExecutor fetchExecutor,
                              DigestProperties properties) {
        this.itemStore = itemStore;
        this.deduplicator = deduplicator;
        this.sourceAdapterRegistry = sourceAdapterRegistry;
        this.batchPlanner = batchPlanner;
        this.summarizer = summarizer;
        this.messageFormatter = messageFormatter;
        this.publisher = publisher;
        this.cycleLogService = cycleLogService;
        this.fatalErrorHandler = fatalErrorHandler;
        this.fetchExecutor = fetchExecutor;
        this.properties = properties;
    }

    public CyclePhase getPhase() {
        return phase;
    }

    public Long getCurrentCycleId() {
        return currentCycleId;
    }

    /**
     * 사이클을 실행합니다. 다른 사이클이 진행 중이면 끝날 때까지 기다립니다.
     */
    public CycleResult runCycle(CycleTrigger trigger) {
        return runCycleUnless(() -> false, trigger).orElseThrow();
    }

    /**
     * 락을 얻은 뒤 skip 조건을 확인하고, 참이 아니면 사이클을 실행합니다.
     * 조건 확인과 사이클 시작 사이에 pause 같은 runExclusive 작업이 끼어들 수 없습니다.
     *
     * @return 건너뛰었으면 empty
     */
    public Optional<CycleResult> runCycleUnless(BooleanSupplier skip, CycleTrigger trigger) {
        cycleLock.lock();
        try {
            if (skip.getAsBoolean()) {
                return Optional.empty();
            }
            return Optional.of(doRunCycle(trigger));
        } finally {
            phase = CyclePhase.IDLE;
            currentCycleId = null;
            cycleLock.unlock();
        }
    }

    /**
     * 사이클 락을 잡은 상태로 action을 실행합니다.
     *
     * @return timeout 안에 락을 얻지 못하면 false
     */
    public boolean runExclusive(Duration timeout, Runnable action) {
        boolean acquired;
        try {
            acquired = cycleLock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        if (!acquired) {
            return false;
        }
        try {
            action.run();
            return true;
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * 시작 시 정리: 멈춘 사이클 기록을 닫고 재처리 대상 아이템 수를 보고합니다.
     * 재처리 대상은 다음 사이클의 carry-over 단계에서 처리됩니다.
     */
    public void reconcile() {
        cycleLock.lock();
        try {
            phase = CyclePhase.RECONCILING;
            int closed = cycleLogService.closeStuckCycles();
            if (closed > 0) {
                log.warn("[Digest] Closed {} interrupted cycle(s) as FAILED", closed);
            }
            int pendingNew = itemStore.listByState(ItemState.NEW).size();
            int pendingSummarized = itemStore.listByState(ItemState.SUMMARIZED).size();
            if (pendingNew + pendingSummarized > 0) {
                log.info("[Digest] Re-queued from previous run: {} NEW, {} SUMMARIZED", pendingNew, pendingSummarized);
            }
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            fatalErrorHandler.storeUnavailable(e);
        } finally {
            phase = CyclePhase.IDLE;
            cycleLock.unlock();
        }
    }

    private CycleResult doRunCycle(CycleTrigger trigger) {
        DigestCycle cycle;
        try {
            cycle = cycleLogService.start(trigger);
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException | TransientDataAccessException e) {
            fatalErrorHandler.storeUnavailable(e);
            throw e;
        }
        currentCycleId = cycle.getId();
        CycleStats stats = new CycleStats();
        log.info("[Digest] Cycle {} started (trigger={})", cycle.getId(), trigger);

        try {
            phase = CyclePhase.FETCHING;
            Map<String, List<RawItem>> fetched = fetchAll(stats);

            phase = CyclePhase.DEDUPING;
            List<NewsItem> pending = carriedOver();
            List<NewsItem> fresh = new ArrayList<>();
            fetched.forEach((sourceId, items) -> fresh.addAll(deduplicator.filterNew(sourceId, items)));

            List<NewsItem> toProcess = new ArrayList<>(pending);
            toProcess.addAll(fresh);
            stats.itemsConsidered(toProcess.size());
            log.info("[Digest] Cycle {}: {} carried over, {} new", cycle.getId(), pending.size(), fresh.size());

            if (!toProcess.isEmpty()) {
                for (PostBatch batch : batchPlanner.plan("c" + cycle.getId(), toProcess)) {
                    processBatch(batch, stats);
                }
            }
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException | TransientDataAccessException e) {
            stats.aborted("item store unavailable: " + e.getMessage());
            fatalErrorHandler.storeUnavailable(e);
            throw e;
        } catch (RuntimeException e) {
            log.error("[Digest] Cycle {} aborted: {}", cycle.getId(), e.getMessage(), e);
            stats.aborted("aborted: " + e.getMessage());
        } finally {
            phase = CyclePhase.FINALIZING;
            finish(cycle.getId(), stats);
        }

        CycleResult result = CycleResult.of(cycle.getId(), stats);
        log.info("[Digest] Cycle {} finished: outcome={}, considered={}, posted={}, sourcesFailed={}, batchesFailed={}",
                cycle.getId(), result.outcome(), result.itemsConsidered(), result.itemsPosted(),
                result.sourcesFailed(), result.batchesFailed());
        return result;
    }

    private void finish(Long cycleId, CycleStats stats) {
        try {
            cycleLogService.complete(cycleId, stats);
        } catch (RuntimeException e) {
            log.error("[Digest] Failed to record completion of cycle {}: {}", cycleId, e.getMessage(), e);
        }
    }

    /**
     * 소스별 수집을 병렬로 실행합니다. 실패하거나 시간 초과된 소스는 이번 사이클에서 제외됩니다.
     * 결과는 설정 순서를 유지합니다.
     */
    private Map<String, List<RawItem>> fetchAll(CycleStats stats) {
        Map<SourceAdapter, Future<List<RawItem>>> futures = new LinkedHashMap<>();
        for (SourceAdapter adapter : sourceAdapterRegistry.adapters()) {
            futures.put(adapter, fetchExecutor.submit(adapter::fetch));
        }

        int timeoutSeconds = properties.getFetch().getTimeoutSeconds();
        Map<String, List<RawItem>> results = new LinkedHashMap<>();
        for (Map.Entry<SourceAdapter, Future<List<RawItem>>> entry : futures.entrySet()) {
            SourceAdapter adapter = entry.getKey();
            Future<List<RawItem>> future = entry.getValue();
            try {
                List<RawItem> items = future.get(timeoutSeconds, TimeUnit.SECONDS);
                List<RawItem> relevant = KeywordFilter.apply(adapter.source().getKeywords(), items);
                results.put(adapter.sourceId(), relevant);
                stats.sourceSucceeded();
                log.debug("[Digest] Source {} returned {} items ({} after keyword filter)",
                        adapter.sourceId(), items.size(), relevant.size());
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("[Digest] Source {} timed out after {}s, skipping", adapter.sourceId(), timeoutSeconds);
                stats.sourceFailed(adapter.sourceId(), "timeout");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof SourceUnavailableException) {
                    log.warn("[Digest] Source {} unavailable, skipping: {}", adapter.sourceId(), cause.getMessage());
                } else {
                    log.error("[Digest] Source {} failed: {}", adapter.sourceId(), cause.getMessage(), cause);
                }
                stats.sourceFailed(adapter.sourceId(), cause.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                stats.sourceFailed(adapter.sourceId(), "interrupted");
            }
        }
        return results;
    }

    /**
     * 이전 사이클에서 끝나지 않은 아이템 (수집 순서)
     */
    private List<NewsItem> carriedOver() {
        List<NewsItem> pending = new ArrayList<>(itemStore.listByState(ItemState.SUMMARIZED));
        pending.addAll(itemStore.listByState(ItemState.NEW));
        pending.sort(Comparator.comparing(NewsItem::getFetchedAt, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(NewsItem::getId, Comparator.nullsLast(Comparator.naturalOrder())));
        return pending;
    }

    private void processBatch(PostBatch batch, CycleStats stats) {
        phase = CyclePhase.SUMMARIZING;
        String summary;
        try {
            summary = summarizer.summarize(batch);
        } catch (ExternalCallException e) {
            handleBatchFailure(batch, e, stats);
            return;
        }
        markAll(batch, ItemState.SUMMARIZED);

        phase = CyclePhase.PUBLISHING;
        String message = messageFormatter.format(summary, batch.items());
        try {
            publisher.publish(message);
        } catch (ExternalCallException e) {
            handleBatchFailure(batch, e, stats);
            return;
        }

        // 발행 직후 바로 기록. 여기서 실패하면 다음 사이클에서 중복 발행될 수 있음
        try {
            markAll(batch, ItemState.POSTED);
        } catch (RuntimeException e) {
            log.warn("[Digest] Batch {} was published but POSTED could not be recorded; it may be posted again",
                    batch.batchId());
            throw e;
        }
        stats.batchPublished(batch.size());
        log.info("[Digest] Batch {} published ({} items)", batch.batchId(), batch.size());
    }

    /**
     * transient 실패: 상태 유지, 다음 사이클에서 재시도.
     * permanent 실패: FAILED로 종료.
     */
    private void handleBatchFailure(PostBatch batch, ExternalCallException e, CycleStats stats) {
        String reason = e.getService() + " " + e.getKind() + ": " + e.getMessage();
        if (e.isTransient()) {
            log.warn("[Digest] Batch {} failed after retries, will retry next cycle: {}", batch.batchId(), reason);
        } else {
            log.error("[Digest] Batch {} failed permanently: {}", batch.batchId(), reason);
        }

        for (NewsItem item : batch.items()) {
            itemStore.recordFailure(item.getSourceId(), item.getItemKey(), reason);
            if (!e.isTransient()) {
                markItem(item, ItemState.FAILED);
            }
        }
        stats.batchFailed(batch.batchId(), reason);
    }

    private void markAll(PostBatch batch, ItemState state) {
        for (NewsItem item : batch.items()) {
            markItem(item, state);
        }
    }

    private void markItem(NewsItem item, ItemState state) {
        try {
            MarkResult result = itemStore.mark(item.getSourceId(), item.getItemKey(), state);
            if (result == MarkResult.NOT_FOUND) {
                log.error("[Digest] Item {}/{} disappeared from the store", item.getSourceId(), item.getItemKey());
            } else {
                item.setState(state);
            }
        } catch (StoreInvariantViolationException e) {
            // 해당 아이템 작업만 중단
            log.error("[Digest] {}", e.getMessage(), e);
        }
    }
}
