package com.newsdigest.bot.service;

import com.newsdigest.bot.entity.ItemState;
import com.newsdigest.bot.entity.NewsItem;
import com.newsdigest.bot.exception.InvalidTransitionException;
import com.newsdigest.bot.repository.NewsItemRepository;
import com.newsdigest.bot.util.Texts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 뉴스 아이템 저장소.
 *
 * 중복 판별과 아이템 상태의 유일한 기준입니다. 모든 쓰기는 메서드가 반환되기 전에 커밋됩니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ItemStore {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final NewsItemRepository newsItemRepository;

    @Transactional(readOnly = true)
    public boolean hasSeen(String sourceId, String itemKey) {
        return newsItemRepository.existsBySourceIdAndItemKey(sourceId, itemKey);
    }

    /**
     * 새 아이템을 NEW 상태로 저장합니다.
     * 유니크 제약 위반은 ALREADY_EXISTS로 반환되므로 동시에 같은 키를 넣어도 하나만 INSERTED가 됩니다.
     * 호출자의 트랜잭션에 참여하지 않아야 하므로 여기서는 트랜잭션을 열지 않습니다 (saveAndFlush가 자체 트랜잭션 사용).
     */
    public InsertResult insertNew(NewsItem item) {
        if (item.getId() != null) {
            throw new IllegalArgumentException("insertNew expects a transient item, got id=" + item.getId());
        }
        item.setState(ItemState.NEW);
        try {
            newsItemRepository.saveAndFlush(item);
            return InsertResult.INSERTED;
        } catch (DataIntegrityViolationException e) {
            log.debug("Item already stored: source={}, key={}", item.getSourceId(), item.getItemKey());
            return InsertResult.ALREADY_EXISTS;
        }
    }

    /**
     * 아이템 상태를 앞으로 이동합니다. 조건부 UPDATE 한 번으로 처리되어 읽기-수정-쓰기가 원자적입니다.
     *
     * @throws InvalidTransitionException 역방향이거나 단계를 건너뛰는 이동
     */
    @Transactional
    public MarkResult mark(String sourceId, String itemKey, ItemState newState) {
        LocalDateTime now = LocalDateTime.now();
        int updated = newState == ItemState.POSTED
                ? newsItemRepository.markPosted(sourceId, itemKey, now)
                : newsItemRepository.transitionState(sourceId, itemKey, newState, newState.allowedPredecessors(), now);
        if (updated > 0) {
            return MarkResult.OK;
        }

        Optional<NewsItem> current = newsItemRepository.findBySourceIdAndItemKey(sourceId, itemKey);
        if (current.isEmpty()) {
            return MarkResult.NOT_FOUND;
        }
        InvalidTransitionException ex =
                new InvalidTransitionException(sourceId, itemKey, current.get().getState(), newState);
        log.error("[ItemStore] {}", ex.getMessage());
        throw ex;
    }

    /**
     * 실패 횟수와 마지막 오류를 기록합니다. 상태는 바꾸지 않습니다.
     */
    @Transactional
    public void recordFailure(String sourceId, String itemKey, String error) {
        newsItemRepository.recordFailure(sourceId, itemKey, Texts.truncate(error, MAX_ERROR_LENGTH), LocalDateTime.now());
    }

    @Transactional(readOnly = true)
    public List<NewsItem> listByState(ItemState state) {
        return newsItemRepository.findByStateOrderByFetchedAtAscIdAsc(state);
    }

    @Transactional(readOnly = true)
    public Page<NewsItem> listByState(ItemState state, Pageable pageable) {
        return newsItemRepository.findByState(state, pageable);
    }

    @Transactional(readOnly = true)
    public Optional<NewsItem> find(String sourceId, String itemKey) {
        return newsItemRepository.findBySourceIdAndItemKey(sourceId, itemKey);
    }

    @Transactional(readOnly = true)
    public Map<ItemState, Long> countByState() {
        Map<ItemState, Long> counts = new EnumMap<>(ItemState.class);
        for (ItemState state : ItemState.values()) {
            counts.put(state, 0L);
        }
        for (Object[] row : newsItemRepository.countGroupByState()) {
            counts.put((ItemState) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    @Transactional(readOnly = true)
    public List<NewsItem> recentFailures(int limit) {
        return newsItemRepository.findByStateOrderByUpdatedAtDesc(ItemState.FAILED, PageRequest.of(0, limit));
    }
}
