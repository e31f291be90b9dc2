package com.newsdigest.bot.repository;

import com.newsdigest.bot.entity.ItemState;
import com.newsdigest.bot.entity.NewsItem;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface NewsItemRepository extends JpaRepository<NewsItem, Long> {

    boolean existsBySourceIdAndItemKey(String sourceId, String itemKey);

    Optional<NewsItem> findBySourceIdAndItemKey(String sourceId, String itemKey);

    /**
     * Pending items in fetch order (crash recovery and carry-over)
     */
    List<NewsItem> findByStateOrderByFetchedAtAscIdAsc(ItemState state);

    Page<NewsItem> findByState(ItemState state, Pageable pageable);

    List<NewsItem> findByStateOrderByUpdatedAtDesc(ItemState state, Pageable pageable);

    /**
     * Conditional state change. Returns 0 when the row is missing or not in an allowed predecessor state.
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE NewsItem i SET i.state = :target, i.updatedAt = :now " +
            "WHERE i.sourceId = :sourceId AND i.itemKey = :itemKey AND i.state IN :allowedFrom")
    int transitionState(@Param("sourceId") String sourceId,
                        @Param("itemKey") String itemKey,
                        @Param("target") ItemState target,
                        @Param("allowedFrom") Collection<ItemState> allowedFrom,
                        @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE NewsItem i SET i.state = 'POSTED', i.postedAt = :now, i.updatedAt = :now " +
            "WHERE i.sourceId = :sourceId AND i.itemKey = :itemKey AND i.state = 'SUMMARIZED'")
    int markPosted(@Param("sourceId") String sourceId,
                   @Param("itemKey") String itemKey,
                   @Param("now") LocalDateTime now);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE NewsItem i SET i.attempts = i.attempts + 1, i.lastError = :error, i.updatedAt = :now " +
            "WHERE i.sourceId = :sourceId AND i.itemKey = :itemKey")
    int recordFailure(@Param("sourceId") String sourceId,
                      @Param("itemKey") String itemKey,
                      @Param("error") String error,
                      @Param("now") LocalDateTime now);

    @Query("SELECT i.state, COUNT(i) FROM NewsItem i GROUP BY i.state")
    List<Object[]> countGroupByState();
}
