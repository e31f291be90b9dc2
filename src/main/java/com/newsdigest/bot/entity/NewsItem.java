package com.newsdigest.bot.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * 소스에서 수집한 뉴스 아이템.
 * (sourceId, itemKey) 조합은 유일하며 같은 아이템을 다시 수집해도 행이 추가되지 않습니다.
 */
@Entity
@Table(name = "news_items",
        uniqueConstraints = @UniqueConstraint(name = "uk_news_items_source_key", columnNames = {"source_id", "item_key"}),
        indexes = {
                @Index(name = "idx_news_items_state", columnList = "state"),
                @Index(name = "idx_news_items_fetched_at", columnList = "fetched_at")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NewsItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_id", nullable = false, length = 128)
    private String sourceId;

    @Column(name = "item_key", nullable = false, length = 64)
    private String itemKey;

    @Column(nullable = false, length = 1024)
    private String title;

    @Column(length = 2048)
    private String url;

    @Column(columnDefinition = "TEXT")
    private String content;

    @Column(name = "published_at")
    private LocalDateTime publishedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    @Builder.Default
    private ItemState state = ItemState.NEW;

    @Column(nullable = false)
    @Builder.Default
    private Integer attempts = 0;

    @Column(name = "last_error", length = 1024)
    private String lastError;

    @CreationTimestamp
    @Column(name = "fetched_at", nullable = false, updatable = false)
    private LocalDateTime fetchedAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "posted_at")
    private LocalDateTime postedAt;
}
