package com.shophub.domain.review.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;

/**
 * "도움이 돼요" 투표. (리뷰, 사용자)당 하나만 존재하며 행의 존재 자체가 투표다.
 */
@Entity
@Table(name = "review_helpfuls",
       uniqueConstraints = @UniqueConstraint(name = "uk_review_helpfuls_review_user",
                                             columnNames = {"review_id", "user_id"}))
public class ReviewHelpful {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "helpful_id")
    private Long helpfulId;

    @Column(name = "review_id", nullable = false)
    private Long reviewId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    protected ReviewHelpful() {}

    public ReviewHelpful(Long reviewId, Long userId, LocalDateTime createdAt) {
        this.reviewId = reviewId;
        this.userId = userId;
        this.createdAt = createdAt;
    }

    public Long getHelpfulId() { return helpfulId; }
    public Long getReviewId() { return reviewId; }
    public Long getUserId() { return userId; }
    public LocalDateTime getCreatedAt() { return createdAt; }
}
