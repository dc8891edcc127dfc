package com.shophub.domain.review.repository;

import com.shophub.domain.review.dto.RatingCount;
import com.shophub.domain.review.entity.Review;
import com.shophub.domain.review.entity.ReviewStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ReviewRepository extends JpaRepository<Review, Long> {

    /**
     * 리뷰 행을 PESSIMISTIC_WRITE로 잠근다.
     * 수정/삭제/검수/도움이 돼요/판매자 답변은 모두 이 잠금을 먼저 잡아
     * 같은 리뷰에 대한 상태 변경과 카운트 증가가 교차 실행되지 않도록 직렬화한다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Review r WHERE r.reviewId = :reviewId")
    Optional<Review> findByIdWithLock(@Param("reviewId") Long reviewId);

    boolean existsByUserIdAndProductId(Long userId, Long productId);

    Page<Review> findByProductIdAndStatus(Long productId, ReviewStatus status, Pageable pageable);

    Page<Review> findByProductIdAndStatusAndRating(Long productId, ReviewStatus status, Integer rating, Pageable pageable);

    Page<Review> findByUserIdOrderByCreatedAtDesc(Long userId, Pageable pageable);

    Page<Review> findByStatusOrderByCreatedAtAscReviewIdAsc(ReviewStatus status, Pageable pageable);

    @Query("SELECT AVG(r.rating) FROM Review r WHERE r.productId = :productId AND r.status = :status")
    Optional<Double> findAverageRating(@Param("productId") Long productId, @Param("status") ReviewStatus status);

    long countByProductIdAndStatus(Long productId, ReviewStatus status);

    long countByProductIdAndStatusAndRating(Long productId, ReviewStatus status, Integer rating);

    @Query("""
            SELECT new com.shophub.domain.review.dto.RatingCount(r.rating, COUNT(r))
            FROM Review r
            WHERE r.productId = :productId AND r.status = :status
            GROUP BY r.rating
            """)
    List<RatingCount> countGroupByRating(@Param("productId") Long productId, @Param("status") ReviewStatus status);

    /**
     * helpful_count를 DB에서 원자적으로 1 증가시킨다.
     * 엔티티 필드 증가(read-modify-write)와 달리 동시 요청에서도 증가분이 유실되지 않는다.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Review r SET r.helpfulCount = r.helpfulCount + 1 WHERE r.reviewId = :reviewId")
    int incrementHelpfulCount(@Param("reviewId") Long reviewId);

    @Query("SELECT r.helpfulCount FROM Review r WHERE r.reviewId = :reviewId")
    Optional<Integer> findHelpfulCountById(@Param("reviewId") Long reviewId);
}
