package com.shophub.domain.review.repository;

import com.shophub.domain.review.entity.ReviewHelpful;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Set;

public interface ReviewHelpfulRepository extends JpaRepository<ReviewHelpful, Long> {

    boolean existsByReviewIdAndUserId(Long reviewId, Long userId);

    @Query("SELECT rh.reviewId FROM ReviewHelpful rh WHERE rh.userId = :userId AND rh.reviewId IN :reviewIds")
    Set<Long> findHelpedReviewIdsByUserIdAndReviewIds(@Param("userId") Long userId,
                                                      @Param("reviewIds") Set<Long> reviewIds);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM ReviewHelpful rh WHERE rh.reviewId = :reviewId")
    int deleteByReviewId(@Param("reviewId") Long reviewId);
}
