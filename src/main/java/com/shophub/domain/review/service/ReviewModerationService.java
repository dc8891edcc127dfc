package com.shophub.domain.review.service;

import com.shophub.domain.review.dto.BulkModerationResponse;
import com.shophub.domain.review.dto.ReviewResponse;
import com.shophub.domain.review.entity.ModerationDecision;
import com.shophub.domain.review.entity.Review;
import com.shophub.domain.review.entity.ReviewStatus;
import com.shophub.domain.review.event.ReviewModeratedEvent;
import com.shophub.domain.review.repository.ReviewRepository;
import com.shophub.global.dto.PageResponse;
import com.shophub.global.exception.ResourceNotFoundException;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 관리자 리뷰 검수.
 *
 * <p>PENDING 리뷰만 APPROVED 또는 REJECTED로 전환할 수 있다. 승인은 승인된 리뷰 집합을 바꾸므로
 * 같은 트랜잭션에서 상품 평점을 재계산하고, 반려는 집계에 영향이 없으므로 재계산하지 않는다.</p>
 */
@Service
@Transactional(readOnly = true)
public class ReviewModerationService {

    private final ReviewRepository reviewRepository;
    private final ProductRatingAggregator productRatingAggregator;
    private final ApplicationEventPublisher eventPublisher;
    private final ReviewEventLogger reviewEventLogger;
    private final Clock clock;

    public ReviewModerationService(ReviewRepository reviewRepository,
                                   ProductRatingAggregator productRatingAggregator,
                                   ApplicationEventPublisher eventPublisher,
                                   ReviewEventLogger reviewEventLogger,
                                   Clock clock) {
        this.reviewRepository = reviewRepository;
        this.productRatingAggregator = productRatingAggregator;
        this.eventPublisher = eventPublisher;
        this.reviewEventLogger = reviewEventLogger;
        this.clock = clock;
    }

    @Transactional
    public ReviewResponse moderate(Long reviewId, ModerationDecision decision) {
        Review review = reviewRepository.findByIdWithLock(reviewId)
                .orElseThrow(() -> new ResourceNotFoundException("리뷰", reviewId));

        applyDecision(review, decision, LocalDateTime.now(clock));

        if (review.isApproved()) {
            productRatingAggregator.recompute(review.getProductId());
        }
        return ReviewResponse.from(review);
    }

    /**
     * 선택한 리뷰를 한 트랜잭션에서 일괄 검수한다.
     *
     * <p>없는 리뷰와 PENDING이 아닌 리뷰는 오류 없이 건너뛴다. 리뷰 행은 ID 오름차순으로 잠그고,
     * 상품 평점은 모든 리뷰를 처리한 뒤 상품별로 한 번씩 재계산한다 (리뷰 → 상품 잠금 순서 유지).</p>
     */
    @Transactional
    public BulkModerationResponse moderateAll(List<Long> reviewIds, ModerationDecision decision) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Long> moderatedIds = new ArrayList<>();
        List<Long> skippedIds = new ArrayList<>();
        SortedSet<Long> productIdsToRecompute = new TreeSet<>();

        for (Long reviewId : new TreeSet<>(reviewIds)) {
            Optional<Review> found = reviewRepository.findByIdWithLock(reviewId);
            if (found.isEmpty() || !found.get().getStatus().isModeratable()) {
                skippedIds.add(reviewId);
                continue;
            }

            Review review = found.get();
            applyDecision(review, decision, now);
            moderatedIds.add(reviewId);
            if (review.isApproved()) {
                productIdsToRecompute.add(review.getProductId());
            }
        }

        productIdsToRecompute.forEach(productRatingAggregator::recompute);
        reviewEventLogger.bulkModerated(decision, moderatedIds.size(), skippedIds.size());
        return new BulkModerationResponse(decision, moderatedIds, skippedIds);
    }

    private void applyDecision(Review review, ModerationDecision decision, LocalDateTime now) {
        review.moderate(decision, now);
        reviewEventLogger.moderated(review, decision);
        // 구매자 알림은 커밋 이후에 처리된다 (ReviewNotificationListener)
        eventPublisher.publishEvent(new ReviewModeratedEvent(
                review.getReviewId(), review.getProductId(), review.getUserId(), review.getStatus()));
    }

    /**
     * 검수 대기열. 오래 기다린 리뷰부터 보여준다.
     */
    public PageResponse<ReviewResponse> getPendingReviews(Pageable pageable) {
        return PageResponse.from(
                reviewRepository.findByStatusOrderByCreatedAtAscReviewIdAsc(ReviewStatus.PENDING, pageable),
                ReviewResponse::from);
    }
}
