package com.shophub.domain.review.service;

import com.shophub.domain.review.dto.RatingSnapshot;
import com.shophub.domain.review.entity.ModerationDecision;
import com.shophub.domain.review.entity.Review;
import com.shophub.domain.review.entity.ReviewStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 리뷰 도메인의 구조화 로그 기록기.
 *
 * 각 서비스가 생성자로 주입받아 사용한다. 로그 수집기에서 필드 단위로 검색할 수 있도록
 * 메시지는 {@code event=... key=value} 형식을 고정하며, 리뷰 본문 등 사용자 입력은 기록하지 않는다.
 */
@Component
public class ReviewEventLogger {

    private static final Logger log = LoggerFactory.getLogger(ReviewEventLogger.class);

    public void submitted(Review review) {
        log.info("event=review_submitted review_id={} product_id={} buyer_id={} rating={} verified={} images={}",
                review.getReviewId(), review.getProductId(), review.getUserId(), review.getRating(),
                review.getVerifiedPurchase(), review.getImages().size());
    }

    public void edited(Review review, boolean wasApproved) {
        log.info("event=review_edited review_id={} product_id={} buyer_id={} rating={} was_approved={}",
                review.getReviewId(), review.getProductId(), review.getUserId(), review.getRating(), wasApproved);
    }

    public void deleted(Long reviewId, Long productId, Long buyerId, int removedVotes) {
        log.info("event=review_deleted review_id={} product_id={} buyer_id={} removed_votes={}",
                reviewId, productId, buyerId, removedVotes);
    }

    public void moderated(Review review, ModerationDecision decision) {
        log.info("event=review_moderated review_id={} product_id={} decision={} status={}",
                review.getReviewId(), review.getProductId(), decision, review.getStatus());
    }

    public void bulkModerated(ModerationDecision decision, int moderatedCount, int skippedCount) {
        log.info("event=review_bulk_moderated decision={} moderated={} skipped={}",
                decision, moderatedCount, skippedCount);
    }

    public void helpfulVoted(Long reviewId, Long userId, int helpfulCount, boolean newVote) {
        if (newVote) {
            log.info("event=review_helpful review_id={} user_id={} helpful_count={} new_vote=true",
                    reviewId, userId, helpfulCount);
        } else {
            log.debug("event=review_helpful review_id={} user_id={} helpful_count={} new_vote=false",
                    reviewId, userId, helpfulCount);
        }
    }

    public void sellerResponded(Long reviewId, Long productId, Long sellerId) {
        log.info("event=review_seller_response review_id={} product_id={} seller_id={}",
                reviewId, productId, sellerId);
    }

    public void ratingRecomputed(RatingSnapshot snapshot) {
        log.info("event=product_rating_recomputed product_id={} rating_avg={} review_count={}",
                snapshot.productId(), snapshot.average(), snapshot.count());
    }

    public void notificationQueued(Long buyerId, Long reviewId, ReviewStatus status) {
        log.info("event=review_notification buyer_id={} review_id={} status={}",
                buyerId, reviewId, status);
    }
}
