package com.shophub.domain.review.event;

import com.shophub.domain.review.entity.ReviewStatus;

/**
 * 리뷰 검수(승인/반려)가 끝났음을 알리는 이벤트. 커밋 이후 구매자 알림에 사용된다.
 */
public record ReviewModeratedEvent(Long reviewId, Long productId, Long buyerId, ReviewStatus status) {
}
