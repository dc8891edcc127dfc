package com.shophub.domain.review.event;

/**
 * 리뷰가 새로 작성되어 검수 대기열에 들어갔음을 알리는 이벤트.
 */
public record ReviewSubmittedEvent(Long reviewId, Long productId, Long buyerId) {
}
