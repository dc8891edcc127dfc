package com.shophub.domain.review.dto;

import com.shophub.global.dto.PageResponse;

import java.util.Set;

/**
 * 상품별 리뷰 목록 응답. helpedReviewIds는 로그인 사용자가 이 페이지에서 도움이 돼요를 누른 리뷰 ID다.
 */
public record ProductReviewsResponse(
        ReviewStatsResponse stats,
        PageResponse<ReviewResponse> reviews,
        String sort,
        Integer ratingFilter,
        Set<Long> helpedReviewIds
) {
}
