package com.shophub.domain.review.dto;

import java.math.BigDecimal;
import java.util.Map;

/**
 * 상품의 승인된 리뷰 통계.
 *
 * @param distribution 별점(5→1 순서) → 리뷰 수. 리뷰가 없는 별점도 0으로 포함한다.
 */
public record ReviewStatsResponse(
        long totalCount,
        BigDecimal averageRating,
        Map<Integer, Long> distribution
) {
}
