package com.shophub.domain.review.dto;

import java.math.BigDecimal;

/**
 * 재계산 직후 상품 행에 기록된 평점 집계 값.
 *
 * @param average 승인된 리뷰 평점의 산술 평균 (소수 둘째 자리 HALF_UP, 없으면 0.00)
 * @param count   승인된 리뷰 수
 */
public record RatingSnapshot(Long productId, BigDecimal average, int count) {
}
