package com.shophub.domain.review.dto;

/**
 * 별점별 리뷰 수 집계 행.
 */
public record RatingCount(Integer rating, Long count) {
}
