package com.shophub.global.common;

import org.springframework.data.domain.Sort;

import java.util.Set;

/**
 * 페이지네이션/정렬/필터 파라미터를 공통 정책으로 보정한다.
 * 정책: 잘못된 값은 400을 던지지 않고 안전한 기본값으로 대체한다.
 */
public final class PagingParams {

    public static final int DEFAULT_PAGE = 0;
    public static final String DEFAULT_REVIEW_SORT = "recent";

    private static final Set<String> ALLOWED_REVIEW_SORTS = Set.of(
            "recent", "helpful", "highest", "lowest"
    );

    private PagingParams() {
    }

    public static int normalizePage(int page) {
        return Math.max(page, DEFAULT_PAGE);
    }

    public static String normalizeReviewSort(String sort) {
        if (sort == null || sort.isBlank()) {
            return DEFAULT_REVIEW_SORT;
        }
        String trimmed = sort.trim();
        return ALLOWED_REVIEW_SORTS.contains(trimmed) ? trimmed : DEFAULT_REVIEW_SORT;
    }

    /**
     * 리뷰 정렬 키를 Sort로 변환한다.
     * 모든 정렬은 작성일 내림차순, 마지막으로 리뷰 ID 내림차순을 보조 키로 둔다.
     */
    public static Sort toReviewSort(String sort) {
        Sort tieBreak = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("reviewId"));

        return switch (normalizeReviewSort(sort)) {
            case "helpful" -> Sort.by(Sort.Order.desc("helpfulCount")).and(tieBreak);
            case "highest" -> Sort.by(Sort.Order.desc("rating")).and(tieBreak);
            case "lowest" -> Sort.by(Sort.Order.asc("rating")).and(tieBreak);
            default -> tieBreak;
        };
    }

    /**
     * 별점 필터(1~5)를 보정한다. 범위를 벗어나거나 없으면 필터 없음(null).
     */
    public static Integer normalizeRatingFilter(Integer rating) {
        if (rating == null || rating < 1 || rating > 5) {
            return null;
        }
        return rating;
    }
}
