package com.shophub.domain.review.entity;

/**
 * 리뷰 검수 상태.
 *
 * <p>상태 전이:</p>
 * <ul>
 *   <li>PENDING → APPROVED / REJECTED : 검수(moderate)로만 가능</li>
 *   <li>APPROVED / REJECTED → PENDING : 구매자의 리뷰 수정으로만 가능</li>
 * </ul>
 * <p>APPROVED만 공개 목록과 상품 평점 집계에 포함된다.</p>
 */
public enum ReviewStatus {
    PENDING("검수대기"),
    APPROVED("승인"),
    REJECTED("반려");

    private final String label;

    ReviewStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isModeratable() {
        return this == PENDING;
    }
}
