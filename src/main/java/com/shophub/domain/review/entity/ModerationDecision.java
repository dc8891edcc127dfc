package com.shophub.domain.review.entity;

public enum ModerationDecision {
    APPROVE(ReviewStatus.APPROVED),
    REJECT(ReviewStatus.REJECTED);

    private final ReviewStatus targetStatus;

    ModerationDecision(ReviewStatus targetStatus) {
        this.targetStatus = targetStatus;
    }

    public ReviewStatus getTargetStatus() {
        return targetStatus;
    }
}
