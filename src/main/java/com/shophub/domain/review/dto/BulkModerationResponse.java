package com.shophub.domain.review.dto;

import com.shophub.domain.review.entity.ModerationDecision;

import java.util.List;

/**
 * 일괄 검수 결과.
 *
 * @param moderatedIds 검수가 적용된 리뷰 ID (오름차순)
 * @param skippedIds   존재하지 않거나 검수 대기 상태가 아니어서 건너뛴 리뷰 ID
 */
public record BulkModerationResponse(
        ModerationDecision decision,
        List<Long> moderatedIds,
        List<Long> skippedIds
) {
}
