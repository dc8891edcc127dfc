package com.shophub.domain.review.dto;

import com.shophub.domain.review.entity.ModerationDecision;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public record BulkModerationRequest(
    @NotEmpty(message = "검수할 리뷰를 선택해주세요.")
    @Size(max = BulkModerationRequest.MAX_REVIEWS, message = "한 번에 100건까지 검수할 수 있습니다.")
    List<@NotNull Long> reviewIds,
    @NotNull(message = "검수 결정(APPROVE/REJECT)이 누락되었습니다.")
    ModerationDecision decision
) {
    public static final int MAX_REVIEWS = 100;
}
