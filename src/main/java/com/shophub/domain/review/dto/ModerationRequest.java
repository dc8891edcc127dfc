package com.shophub.domain.review.dto;

import com.shophub.domain.review.entity.ModerationDecision;
import jakarta.validation.constraints.NotNull;

public record ModerationRequest(
    @NotNull(message = "검수 결정(APPROVE/REJECT)이 누락되었습니다.")
    ModerationDecision decision
) {}
