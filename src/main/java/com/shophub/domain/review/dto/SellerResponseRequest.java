package com.shophub.domain.review.dto;

import com.shophub.domain.review.entity.Review;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SellerResponseRequest(
    @NotBlank(message = "답변 내용을 입력해주세요.")
    @Size(max = Review.SELLER_RESPONSE_MAX_LENGTH, message = "답변은 1,000자 이하로 입력해주세요.")
    String response
) {}
