package com.shophub.domain.review.dto;

import com.shophub.domain.review.entity.Review;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * 리뷰 작성 요청.
 *
 * orderItemId는 선택값이다. 주어지면 배송 완료된 본인 주문 항목인지 검증하고
 * 구매 인증(verifiedPurchase) 여부를 판단하는 근거로 사용한다.
 */
public record ReviewCreateRequest(
    @NotNull(message = "상품 정보가 누락되었습니다.")
    Long productId,
    Long orderItemId,
    @Min(value = 1, message = "평점은 1점 이상이어야 합니다.")
    @Max(value = 5, message = "평점은 5점 이하여야 합니다.")
    int rating,
    @NotBlank(message = "리뷰 제목을 입력해주세요.")
    @Size(max = Review.TITLE_MAX_LENGTH, message = "리뷰 제목은 255자 이하로 입력해주세요.")
    String title,
    @NotBlank(message = "리뷰 내용을 입력해주세요.")
    @Size(max = Review.BODY_MAX_LENGTH, message = "리뷰 내용은 5,000자 이하로 입력해주세요.")
    String body,
    @Size(max = ReviewImageRequest.MAX_IMAGES_PER_BATCH, message = "리뷰 이미지는 한 번에 5장까지 첨부할 수 있습니다.")
    List<@Valid ReviewImageRequest> images
) {
    public List<ReviewImageRequest> imagesOrEmpty() {
        return images == null ? List.of() : images;
    }
}
