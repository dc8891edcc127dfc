package com.shophub.domain.review.dto;

import com.shophub.domain.review.entity.Review;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * 리뷰 수정 요청.
 *
 * 상품·주문 항목은 변경 불가이므로 포함하지 않는다.
 * null 필드는 기존 값을 유지하며, 새 이미지는 기존 이미지 뒤에 추가된다.
 */
public record ReviewUpdateRequest(
    @Min(value = 1, message = "평점은 1점 이상이어야 합니다.")
    @Max(value = 5, message = "평점은 5점 이하여야 합니다.")
    Integer rating,
    @Size(max = Review.TITLE_MAX_LENGTH, message = "리뷰 제목은 255자 이하로 입력해주세요.")
    @Pattern(regexp = "(?s)^(?!\\s*$).+", message = "리뷰 제목은 공백만 입력할 수 없습니다.")
    String title,
    @Size(max = Review.BODY_MAX_LENGTH, message = "리뷰 내용은 5,000자 이하로 입력해주세요.")
    @Pattern(regexp = "(?s)^(?!\\s*$).+", message = "리뷰 내용은 공백만 입력할 수 없습니다.")
    String body,
    @Size(max = ReviewImageRequest.MAX_IMAGES_PER_BATCH, message = "리뷰 이미지는 한 번에 5장까지 첨부할 수 있습니다.")
    List<@Valid ReviewImageRequest> images
) {
    public List<ReviewImageRequest> imagesOrEmpty() {
        return images == null ? List.of() : images;
    }
}
