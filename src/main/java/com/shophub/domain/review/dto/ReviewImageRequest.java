package com.shophub.domain.review.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 리뷰 이미지 첨부. 파일 업로드는 별도 저장소가 처리하며 여기서는 저장된 URI만 받는다.
 */
public record ReviewImageRequest(
    @NotBlank(message = "이미지 경로가 누락되었습니다.")
    @Size(max = 500, message = "이미지 경로는 500자 이하여야 합니다.")
    String imageUrl,
    @Size(max = 255, message = "이미지 설명은 255자 이하로 입력해주세요.")
    String caption
) {
    public static final int MAX_IMAGES_PER_BATCH = 5;
}
