package com.shophub.domain.review.dto;

import com.shophub.domain.review.entity.ReviewImage;

public record ReviewImageResponse(
        Long imageId,
        String imageUrl,
        String caption,
        int displayOrder
) {
    public static ReviewImageResponse from(ReviewImage image) {
        return new ReviewImageResponse(
                image.getImageId(),
                image.getImageUrl(),
                image.getCaption(),
                image.getDisplayOrder()
        );
    }
}
