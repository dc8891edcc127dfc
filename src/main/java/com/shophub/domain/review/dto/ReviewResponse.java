package com.shophub.domain.review.dto;

import com.shophub.domain.review.entity.Review;
import com.shophub.domain.review.entity.ReviewStatus;

import java.time.LocalDateTime;
import java.util.List;

public record ReviewResponse(
        Long reviewId,
        Long productId,
        Long userId,
        int rating,
        String title,
        String body,
        boolean verifiedPurchase,
        int helpfulCount,
        ReviewStatus status,
        String sellerResponse,
        LocalDateTime sellerRespondedAt,
        List<ReviewImageResponse> images,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static ReviewResponse from(Review review) {
        return new ReviewResponse(
                review.getReviewId(),
                review.getProductId(),
                review.getUserId(),
                review.getRating(),
                review.getTitle(),
                review.getBody(),
                Boolean.TRUE.equals(review.getVerifiedPurchase()),
                review.getHelpfulCount() != null ? review.getHelpfulCount() : 0,
                review.getStatus(),
                review.getSellerResponse(),
                review.getSellerRespondedAt(),
                review.getImages().stream().map(ReviewImageResponse::from).toList(),
                review.getCreatedAt(),
                review.getUpdatedAt()
        );
    }
}
