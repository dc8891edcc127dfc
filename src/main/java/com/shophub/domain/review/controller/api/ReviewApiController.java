package com.shophub.domain.review.controller.api;

import com.shophub.domain.review.dto.HelpfulVoteResponse;
import com.shophub.domain.review.dto.ProductReviewsResponse;
import com.shophub.domain.review.dto.ReviewCreateRequest;
import com.shophub.domain.review.dto.ReviewResponse;
import com.shophub.domain.review.dto.ReviewUpdateRequest;
import com.shophub.domain.review.dto.ReviewableOrderItemResponse;
import com.shophub.domain.review.dto.SellerResponseRequest;
import com.shophub.domain.review.service.ReviewQueryService;
import com.shophub.domain.review.service.ReviewService;
import com.shophub.global.dto.ApiResponse;
import com.shophub.global.dto.PageResponse;
import com.shophub.global.security.SecurityUtil;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 리뷰 REST API 컨트롤러.
 *
 * 상품별 리뷰 조회(GET)는 공개 API이며, 그 외 /api/v1/reviews/** 경로는 인증된 사용자만 가능하다.
 * 판매자 답변은 SecurityConfig에서 ROLE_SELLER로 제한하고, 상품 소유 여부는 서비스에서 확인한다.
 */
@RestController
@RequestMapping("/api/v1")
public class ReviewApiController {

    private final ReviewService reviewService;
    private final ReviewQueryService reviewQueryService;

    public ReviewApiController(ReviewService reviewService, ReviewQueryService reviewQueryService) {
        this.reviewService = reviewService;
        this.reviewQueryService = reviewQueryService;
    }

    /**
     * 상품별 리뷰 목록 조회 (공개). 로그인 상태면 본인이 도움이 돼요를 누른 리뷰 ID도 함께 내려준다.
     */
    @GetMapping("/products/{productId}/reviews")
    public ApiResponse<ProductReviewsResponse> getProductReviews(
            @PathVariable Long productId,
            @RequestParam(required = false) Integer rating,
            @RequestParam(required = false) String sort,
            @RequestParam(defaultValue = "0") int page) {
        Long userId = SecurityUtil.getCurrentUserId().orElse(null);
        return ApiResponse.ok(reviewQueryService.getProductReviews(productId, rating, sort, page, userId));
    }

    @PostMapping("/reviews")
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<ReviewResponse> createReview(@Valid @RequestBody ReviewCreateRequest request) {
        Long userId = SecurityUtil.requireCurrentUserId();
        return ApiResponse.ok(reviewService.submitReview(userId, request));
    }

    /**
     * 리뷰 수정 (본인, 작성 후 수정 가능 기간 내). 수정된 리뷰는 다시 검수 대기 상태가 된다.
     */
    @PutMapping("/reviews/{reviewId}")
    public ApiResponse<ReviewResponse> updateReview(@PathVariable Long reviewId,
                                                    @Valid @RequestBody ReviewUpdateRequest request) {
        Long userId = SecurityUtil.requireCurrentUserId();
        return ApiResponse.ok(reviewService.editReview(reviewId, userId, request));
    }

    @DeleteMapping("/reviews/{reviewId}")
    public ApiResponse<Void> deleteReview(@PathVariable Long reviewId) {
        Long userId = SecurityUtil.requireCurrentUserId();
        reviewService.deleteReview(reviewId, userId);
        return ApiResponse.ok();
    }

    /**
     * "도움이 돼요". 이미 누른 경우에도 성공으로 응답하며 newVote=false로 구분한다.
     */
    @PostMapping("/reviews/{reviewId}/helpful")
    public ApiResponse<HelpfulVoteResponse> markHelpful(@PathVariable Long reviewId) {
        Long userId = SecurityUtil.requireCurrentUserId();
        return ApiResponse.ok(reviewService.markHelpful(reviewId, userId));
    }

    @PostMapping("/reviews/{reviewId}/response")
    public ApiResponse<ReviewResponse> respond(@PathVariable Long reviewId,
                                               @Valid @RequestBody SellerResponseRequest request) {
        Long sellerId = SecurityUtil.requireCurrentUserId();
        return ApiResponse.ok(reviewService.respondAsSeller(reviewId, sellerId, request.response()));
    }

    @GetMapping("/reviews/me")
    public ApiResponse<PageResponse<ReviewResponse>> getMyReviews(@RequestParam(defaultValue = "0") int page) {
        Long userId = SecurityUtil.requireCurrentUserId();
        return ApiResponse.ok(reviewQueryService.getUserReviews(userId, page));
    }

    /**
     * 리뷰 작성 화면에서 선택할 수 있는 주문 항목 (배송 완료, 아직 리뷰 없음).
     */
    @GetMapping("/reviews/reviewable-items")
    public ApiResponse<List<ReviewableOrderItemResponse>> getReviewableItems(@RequestParam Long productId) {
        Long userId = SecurityUtil.requireCurrentUserId();
        return ApiResponse.ok(reviewQueryService.getReviewableOrderItems(userId, productId));
    }
}
