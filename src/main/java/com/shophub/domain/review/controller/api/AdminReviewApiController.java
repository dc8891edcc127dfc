package com.shophub.domain.review.controller.api;

import com.shophub.domain.review.dto.BulkModerationRequest;
import com.shophub.domain.review.dto.BulkModerationResponse;
import com.shophub.domain.review.dto.ModerationRequest;
import com.shophub.domain.review.dto.ReviewResponse;
import com.shophub.domain.review.service.ReviewModerationService;
import com.shophub.global.common.PageDefaults;
import com.shophub.global.common.PagingParams;
import com.shophub.global.dto.ApiResponse;
import com.shophub.global.dto.PageResponse;
import jakarta.validation.Valid;
import org.springframework.data.domain.PageRequest;
import org.springframework.web.bind.annotation.*;

/**
 * 관리자 리뷰 검수 API. /api/v1/admin/** 는 SecurityConfig에서 ROLE_ADMIN으로 제한된다.
 */
@RestController
@RequestMapping("/api/v1/admin/reviews")
public class AdminReviewApiController {

    private final ReviewModerationService reviewModerationService;

    public AdminReviewApiController(ReviewModerationService reviewModerationService) {
        this.reviewModerationService = reviewModerationService;
    }

    @GetMapping("/pending")
    public ApiResponse<PageResponse<ReviewResponse>> getPendingReviews(@RequestParam(defaultValue = "0") int page) {
        return ApiResponse.ok(reviewModerationService.getPendingReviews(
                PageRequest.of(PagingParams.normalizePage(page), PageDefaults.ADMIN_LIST_SIZE)));
    }

    @PostMapping("/{reviewId}/moderation")
    public ApiResponse<ReviewResponse> moderate(@PathVariable Long reviewId,
                                                @Valid @RequestBody ModerationRequest request) {
        return ApiResponse.ok(reviewModerationService.moderate(reviewId, request.decision()));
    }

    @PostMapping("/moderation")
    public ApiResponse<BulkModerationResponse> moderateAll(@Valid @RequestBody BulkModerationRequest request) {
        return ApiResponse.ok(reviewModerationService.moderateAll(request.reviewIds(), request.decision()));
    }
}
