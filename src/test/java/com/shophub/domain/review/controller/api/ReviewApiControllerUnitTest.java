package com.shophub.domain.review.controller.api;

import com.shophub.domain.review.dto.BulkModerationResponse;
import com.shophub.domain.review.dto.HelpfulVoteResponse;
import com.shophub.domain.review.dto.ProductReviewsResponse;
import com.shophub.domain.review.dto.ReviewCreateRequest;
import com.shophub.domain.review.dto.ReviewResponse;
import com.shophub.domain.review.dto.ReviewStatsResponse;
import com.shophub.domain.review.dto.ReviewUpdateRequest;
import com.shophub.domain.review.dto.ReviewableOrderItemResponse;
import com.shophub.domain.review.entity.ModerationDecision;
import com.shophub.domain.review.entity.ReviewStatus;
import com.shophub.domain.review.service.ReviewModerationService;
import com.shophub.domain.review.service.ReviewQueryService;
import com.shophub.domain.review.service.ReviewService;
import com.shophub.global.dto.PageResponse;
import com.shophub.global.exception.ApiExceptionHandler;
import com.shophub.global.exception.BusinessException;
import com.shophub.global.exception.DuplicateConstraintMessageResolver;
import com.shophub.global.exception.DuplicateReviewException;
import com.shophub.global.exception.ForbiddenException;
import com.shophub.global.exception.ResourceNotFoundException;
import com.shophub.global.security.CustomUserPrincipal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.validation.beanvalidation.LocalValidatorFactoryBean;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ReviewApiControllerUnitTest {

    private static final Long BUYER_ID = 7L;

    @Mock
    private ReviewService reviewService;

    @Mock
    private ReviewQueryService reviewQueryService;

    @Mock
    private ReviewModerationService reviewModerationService;

    private MockMvc mockMvc;
    private LocalValidatorFactoryBean validator;

    @BeforeEach
    void setUp() {
        validator = new LocalValidatorFactoryBean();
        validator.afterPropertiesSet();

        mockMvc = MockMvcBuilders.standaloneSetup(
                        new ReviewApiController(reviewService, reviewQueryService),
                        new AdminReviewApiController(reviewModerationService))
                .setControllerAdvice(new ApiExceptionHandler(new DuplicateConstraintMessageResolver()))
                .setValidator(validator)
                .build();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
        validator.destroy();
    }

    private void loginAs(Long userId, String role) {
        CustomUserPrincipal principal = new CustomUserPrincipal(userId, "user" + userId, "", role,
                List.of(new SimpleGrantedAuthority(role)));
        SecurityContextHolder.getContext().setAuthentication(
                new UsernamePasswordAuthenticationToken(principal, null, principal.getAuthorities()));
    }

    private ReviewResponse reviewResponse(Long reviewId, ReviewStatus status) {
        LocalDateTime now = LocalDateTime.of(2026, 3, 1, 12, 0);
        return new ReviewResponse(reviewId, 42L, BUYER_ID, 5, "최고예요", "좋습니다.", true, 0, status,
                null, null, List.of(), now, now);
    }

    @Test
    @DisplayName("POST /reviews — 201과 PENDING 리뷰 반환")
    void createReview_returnsCreated() throws Exception {
        loginAs(BUYER_ID, "ROLE_USER");
        when(reviewService.submitReview(eq(BUYER_ID), any(ReviewCreateRequest.class)))
                .thenReturn(reviewResponse(500L, ReviewStatus.PENDING));

        mockMvc.perform(post("/api/v1/reviews")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"productId":42,"orderItemId":11,"rating":5,"title":"최고예요","body":"좋습니다.",
                                 "images":[{"imageUrl":"https://cdn.example.com/1.jpg","caption":"정면"}]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.reviewId").value(500))
                .andExpect(jsonPath("$.data.status").value("PENDING"))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    @DisplayName("POST /reviews — 평점 6점은 VALIDATION_ERROR, 서비스 호출 없음")
    void createReview_invalidRating_returnsBadRequest() throws Exception {
        loginAs(BUYER_ID, "ROLE_USER");

        mockMvc.perform(post("/api/v1/reviews")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\":42,\"rating\":6,\"title\":\"제목\",\"body\":\"내용\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.message").value("평점은 5점 이하여야 합니다."));

        verifyNoInteractions(reviewService);
    }

    @Test
    @DisplayName("POST /reviews — 이미지 6장은 VALIDATION_ERROR")
    void createReview_tooManyImages_returnsBadRequest() throws Exception {
        loginAs(BUYER_ID, "ROLE_USER");
        String image = "{\"imageUrl\":\"https://cdn.example.com/a.jpg\"}";
        String images = String.join(",", image, image, image, image, image, image);

        mockMvc.perform(post("/api/v1/reviews")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\":42,\"rating\":5,\"title\":\"제목\",\"body\":\"내용\",\"images\":["
                                + images + "]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(reviewService);
    }

    @Test
    @DisplayName("POST /reviews — 중복 리뷰는 409 DUPLICATE_REVIEW")
    void createReview_duplicate_returnsConflict() throws Exception {
        loginAs(BUYER_ID, "ROLE_USER");
        when(reviewService.submitReview(eq(BUYER_ID), any(ReviewCreateRequest.class)))
                .thenThrow(new DuplicateReviewException());

        mockMvc.perform(post("/api/v1/reviews")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\":42,\"rating\":4,\"title\":\"제목\",\"body\":\"내용\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("DUPLICATE_REVIEW"));
    }

    @Test
    @DisplayName("POST /reviews — 배송 전 주문은 400 NOT_DELIVERED")
    void createReview_notDelivered_returnsBadRequest() throws Exception {
        loginAs(BUYER_ID, "ROLE_USER");
        when(reviewService.submitReview(eq(BUYER_ID), any(ReviewCreateRequest.class)))
                .thenThrow(new BusinessException("NOT_DELIVERED", "배송 완료된 주문만 리뷰를 작성할 수 있습니다."));

        mockMvc.perform(post("/api/v1/reviews")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productId\":42,\"orderItemId\":11,\"rating\":4,\"title\":\"제목\",\"body\":\"내용\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("NOT_DELIVERED"));
    }

    @Test
    @DisplayName("PUT /reviews/{id} — 본인 리뷰가 아니면 403 NOT_OWNER")
    void updateReview_notOwner_returnsForbidden() throws Exception {
        loginAs(8L, "ROLE_USER");
        when(reviewService.editReview(eq(500L), eq(8L), any(ReviewUpdateRequest.class)))
                .thenThrow(new ForbiddenException("NOT_OWNER", "본인의 리뷰만 수정할 수 있습니다."));

        mockMvc.perform(put("/api/v1/reviews/500")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"수정\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error.code").value("NOT_OWNER"));
    }

    @Test
    @DisplayName("PUT /reviews/{id} — 공백만 있는 제목은 VALIDATION_ERROR")
    void updateReview_blankTitle_returnsBadRequest() throws Exception {
        loginAs(BUYER_ID, "ROLE_USER");

        mockMvc.perform(put("/api/v1/reviews/500")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(reviewService);
    }

    @Test
    @DisplayName("PUT /reviews/{id} — 여러 줄 본문도 허용")
    void updateReview_multilineBody_isAccepted() throws Exception {
        loginAs(BUYER_ID, "ROLE_USER");
        when(reviewService.editReview(eq(500L), eq(BUYER_ID), any(ReviewUpdateRequest.class)))
                .thenReturn(reviewResponse(500L, ReviewStatus.PENDING));

        mockMvc.perform(put("/api/v1/reviews/500")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"body\":\"첫 줄\\n둘째 줄\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("PENDING"));
    }

    @Test
    @DisplayName("DELETE /reviews/{id} — 존재하지 않으면 404")
    void deleteReview_missing_returnsNotFound() throws Exception {
        loginAs(BUYER_ID, "ROLE_USER");
        doThrow(new ResourceNotFoundException("리뷰", 999L)).when(reviewService).deleteReview(999L, BUYER_ID);

        mockMvc.perform(delete("/api/v1/reviews/999"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("DELETE /reviews/{id} — 성공 시 success=true")
    void deleteReview_success() throws Exception {
        loginAs(BUYER_ID, "ROLE_USER");

        mockMvc.perform(delete("/api/v1/reviews/500"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data").doesNotExist());

        verify(reviewService).deleteReview(500L, BUYER_ID);
    }

    @Test
    @DisplayName("POST /reviews/{id}/helpful — 카운트와 newVote 반환")
    void markHelpful_returnsVoteResult() throws Exception {
        loginAs(3L, "ROLE_USER");
        when(reviewService.markHelpful(500L, 3L)).thenReturn(new HelpfulVoteResponse(500L, 12, false));

        mockMvc.perform(post("/api/v1/reviews/500/helpful"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.helpfulCount").value(12))
                .andExpect(jsonPath("$.data.newVote").value(false));
    }

    @Test
    @DisplayName("POST /reviews/{id}/helpful — 락 대기 실패는 503 TRANSIENT_ERROR")
    void markHelpful_lockFailure_returnsServiceUnavailable() throws Exception {
        loginAs(3L, "ROLE_USER");
        when(reviewService.markHelpful(500L, 3L)).thenThrow(new PessimisticLockingFailureException("lock timeout"));

        mockMvc.perform(post("/api/v1/reviews/500/helpful"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error.code").value("TRANSIENT_ERROR"));
    }

    @Test
    @DisplayName("POST /reviews/{id}/response — 빈 답변은 VALIDATION_ERROR")
    void respond_blank_returnsBadRequest() throws Exception {
        loginAs(50L, "ROLE_SELLER");

        mockMvc.perform(post("/api/v1/reviews/500/response")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"response\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.message").value("답변 내용을 입력해주세요."));

        verifyNoInteractions(reviewService);
    }

    @Test
    @DisplayName("POST /reviews/{id}/response — 판매자 답변 등록")
    void respond_success() throws Exception {
        loginAs(50L, "ROLE_SELLER");
        when(reviewService.respondAsSeller(500L, 50L, "감사합니다."))
                .thenReturn(reviewResponse(500L, ReviewStatus.APPROVED));

        mockMvc.perform(post("/api/v1/reviews/500/response")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"response\":\"감사합니다.\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("APPROVED"));
    }

    @Test
    @DisplayName("GET /products/{id}/reviews — 비로그인 조회는 userId 없이 전달")
    void getProductReviews_anonymous() throws Exception {
        ProductReviewsResponse response = new ProductReviewsResponse(
                new ReviewStatsResponse(1, new BigDecimal("5.0"), Map.of(5, 1L)),
                new PageResponse<>(List.of(reviewResponse(500L, ReviewStatus.APPROVED)), 0, 10, 1, 1, true, true),
                "helpful", 5, Set.of());
        when(reviewQueryService.getProductReviews(eq(42L), eq(5), eq("helpful"), eq(0), isNull()))
                .thenReturn(response);

        mockMvc.perform(get("/api/v1/products/42/reviews")
                        .param("rating", "5")
                        .param("sort", "helpful"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.stats.totalCount").value(1))
                .andExpect(jsonPath("$.data.reviews.content[0].reviewId").value(500))
                .andExpect(jsonPath("$.data.sort").value("helpful"));
    }

    @Test
    @DisplayName("GET /reviews/me — 로그인 사용자의 리뷰 목록")
    void getMyReviews() throws Exception {
        loginAs(BUYER_ID, "ROLE_USER");
        when(reviewQueryService.getUserReviews(BUYER_ID, 1)).thenReturn(
                new PageResponse<>(List.of(reviewResponse(500L, ReviewStatus.REJECTED)), 1, 10, 11, 2, false, true));

        mockMvc.perform(get("/api/v1/reviews/me").param("page", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.content[0].status").value("REJECTED"))
                .andExpect(jsonPath("$.data.last").value(true));
    }

    @Test
    @DisplayName("POST /admin/reviews/{id}/moderation — 승인")
    void moderate_approve() throws Exception {
        loginAs(1L, "ROLE_ADMIN");
        when(reviewModerationService.moderate(500L, ModerationDecision.APPROVE))
                .thenReturn(reviewResponse(500L, ReviewStatus.APPROVED));

        mockMvc.perform(post("/api/v1/admin/reviews/500/moderation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"decision\":\"APPROVE\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("APPROVED"));
    }

    @Test
    @DisplayName("POST /admin/reviews/{id}/moderation — 알 수 없는 결정은 VALIDATION_ERROR")
    void moderate_unknownDecision_returnsBadRequest() throws Exception {
        loginAs(1L, "ROLE_ADMIN");

        mockMvc.perform(post("/api/v1/admin/reviews/500/moderation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"decision\":\"HOLD\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(reviewModerationService);
    }

    @Test
    @DisplayName("POST /admin/reviews/{id}/moderation — 이미 검수된 리뷰는 400 INVALID_MODERATION_STATE")
    void moderate_alreadyModerated_returnsBadRequest() throws Exception {
        loginAs(1L, "ROLE_ADMIN");
        when(reviewModerationService.moderate(500L, ModerationDecision.REJECT))
                .thenThrow(new BusinessException("INVALID_MODERATION_STATE", "검수 대기 상태의 리뷰만 검수할 수 있습니다."));

        mockMvc.perform(post("/api/v1/admin/reviews/500/moderation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"decision\":\"REJECT\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_MODERATION_STATE"));
    }

    @Test
    @DisplayName("예상하지 못한 예외는 500 INTERNAL_ERROR")
    void unexpectedException_returnsInternalError() throws Exception {
        loginAs(3L, "ROLE_USER");
        when(reviewService.markHelpful(500L, 3L)).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/v1/reviews/500/helpful"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error.code").value("INTERNAL_ERROR"));
    }

    @Test
    @DisplayName("GET /reviews/reviewable-items — 로그인 구매자의 작성 가능 주문 항목")
    void getReviewableItems_returnsItemsOfCurrentBuyer() throws Exception {
        loginAs(BUYER_ID, "ROLE_USER");
        when(reviewQueryService.getReviewableOrderItems(BUYER_ID, 42L)).thenReturn(List.of(
                new ReviewableOrderItemResponse(11L, 3L, "ORD-20260201-0001", 42L, "무선 이어폰",
                        LocalDateTime.of(2026, 2, 3, 15, 0))));

        mockMvc.perform(get("/api/v1/reviews/reviewable-items").param("productId", "42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].orderItemId").value(11))
                .andExpect(jsonPath("$.data[0].orderNumber").value("ORD-20260201-0001"));
    }

    @Test
    @DisplayName("POST /admin/reviews/moderation — 일괄 검수 결과 반환")
    void moderateAll_returnsModeratedAndSkipped() throws Exception {
        loginAs(1L, "ROLE_ADMIN");
        when(reviewModerationService.moderateAll(List.of(500L, 501L), ModerationDecision.APPROVE))
                .thenReturn(new BulkModerationResponse(ModerationDecision.APPROVE, List.of(500L), List.of(501L)));

        mockMvc.perform(post("/api/v1/admin/reviews/moderation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reviewIds\":[500,501],\"decision\":\"APPROVE\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.moderatedIds[0]").value(500))
                .andExpect(jsonPath("$.data.skippedIds[0]").value(501));
    }

    @Test
    @DisplayName("POST /admin/reviews/moderation — 빈 선택은 VALIDATION_ERROR")
    void moderateAll_emptySelection_returnsBadRequest() throws Exception {
        loginAs(1L, "ROLE_ADMIN");

        mockMvc.perform(post("/api/v1/admin/reviews/moderation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reviewIds\":[],\"decision\":\"REJECT\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(reviewModerationService);
    }
}
