package com.shophub.domain.review.service;

import com.shophub.domain.order.entity.Order;
import com.shophub.domain.order.entity.OrderItem;
import com.shophub.domain.order.repository.OrderItemRepository;
import com.shophub.domain.product.entity.Product;
import com.shophub.domain.product.repository.ProductRepository;
import com.shophub.domain.review.dto.HelpfulVoteResponse;
import com.shophub.domain.review.dto.ReviewCreateRequest;
import com.shophub.domain.review.dto.ReviewImageRequest;
import com.shophub.domain.review.dto.ReviewResponse;
import com.shophub.domain.review.dto.ReviewUpdateRequest;
import com.shophub.domain.review.entity.Review;
import com.shophub.domain.review.entity.ReviewHelpful;
import com.shophub.domain.review.event.ReviewSubmittedEvent;
import com.shophub.domain.review.repository.ReviewHelpfulRepository;
import com.shophub.domain.review.repository.ReviewRepository;
import com.shophub.global.exception.BusinessException;
import com.shophub.global.exception.DuplicateConstraintMessageResolver;
import com.shophub.global.exception.DuplicateReviewException;
import com.shophub.global.exception.ForbiddenException;
import com.shophub.global.exception.ResourceNotFoundException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 리뷰 작성·수정·삭제, 도움이 돼요, 판매자 답변.
 *
 * <p>모든 변경 메서드는 하나의 트랜잭션이다. 비즈니스 예외가 나면 전체가 롤백되어
 * 부분 반영이 남지 않는다. 지연 로딩 컬렉션(이미지) 때문에 응답 DTO 변환도 트랜잭션 안에서 끝낸다.</p>
 *
 * <p>상품 평점 재계산은 저장 훅에 숨기지 않고, 승인된 리뷰 집합이 바뀌는 경로(수정, 삭제)에서
 * {@link ProductRatingAggregator#recompute}를 명시적으로 호출한다. 신규 리뷰는 PENDING이라 집계에
 * 영향이 없으므로 작성 시에는 호출하지 않는다.</p>
 */
@Service
@Transactional(readOnly = true)
public class ReviewService {

    private final ReviewRepository reviewRepository;
    private final ReviewHelpfulRepository reviewHelpfulRepository;
    private final ProductRepository productRepository;
    private final OrderItemRepository orderItemRepository;
    private final ProductRatingAggregator productRatingAggregator;
    private final DuplicateConstraintMessageResolver duplicateConstraintMessageResolver;
    private final ApplicationEventPublisher eventPublisher;
    private final ReviewEventLogger reviewEventLogger;
    private final Clock clock;
    private final int editWindowDays;
    private final int maxImagesPerBatch;

    public ReviewService(ReviewRepository reviewRepository,
                         ReviewHelpfulRepository reviewHelpfulRepository,
                         ProductRepository productRepository,
                         OrderItemRepository orderItemRepository,
                         ProductRatingAggregator productRatingAggregator,
                         DuplicateConstraintMessageResolver duplicateConstraintMessageResolver,
                         ApplicationEventPublisher eventPublisher,
                         ReviewEventLogger reviewEventLogger,
                         Clock clock,
                         @Value("${app.review.edit-window-days:30}") int editWindowDays,
                         @Value("${app.review.max-images-per-batch:5}") int maxImagesPerBatch) {
        this.reviewRepository = reviewRepository;
        this.reviewHelpfulRepository = reviewHelpfulRepository;
        this.productRepository = productRepository;
        this.orderItemRepository = orderItemRepository;
        this.productRatingAggregator = productRatingAggregator;
        this.duplicateConstraintMessageResolver = duplicateConstraintMessageResolver;
        this.eventPublisher = eventPublisher;
        this.reviewEventLogger = reviewEventLogger;
        this.clock = clock;
        this.editWindowDays = editWindowDays;
        this.maxImagesPerBatch = maxImagesPerBatch;
    }

    @Transactional
    public ReviewResponse submitReview(Long buyerId, ReviewCreateRequest request) {
        validateImageCount(request.imagesOrEmpty());
        if (!productRepository.existsById(request.productId())) {
            throw new ResourceNotFoundException("상품", request.productId());
        }

        OrderItem orderItem = resolveOrderItemForReview(buyerId, request);

        if (reviewRepository.existsByUserIdAndProductId(buyerId, request.productId())) {
            throw new DuplicateReviewException();
        }

        Order order = orderItem != null ? orderItem.getOrder() : null;
        boolean verifiedPurchase = order != null && order.containsProduct(request.productId());

        LocalDateTime now = LocalDateTime.now(clock);
        Review review = new Review(request.productId(), buyerId,
                order != null ? order.getOrderId() : null,
                orderItem != null ? orderItem.getOrderItemId() : null,
                request.rating(), request.title(), request.body(), verifiedPurchase, now);
        attachImages(review, request.imagesOrEmpty(), now);

        Review saved;
        try {
            saved = reviewRepository.saveAndFlush(review);
        } catch (DataIntegrityViolationException exception) {
            // 사전 검사 이후 같은 (구매자, 상품) 리뷰가 먼저 커밋된 경우
            if (duplicateConstraintMessageResolver.isDuplicateReview(exception)) {
                throw new DuplicateReviewException();
            }
            throw exception;
        }

        reviewEventLogger.submitted(saved);
        eventPublisher.publishEvent(new ReviewSubmittedEvent(saved.getReviewId(), saved.getProductId(), buyerId));
        return ReviewResponse.from(saved);
    }

    private OrderItem resolveOrderItemForReview(Long buyerId, ReviewCreateRequest request) {
        if (request.orderItemId() == null) {
            return null;
        }

        OrderItem orderItem = orderItemRepository.findByIdWithOrder(request.orderItemId())
                .orElseThrow(() -> new BusinessException(
                        "REVIEW_ORDER_ITEM_NOT_FOUND",
                        "리뷰 대상 주문 항목을 찾을 수 없습니다."
                ));

        if (!orderItem.getOrder().getUserId().equals(buyerId)) {
            throw new ForbiddenException(
                    "NOT_OWNER",
                    "본인 주문의 상품에 대해서만 리뷰를 작성할 수 있습니다."
            );
        }

        if (!orderItem.getProductId().equals(request.productId())) {
            throw new BusinessException(
                    "REVIEW_PRODUCT_MISMATCH",
                    "주문 상품과 리뷰 상품이 일치하지 않습니다."
            );
        }

        if (!orderItem.getOrder().isDelivered()) {
            throw new BusinessException(
                    "NOT_DELIVERED",
                    "배송 완료된 주문만 리뷰를 작성할 수 있습니다."
            );
        }

        return orderItem;
    }

    @Transactional
    public ReviewResponse editReview(Long reviewId, Long buyerId, ReviewUpdateRequest request) {
        validateImageCount(request.imagesOrEmpty());
        Review review = reviewRepository.findByIdWithLock(reviewId)
                .orElseThrow(() -> new ResourceNotFoundException("리뷰", reviewId));
        if (!review.isWrittenBy(buyerId)) {
            throw new ForbiddenException("NOT_OWNER", "본인의 리뷰만 수정할 수 있습니다.");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (!review.isEditableAt(now, editWindowDays)) {
            throw new BusinessException("EDIT_WINDOW_EXPIRED",
                    "리뷰는 작성 후 " + editWindowDays + "일 이내에만 수정할 수 있습니다.");
        }

        boolean wasApproved = review.edit(request.rating(), request.title(), request.body(), now);
        attachImages(review, request.imagesOrEmpty(), now);

        // 승인 상태였다면 PENDING 전환으로 집계에서 빠진다
        productRatingAggregator.recompute(review.getProductId());
        reviewEventLogger.edited(review, wasApproved);
        return ReviewResponse.from(review);
    }

    @Transactional
    public void deleteReview(Long reviewId, Long buyerId) {
        Review review = reviewRepository.findByIdWithLock(reviewId)
                .orElseThrow(() -> new ResourceNotFoundException("리뷰", reviewId));
        if (!review.isWrittenBy(buyerId)) {
            throw new ForbiddenException("NOT_OWNER", "본인의 리뷰만 삭제할 수 있습니다.");
        }

        Long productId = review.getProductId();
        int removedVotes = reviewHelpfulRepository.deleteByReviewId(reviewId);
        // 이미지는 orphanRemoval로 함께 삭제된다
        reviewRepository.delete(review);

        productRatingAggregator.recompute(productId);
        reviewEventLogger.deleted(reviewId, productId, buyerId, removedVotes);
    }

    /**
     * "도움이 돼요" 투표. 같은 사용자의 재요청은 오류 없이 무시한다.
     *
     * <p>리뷰 행 잠금으로 같은 리뷰에 대한 투표를 직렬화한다. 잠금을 얻은 뒤 투표 존재 여부를
     * 확인하므로 같은 사용자의 동시 요청은 정확히 하나만 투표로 남고, 카운트 증가는
     * 원자적 UPDATE이므로 서로 다른 사용자의 동시 요청에서도 증가분이 유실되지 않는다.</p>
     */
    @Transactional
    public HelpfulVoteResponse markHelpful(Long reviewId, Long userId) {
        Review review = reviewRepository.findByIdWithLock(reviewId)
                .orElseThrow(() -> new ResourceNotFoundException("리뷰", reviewId));
        if (!review.isApproved()) {
            throw new BusinessException("REVIEW_NOT_APPROVED", "승인된 리뷰에만 도움이 돼요를 누를 수 있습니다.");
        }

        if (reviewHelpfulRepository.existsByReviewIdAndUserId(reviewId, userId)) {
            int current = review.getHelpfulCount();
            reviewEventLogger.helpfulVoted(reviewId, userId, current, false);
            return new HelpfulVoteResponse(reviewId, current, false);
        }

        reviewHelpfulRepository.save(new ReviewHelpful(reviewId, userId, LocalDateTime.now(clock)));
        reviewRepository.incrementHelpfulCount(reviewId);
        int updated = reviewRepository.findHelpfulCountById(reviewId)
                .orElseThrow(() -> new ResourceNotFoundException("리뷰", reviewId));

        reviewEventLogger.helpfulVoted(reviewId, userId, updated, true);
        return new HelpfulVoteResponse(reviewId, updated, true);
    }

    /**
     * 판매자 답변. 승인된 리뷰에 대해 상품 판매자만 한 번 등록할 수 있다.
     * 답변은 검수 상태와 평점 집계에 영향을 주지 않는다.
     */
    @Transactional
    public ReviewResponse respondAsSeller(Long reviewId, Long sellerId, String response) {
        Review review = reviewRepository.findByIdWithLock(reviewId)
                .orElseThrow(() -> new ResourceNotFoundException("리뷰", reviewId));
        if (!review.isApproved()) {
            throw new BusinessException("REVIEW_NOT_APPROVED", "승인된 리뷰에만 답변할 수 있습니다.");
        }

        Product product = productRepository.findById(review.getProductId())
                .orElseThrow(() -> new ResourceNotFoundException("상품", review.getProductId()));
        if (!product.isOwnedBy(sellerId)) {
            throw new ForbiddenException("NOT_PRODUCT_OWNER", "본인 상품의 리뷰에만 답변할 수 있습니다.");
        }

        review.respond(response, LocalDateTime.now(clock));
        reviewEventLogger.sellerResponded(reviewId, review.getProductId(), sellerId);
        return ReviewResponse.from(review);
    }

    /**
     * 한 요청에 첨부할 수 있는 이미지 수를 넘으면 일부만 저장하지 않고 요청 전체를 거부한다.
     */
    private void validateImageCount(List<ReviewImageRequest> images) {
        if (images.size() > maxImagesPerBatch) {
            throw new BusinessException("VALIDATION_ERROR",
                    "리뷰 이미지는 한 번에 " + maxImagesPerBatch + "장까지 첨부할 수 있습니다.");
        }
    }

    private void attachImages(Review review, List<ReviewImageRequest> images, LocalDateTime now) {
        int displayOrder = review.nextImageDisplayOrder();
        for (ReviewImageRequest image : images) {
            review.addImage(image.imageUrl(), image.caption(), displayOrder++, now);
        }
    }
}
