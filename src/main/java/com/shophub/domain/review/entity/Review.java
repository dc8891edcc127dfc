package com.shophub.domain.review.entity;

import com.shophub.global.exception.BusinessException;
import jakarta.persistence.*;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 상품 리뷰.
 *
 * <p>(구매자, 상품)당 하나만 존재한다. 저장소의 unique 인덱스(uk_reviews_user_product)와
 * 서비스 계층의 사전 중복 검사가 함께 이 불변식을 지킨다.</p>
 *
 * <p>helpfulCount는 review_helpfuls 행 수와 항상 같아야 하며, 엔티티 필드를 직접 증가시키지 않고
 * {@code ReviewRepository.incrementHelpfulCount}의 원자적 UPDATE로만 변경한다.</p>
 */
@Entity
@Table(name = "reviews",
       uniqueConstraints = @UniqueConstraint(name = "uk_reviews_user_product",
                                             columnNames = {"user_id", "product_id"}))
public class Review {

    public static final int TITLE_MAX_LENGTH = 255;
    public static final int BODY_MAX_LENGTH = 5000;
    public static final int SELLER_RESPONSE_MAX_LENGTH = 1000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "review_id")
    private Long reviewId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "order_item_id")
    private Long orderItemId;

    @Column(name = "rating", nullable = false)
    private Integer rating;

    @Column(name = "title", nullable = false, length = TITLE_MAX_LENGTH)
    private String title;

    @Column(name = "body", nullable = false, length = BODY_MAX_LENGTH)
    private String body;

    @Column(name = "verified_purchase", nullable = false)
    private Boolean verifiedPurchase;

    @Column(name = "helpful_count", nullable = false)
    private Integer helpfulCount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ReviewStatus status;

    @Column(name = "seller_response", length = SELLER_RESPONSE_MAX_LENGTH)
    private String sellerResponse;

    @Column(name = "seller_responded_at")
    private LocalDateTime sellerRespondedAt;

    @Column(name = "moderated_at")
    private LocalDateTime moderatedAt;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @OneToMany(mappedBy = "review", fetch = FetchType.LAZY, cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("displayOrder ASC, createdAt ASC, imageId ASC")
    private List<ReviewImage> images = new ArrayList<>();

    protected Review() {}

    /**
     * 신규 리뷰는 구매 인증 여부와 관계없이 항상 PENDING으로 시작한다.
     * verifiedPurchase는 작성 시점에 한 번 결정되며 이후 수정에서 다시 판단하지 않는다.
     */
    public Review(Long productId, Long userId, Long orderId, Long orderItemId,
                  int rating, String title, String body, boolean verifiedPurchase,
                  LocalDateTime now) {
        this.productId = productId;
        this.userId = userId;
        this.orderId = orderId;
        this.orderItemId = orderItemId;
        this.rating = rating;
        this.title = title;
        this.body = body;
        this.verifiedPurchase = verifiedPurchase;
        this.helpfulCount = 0;
        this.status = ReviewStatus.PENDING;
        this.createdAt = now;
        this.updatedAt = now;
    }

    public boolean isWrittenBy(Long buyerId) {
        return userId.equals(buyerId);
    }

    /**
     * 작성 후 경과한 일수(24시간 단위, 버림)가 windowDays 이하이면 수정 가능하다.
     * windowDays=30이면 30일 23시간 경과까지 허용, 31일째부터 거부.
     */
    public boolean isEditableAt(LocalDateTime now, int windowDays) {
        return Duration.between(createdAt, now).toDays() <= windowDays;
    }

    /**
     * 내용 수정. null 인자는 기존 값을 유지한다.
     * 이전 상태와 관계없이 PENDING으로 되돌려 재검수를 받게 한다.
     *
     * @return 수정 전 상태가 APPROVED였는지 (평점 집계에서 빠지는지)
     */
    public boolean edit(Integer newRating, String newTitle, String newBody, LocalDateTime now) {
        boolean wasApproved = status == ReviewStatus.APPROVED;
        if (newRating != null) {
            this.rating = newRating;
        }
        if (newTitle != null) {
            this.title = newTitle;
        }
        if (newBody != null) {
            this.body = newBody;
        }
        this.status = ReviewStatus.PENDING;
        this.moderatedAt = null;
        this.updatedAt = now;
        return wasApproved;
    }

    public void moderate(ModerationDecision decision, LocalDateTime now) {
        if (!status.isModeratable()) {
            throw new BusinessException("INVALID_MODERATION_STATE",
                    "검수 대기 상태의 리뷰만 검수할 수 있습니다. (현재 상태: " + status.getLabel() + ")");
        }
        this.status = decision.getTargetStatus();
        this.moderatedAt = now;
        this.updatedAt = now;
    }

    public void respond(String response, LocalDateTime now) {
        if (hasSellerResponse()) {
            throw new BusinessException("ALREADY_RESPONDED", "이미 답변을 등록한 리뷰입니다.");
        }
        this.sellerResponse = response;
        this.sellerRespondedAt = now;
    }

    public ReviewImage addImage(String imageUrl, String caption, int displayOrder, LocalDateTime now) {
        ReviewImage image = new ReviewImage(this, imageUrl, caption, displayOrder, now);
        images.add(image);
        return image;
    }

    public int nextImageDisplayOrder() {
        return images.stream()
                .mapToInt(ReviewImage::getDisplayOrder)
                .max()
                .orElse(-1) + 1;
    }

    public boolean isApproved() {
        return status == ReviewStatus.APPROVED;
    }

    public boolean hasSellerResponse() {
        return sellerResponse != null && !sellerResponse.isBlank();
    }

    public Long getReviewId() { return reviewId; }
    public Long getProductId() { return productId; }
    public Long getUserId() { return userId; }
    public Long getOrderId() { return orderId; }
    public Long getOrderItemId() { return orderItemId; }
    public Integer getRating() { return rating; }
    public String getTitle() { return title; }
    public String getBody() { return body; }
    public Boolean getVerifiedPurchase() { return verifiedPurchase; }
    public Integer getHelpfulCount() { return helpfulCount; }
    public ReviewStatus getStatus() { return status; }
    public String getSellerResponse() { return sellerResponse; }
    public LocalDateTime getSellerRespondedAt() { return sellerRespondedAt; }
    public LocalDateTime getModeratedAt() { return moderatedAt; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public List<ReviewImage> getImages() { return images; }
}
