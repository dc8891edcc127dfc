package com.shophub.domain.product.entity;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 상품. 승인된 리뷰의 평균 평점과 개수를 행에 물리화하여 조회 시 재계산하지 않는다.
 */
@Entity
@Table(name = "products")
public class Product {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "product_id")
    private Long productId;

    @Column(name = "product_name", nullable = false, length = 200)
    private String productName;

    /** 상품을 등록한 판매자(users.user_id). 판매자 답변 권한 판단에 사용한다. */
    @Column(name = "seller_id", nullable = false)
    private Long sellerId;

    @Column(name = "rating_avg", nullable = false, precision = 3, scale = 2)
    private BigDecimal ratingAvg;

    @Column(name = "review_count", nullable = false)
    private Integer reviewCount;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    protected Product() {}

    public Product(String productName, Long sellerId) {
        this.productName = productName;
        this.sellerId = sellerId;
        this.ratingAvg = BigDecimal.ZERO.setScale(2);
        this.reviewCount = 0;
        this.isActive = true;
        this.createdAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    public void updateRating(BigDecimal newAvg, int newCount, LocalDateTime now) {
        this.ratingAvg = newAvg;
        this.reviewCount = newCount;
        this.updatedAt = now;
    }

    public boolean isOwnedBy(Long userId) {
        return sellerId != null && sellerId.equals(userId);
    }

    public Long getProductId() { return productId; }
    public String getProductName() { return productName; }
    public Long getSellerId() { return sellerId; }
    public BigDecimal getRatingAvg() { return ratingAvg; }
    public Integer getReviewCount() { return reviewCount; }
    public Boolean getIsActive() { return isActive; }
    public LocalDateTime getCreatedAt() { return createdAt; }
    public LocalDateTime getUpdatedAt() { return updatedAt; }
}
