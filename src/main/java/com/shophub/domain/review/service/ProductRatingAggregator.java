package com.shophub.domain.review.service;

import com.shophub.domain.product.entity.Product;
import com.shophub.domain.product.repository.ProductRepository;
import com.shophub.domain.review.dto.RatingSnapshot;
import com.shophub.domain.review.entity.ReviewStatus;
import com.shophub.domain.review.repository.ReviewRepository;
import com.shophub.global.exception.ResourceNotFoundException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 상품 평점 집계기.
 *
 * <p>승인(APPROVED)된 리뷰만으로 평균 평점과 리뷰 수를 다시 계산해 상품 행에 기록한다.
 * 저장/삭제 훅이 아니라, 승인된 리뷰 집합을 바꾸는 서비스 메서드(승인, 수정, 삭제)가
 * 명시적으로 호출한다.</p>
 *
 * <p>호출자의 트랜잭션 안에서만 실행된다(MANDATORY). 리뷰 변경과 집계 갱신이 하나의 커밋으로
 * 묶여야 조회자가 "승인되었지만 평점에 반영되지 않은" 중간 상태를 볼 수 없다.</p>
 *
 * <p>잠금 순서: 호출자가 리뷰 행을 먼저 잠근 뒤 여기서 상품 행을 잠근다. 모든 경로가
 * 리뷰 → 상품 순서를 지키므로 교착 상태가 생기지 않는다.</p>
 */
@Component
public class ProductRatingAggregator {

    private final ProductRepository productRepository;
    private final ReviewRepository reviewRepository;
    private final ReviewEventLogger reviewEventLogger;
    private final Clock clock;

    public ProductRatingAggregator(ProductRepository productRepository,
                                   ReviewRepository reviewRepository,
                                   ReviewEventLogger reviewEventLogger,
                                   Clock clock) {
        this.productRepository = productRepository;
        this.reviewRepository = reviewRepository;
        this.reviewEventLogger = reviewEventLogger;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public RatingSnapshot recompute(Long productId) {
        Product product = productRepository.findByIdWithLock(productId)
                .orElseThrow(() -> new ResourceNotFoundException("상품", productId));

        double avg = reviewRepository.findAverageRating(productId, ReviewStatus.APPROVED).orElse(0.0);
        int count = Math.toIntExact(reviewRepository.countByProductIdAndStatus(productId, ReviewStatus.APPROVED));
        BigDecimal average = BigDecimal.valueOf(avg).setScale(2, RoundingMode.HALF_UP);

        product.updateRating(average, count, LocalDateTime.now(clock));

        RatingSnapshot snapshot = new RatingSnapshot(productId, average, count);
        reviewEventLogger.ratingRecomputed(snapshot);
        return snapshot;
    }
}
