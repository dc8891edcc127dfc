package com.shophub.domain.review.service;

import com.shophub.domain.order.repository.OrderItemRepository;
import com.shophub.domain.review.dto.ProductReviewsResponse;
import com.shophub.domain.review.dto.RatingCount;
import com.shophub.domain.review.dto.ReviewResponse;
import com.shophub.domain.review.dto.ReviewStatsResponse;
import com.shophub.domain.review.dto.ReviewableOrderItemResponse;
import com.shophub.domain.review.entity.Review;
import com.shophub.domain.review.entity.ReviewStatus;
import com.shophub.domain.review.repository.ReviewHelpfulRepository;
import com.shophub.domain.review.repository.ReviewRepository;
import com.shophub.global.common.PageDefaults;
import com.shophub.global.common.PagingParams;
import com.shophub.global.dto.PageResponse;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 리뷰 조회 전용 서비스.
 *
 * 공개 목록은 승인(APPROVED)된 리뷰만 노출한다. 정렬/필터/페이지 파라미터는 {@link PagingParams}로
 * 보정되므로 잘못된 값이 와도 오류 대신 기본값으로 조회한다.
 */
@Service
@Transactional(readOnly = true)
public class ReviewQueryService {

    private final ReviewRepository reviewRepository;
    private final ReviewHelpfulRepository reviewHelpfulRepository;
    private final OrderItemRepository orderItemRepository;

    public ReviewQueryService(ReviewRepository reviewRepository,
                              ReviewHelpfulRepository reviewHelpfulRepository,
                              OrderItemRepository orderItemRepository) {
        this.reviewRepository = reviewRepository;
        this.reviewHelpfulRepository = reviewHelpfulRepository;
        this.orderItemRepository = orderItemRepository;
    }

    /**
     * 상품 상세의 리뷰 영역. 통계는 목록과 같은 집합(승인된 리뷰, 별점 필터 적용)을 기준으로 한다.
     *
     * @param userId 로그인 사용자 ID, 비로그인이면 null
     */
    public ProductReviewsResponse getProductReviews(Long productId, Integer rating, String sort,
                                                    int page, Long userId) {
        String normalizedSort = PagingParams.normalizeReviewSort(sort);
        Integer ratingFilter = PagingParams.normalizeRatingFilter(rating);
        Pageable pageable = PageRequest.of(PagingParams.normalizePage(page), PageDefaults.REVIEW_LIST_SIZE,
                PagingParams.toReviewSort(normalizedSort));

        Page<Review> reviews = ratingFilter == null
                ? reviewRepository.findByProductIdAndStatus(productId, ReviewStatus.APPROVED, pageable)
                : reviewRepository.findByProductIdAndStatusAndRating(productId, ReviewStatus.APPROVED,
                        ratingFilter, pageable);

        Set<Long> pageReviewIds = reviews.getContent().stream()
                .map(Review::getReviewId)
                .collect(Collectors.toSet());

        return new ProductReviewsResponse(
                getReviewStats(productId, ratingFilter),
                PageResponse.from(reviews, ReviewResponse::from),
                normalizedSort,
                ratingFilter,
                getHelpedReviewIds(userId, pageReviewIds)
        );
    }

    /**
     * @param ratingFilter 별점 필터, 없으면 null. 필터가 있으면 해당 별점의 리뷰만 집계한다.
     */
    public ReviewStatsResponse getReviewStats(Long productId, Integer ratingFilter) {
        if (ratingFilter != null) {
            return filteredStats(productId, ratingFilter);
        }

        long totalCount = reviewRepository.countByProductIdAndStatus(productId, ReviewStatus.APPROVED);
        BigDecimal average = BigDecimal.valueOf(
                reviewRepository.findAverageRating(productId, ReviewStatus.APPROVED).orElse(0.0)
        ).setScale(1, RoundingMode.HALF_UP);

        Map<Integer, Long> distribution = emptyDistribution();
        for (RatingCount ratingCount : reviewRepository.countGroupByRating(productId, ReviewStatus.APPROVED)) {
            distribution.put(ratingCount.rating(), ratingCount.count());
        }

        return new ReviewStatsResponse(totalCount, average, distribution);
    }

    // 단일 별점 집합이므로 평균은 그 별점 자체다
    private ReviewStatsResponse filteredStats(Long productId, int rating) {
        long totalCount = reviewRepository.countByProductIdAndStatusAndRating(productId, ReviewStatus.APPROVED, rating);
        BigDecimal average = BigDecimal.valueOf(totalCount == 0 ? 0 : rating).setScale(1, RoundingMode.HALF_UP);

        Map<Integer, Long> distribution = emptyDistribution();
        distribution.put(rating, totalCount);
        return new ReviewStatsResponse(totalCount, average, distribution);
    }

    private static Map<Integer, Long> emptyDistribution() {
        Map<Integer, Long> distribution = new LinkedHashMap<>();
        for (int star = 5; star >= 1; star--) {
            distribution.put(star, 0L);
        }
        return distribution;
    }

    /**
     * 구매자 본인의 리뷰. 검수 상태와 관계없이 최신순으로 보여준다.
     */
    public PageResponse<ReviewResponse> getUserReviews(Long userId, int page) {
        Pageable pageable = PageRequest.of(PagingParams.normalizePage(page), PageDefaults.REVIEW_LIST_SIZE);
        return PageResponse.from(reviewRepository.findByUserIdOrderByCreatedAtDesc(userId, pageable),
                ReviewResponse::from);
    }

    public List<ReviewableOrderItemResponse> getReviewableOrderItems(Long userId, Long productId) {
        return orderItemRepository.findDeliveredItemsForReview(userId, productId).stream()
                .map(ReviewableOrderItemResponse::from)
                .toList();
    }

    public Set<Long> getHelpedReviewIds(Long userId, Set<Long> reviewIds) {
        if (userId == null || reviewIds == null || reviewIds.isEmpty()) {
            return Collections.emptySet();
        }
        return reviewHelpfulRepository.findHelpedReviewIdsByUserIdAndReviewIds(userId, reviewIds);
    }
}
