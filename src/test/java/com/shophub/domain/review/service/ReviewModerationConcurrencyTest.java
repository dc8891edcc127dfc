package com.shophub.domain.review.service;

import com.shophub.domain.review.dto.ReviewCreateRequest;
import com.shophub.domain.review.dto.ReviewUpdateRequest;
import com.shophub.domain.review.entity.ModerationDecision;
import org.junit.jupiter.api.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.TestPropertySource;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 검수와 수정이 같은 리뷰에 동시에 들어오는 경우의 직렬화 테스트
 *
 * 준비: 다른 구매자의 3점 리뷰(승인) + 대상 리뷰 5점(PENDING)
 * 동시 실행: 관리자 승인 vs 작성자의 평점 1점 수정
 *
 * 가능한 직렬 순서는 두 가지뿐이다.
 * 1) 승인 → 수정: 대상 리뷰 PENDING, 평점 3.00 / 1건
 * 2) 수정 → 승인: 대상 리뷰 APPROVED(1점), 평점 2.00 / 2건
 * 리뷰 상태와 상품 집계가 서로 다른 순서를 반영한 상태는 나오면 안 된다.
 */
@SpringBootTest
@TestPropertySource(properties = {
        "logging.level.org.hibernate.SQL=WARN",
        "logging.level.com.shophub=WARN"
})
class ReviewModerationConcurrencyTest {

    private static final long SELLER_ID = 5100L;
    private static final long AUTHOR_ID = 5101L;
    private static final long OTHER_BUYER_ID = 5102L;
    private static final long PRODUCT_ID = 7100L;

    @Autowired
    private ReviewService reviewService;

    @Autowired
    private ReviewModerationService reviewModerationService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private Long targetReviewId;

    @BeforeEach
    void setUp() {
        cleanUp();
        insertUser(SELLER_ID, "moderation-seller", "ROLE_SELLER");
        insertUser(AUTHOR_ID, "moderation-author", "ROLE_USER");
        insertUser(OTHER_BUYER_ID, "moderation-other", "ROLE_USER");
        jdbcTemplate.update(
                "INSERT INTO products (product_id, product_name, seller_id) VALUES (?, ?, ?)",
                PRODUCT_ID, "게이밍 마우스", SELLER_ID);

        Long otherReviewId = reviewService.submitReview(OTHER_BUYER_ID,
                new ReviewCreateRequest(PRODUCT_ID, null, 3, "무난해요", "가격 대비 괜찮습니다.", null)).reviewId();
        reviewModerationService.moderate(otherReviewId, ModerationDecision.APPROVE);

        targetReviewId = reviewService.submitReview(AUTHOR_ID,
                new ReviewCreateRequest(PRODUCT_ID, null, 5, "최고예요", "손에 잘 맞습니다.", null)).reviewId();
    }

    @AfterEach
    void tearDown() {
        cleanUp();
    }

    @RepeatedTest(5)
    @DisplayName("승인과 수정 동시 실행 → 둘 다 성공하고 결과는 두 직렬 순서 중 하나")
    void concurrentModerateAndEdit_applyOneAfterTheOther() throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch ready = new CountDownLatch(2);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(2);
        AtomicInteger failCount = new AtomicInteger(0);

        executor.submit(() -> {
            ready.countDown();
            try {
                start.await();
                reviewModerationService.moderate(targetReviewId, ModerationDecision.APPROVE);
            } catch (Exception e) {
                failCount.incrementAndGet();
                System.err.println("승인 실패: " + e.getMessage());
            } finally {
                done.countDown();
            }
        });
        executor.submit(() -> {
            ready.countDown();
            try {
                start.await();
                reviewService.editReview(targetReviewId, AUTHOR_ID,
                        new ReviewUpdateRequest(1, null, "쓰다 보니 클릭이 불량입니다.", null));
            } catch (Exception e) {
                failCount.incrementAndGet();
                System.err.println("수정 실패: " + e.getMessage());
            } finally {
                done.countDown();
            }
        });

        ready.await(10, TimeUnit.SECONDS);
        start.countDown();
        done.await(30, TimeUnit.SECONDS);
        executor.shutdown();

        // DB에서 직접 조회하여 검증 (영속성 컨텍스트 우회)
        Map<String, Object> review = jdbcTemplate.queryForMap(
                "SELECT status, rating FROM reviews WHERE review_id = ?", targetReviewId);
        Map<String, Object> product = jdbcTemplate.queryForMap(
                "SELECT rating_avg, review_count FROM products WHERE product_id = ?", PRODUCT_ID);
        String status = (String) review.get("status");
        BigDecimal ratingAvg = (BigDecimal) product.get("rating_avg");
        int reviewCount = ((Number) product.get("review_count")).intValue();

        System.out.println("  상태: " + status + ", 평점: " + ratingAvg + ", 리뷰 수: " + reviewCount);

        assertThat(failCount.get()).isZero();
        assertThat(((Number) review.get("rating")).intValue()).isEqualTo(1);
        if ("APPROVED".equals(status)) {
            // 수정 → 승인
            assertThat(ratingAvg).isEqualByComparingTo("2.00");
            assertThat(reviewCount).isEqualTo(2);
        } else {
            // 승인 → 수정
            assertThat(status).isEqualTo("PENDING");
            assertThat(ratingAvg).isEqualByComparingTo("3.00");
            assertThat(reviewCount).isEqualTo(1);
        }
    }

    private void insertUser(long userId, String username, String role) {
        jdbcTemplate.update(
                "INSERT INTO users (user_id, username, password_hash, role) VALUES (?, ?, ?, ?)",
                userId, username, "{noop}password", role);
    }

    private void cleanUp() {
        jdbcTemplate.update("DELETE FROM review_helpfuls");
        jdbcTemplate.update("DELETE FROM review_images");
        jdbcTemplate.update("DELETE FROM reviews");
        jdbcTemplate.update("DELETE FROM order_items");
        jdbcTemplate.update("DELETE FROM orders");
        jdbcTemplate.update("DELETE FROM products");
        jdbcTemplate.update("DELETE FROM users");
    }
}
