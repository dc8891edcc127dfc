package com.shophub.domain.review.service;

import com.shophub.domain.review.entity.ReviewStatus;
import com.shophub.domain.review.event.ReviewModeratedEvent;
import com.shophub.domain.review.event.ReviewSubmittedEvent;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 리뷰 작성/검수 결과를 구매자에게 알린다.
 *
 * 커밋된 변경에 대해서만 알림이 나가도록 AFTER_COMMIT에서 처리한다.
 * 실제 발송(메일/푸시)은 외부 알림 시스템의 책임이며, 여기서는 발송 요청을 기록한다.
 */
@Component
public class ReviewNotificationListener {

    private final ReviewEventLogger reviewEventLogger;

    public ReviewNotificationListener(ReviewEventLogger reviewEventLogger) {
        this.reviewEventLogger = reviewEventLogger;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handle(ReviewSubmittedEvent event) {
        reviewEventLogger.notificationQueued(event.buyerId(), event.reviewId(), ReviewStatus.PENDING);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handle(ReviewModeratedEvent event) {
        reviewEventLogger.notificationQueued(event.buyerId(), event.reviewId(), event.status());
    }
}
