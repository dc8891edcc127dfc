package com.shophub.global.exception;

public class DuplicateReviewException extends BusinessException {
    public DuplicateReviewException() {
        super("DUPLICATE_REVIEW", "이미 이 상품에 리뷰를 작성하였습니다.");
    }
}
