package com.shophub.global.exception;

/**
 * 리소스 소유자가 아닌 사용자의 요청(NOT_OWNER, NOT_PRODUCT_OWNER).
 */
public class ForbiddenException extends BusinessException {
    public ForbiddenException(String code, String message) {
        super(code, message);
    }
}
