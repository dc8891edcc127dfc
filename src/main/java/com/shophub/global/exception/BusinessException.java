package com.shophub.global.exception;

/**
 * 도메인 규칙 위반을 표현하는 기본 예외.
 *
 * code는 API 응답의 error.code로 그대로 노출되므로 클라이언트가 분기 처리에 사용할 수 있다.
 * RuntimeException이므로 @Transactional 경계에서 롤백된다.
 */
public class BusinessException extends RuntimeException {

    private final String code;

    public BusinessException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
