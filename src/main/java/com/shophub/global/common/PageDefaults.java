package com.shophub.global.common;

/**
 * 컨트롤러/서비스에서 사용하는 페이지 크기 상수 모음.
 */
public final class PageDefaults {

    private PageDefaults() {}

    /** 상품별 리뷰 목록 / 내 리뷰 목록 페이지 크기 */
    public static final int REVIEW_LIST_SIZE = 10;
    /** 관리자 검수 대기 목록 페이지 크기 */
    public static final int ADMIN_LIST_SIZE = 20;
}
