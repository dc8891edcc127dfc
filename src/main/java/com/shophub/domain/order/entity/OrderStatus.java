package com.shophub.domain.order.entity;

public enum OrderStatus {
    PENDING("결제대기"),
    PAID("결제완료"),
    SHIPPED("배송중"),
    DELIVERED("배송완료"),
    CANCELLED("주문취소");

    private final String label;

    OrderStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
