package com.shophub.domain.review.dto;

import com.shophub.domain.order.entity.OrderItem;

import java.time.LocalDateTime;

public record ReviewableOrderItemResponse(
        Long orderItemId,
        Long orderId,
        String orderNumber,
        Long productId,
        String productName,
        LocalDateTime deliveredAt
) {
    public static ReviewableOrderItemResponse from(OrderItem orderItem) {
        return new ReviewableOrderItemResponse(
                orderItem.getOrderItemId(),
                orderItem.getOrder().getOrderId(),
                orderItem.getOrder().getOrderNumber(),
                orderItem.getProductId(),
                orderItem.getProductName(),
                orderItem.getOrder().getDeliveredAt()
        );
    }
}
