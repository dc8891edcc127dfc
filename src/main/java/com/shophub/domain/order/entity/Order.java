package com.shophub.domain.order.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 주문. 리뷰 도메인에서는 배송 완료 여부와 구매 인증(주문 상품 포함 여부) 판단에만 사용한다.
 */
@Entity
@Table(name = "orders")
public class Order {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "order_number", unique = true, nullable = false, length = 50)
    private String orderNumber;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_status", nullable = false, length = 20)
    private OrderStatus orderStatus;

    @Column(name = "order_date", nullable = false)
    private LocalDateTime orderDate;

    @Column(name = "delivered_at")
    private LocalDateTime deliveredAt;

    @OneToMany(mappedBy = "order", fetch = FetchType.LAZY, cascade = CascadeType.ALL, orphanRemoval = true)
    private List<OrderItem> items = new ArrayList<>();

    protected Order() {}

    public Order(String orderNumber, Long userId) {
        this.orderNumber = orderNumber;
        this.userId = userId;
        this.orderStatus = OrderStatus.PENDING;
        this.orderDate = LocalDateTime.now();
    }

    public void addItem(OrderItem item) {
        items.add(item);
        item.setOrder(this);
    }

    public void markDelivered() {
        this.orderStatus = OrderStatus.DELIVERED;
        this.deliveredAt = LocalDateTime.now();
    }

    public boolean isDelivered() {
        return orderStatus == OrderStatus.DELIVERED;
    }

    /**
     * 주문 상품 중 해당 상품이 포함되어 있는지. 리뷰의 구매 인증(verifiedPurchase) 판단 기준이다.
     */
    public boolean containsProduct(Long productId) {
        return items.stream().anyMatch(item -> item.getProductId().equals(productId));
    }

    public Long getOrderId() { return orderId; }
    public String getOrderNumber() { return orderNumber; }
    public Long getUserId() { return userId; }
    public OrderStatus getOrderStatus() { return orderStatus; }
    public LocalDateTime getOrderDate() { return orderDate; }
    public LocalDateTime getDeliveredAt() { return deliveredAt; }
    public List<OrderItem> getItems() { return items; }
}
