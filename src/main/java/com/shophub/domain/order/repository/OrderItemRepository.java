package com.shophub.domain.order.repository;

import com.shophub.domain.order.entity.OrderItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface OrderItemRepository extends JpaRepository<OrderItem, Long> {

    /**
     * 주문과 주문 상품 목록을 함께 로딩한다. 구매 인증 판단에 주문 전체 상품이 필요하다.
     */
    @Query("""
            SELECT oi FROM OrderItem oi
            JOIN FETCH oi.order o
            LEFT JOIN FETCH o.items
            WHERE oi.orderItemId = :orderItemId
            """)
    Optional<OrderItem> findByIdWithOrder(@Param("orderItemId") Long orderItemId);

    /**
     * 리뷰 작성 가능한 주문 상품: 배송 완료된 본인 주문이고, 해당 상품에 아직 리뷰가 없는 경우.
     * 리뷰는 (구매자, 상품)당 하나이므로 상품 단위로 제외한다.
     */
    @Query("""
            SELECT oi FROM OrderItem oi
            JOIN FETCH oi.order o
            WHERE o.userId = :userId
              AND oi.productId = :productId
              AND o.orderStatus = com.shophub.domain.order.entity.OrderStatus.DELIVERED
              AND NOT EXISTS (
                  SELECT 1 FROM Review r
                  WHERE r.userId = :userId
                    AND r.productId = oi.productId
              )
            ORDER BY o.deliveredAt DESC, oi.orderItemId DESC
            """)
    List<OrderItem> findDeliveredItemsForReview(@Param("userId") Long userId, @Param("productId") Long productId);
}
