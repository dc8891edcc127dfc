package com.shophub.domain.product.repository;

import com.shophub.domain.product.entity.Product;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface ProductRepository extends JpaRepository<Product, Long> {

    /**
     * 평점 재계산 전에 상품 행을 잠근다. 같은 상품의 재계산이 직렬화되어
     * 뒤에 오는 트랜잭션의 집계 쿼리가 앞선 커밋을 반영한다.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Product p WHERE p.productId = :id")
    Optional<Product> findByIdWithLock(@Param("id") Long id);
}
