package com.demoshop.ecommerce.domain.order;

import java.util.List;
import java.util.Optional;

/**
 * Order Repository Interface (Domain Layer - Port)
 * 추가 전용(append-only) 주문 저장소
 */
public interface OrderRepository {

    /**
     * 주문 저장 (신규만 허용)
     */
    Order save(Order order);

    Optional<Order> findById(String orderId);

    /**
     * 사용자의 주문 목록 (생성 순서)
     */
    List<Order> findByUserId(String userId);
}
