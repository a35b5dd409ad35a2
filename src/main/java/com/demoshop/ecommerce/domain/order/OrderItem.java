package com.demoshop.ecommerce.domain.order;

import lombok.Builder;
import lombok.Getter;

/**
 * OrderItem 도메인 값 객체
 * 결제 시점 장바구니 라인의 고정 스냅샷
 */
@Getter
@Builder
public class OrderItem {

    private final String productId;

    private final int quantity;
}
