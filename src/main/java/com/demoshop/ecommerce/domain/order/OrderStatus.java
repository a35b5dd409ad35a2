package com.demoshop.ecommerce.domain.order;

import lombok.Getter;

/**
 * OrderStatus - 도메인 값 객체 (Enum)
 *
 * 결제 즉시 주문이 완료되므로 대기/실패 상태는 존재하지 않는다.
 */
@Getter
public enum OrderStatus {
    COMPLETED("completed", "주문 완료");

    private final String value;
    private final String displayName;

    OrderStatus(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }
}
