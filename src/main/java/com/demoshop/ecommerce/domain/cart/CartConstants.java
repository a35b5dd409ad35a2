package com.demoshop.ecommerce.domain.cart;

import java.math.BigDecimal;

/**
 * CartConstants - 장바구니 도메인 상수
 *
 * 역할:
 * - 장바구니 항목 수량 검증 규칙
 * - 총액 계산 스케일
 */
public class CartConstants {

    /** 장바구니 항목 최소 수량 */
    public static final int MIN_CART_QUANTITY = 1;

    /** 금액 소수점 자리수 */
    public static final int PRICE_SCALE = 2;

    public static final BigDecimal ZERO_TOTAL = BigDecimal.ZERO.setScale(PRICE_SCALE);

    private CartConstants() {
        throw new AssertionError("CartConstants는 인스턴스화할 수 없습니다");
    }
}
