package com.demoshop.ecommerce.domain.cart;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * CartItem 도메인 엔티티
 * 장바구니의 라인 항목 (상품 ID + 수량)
 *
 * 불변식:
 * - 수량은 항상 1 이상 (0이 되는 경우 Cart에서 라인 자체를 삭제)
 */
@Getter
@Builder
@AllArgsConstructor
public class CartItem {

    private final String productId;

    private int quantity;

    public static CartItem of(String productId, int quantity) {
        if (quantity < CartConstants.MIN_CART_QUANTITY) {
            throw new InvalidQuantityException(quantity);
        }
        return new CartItem(productId, quantity);
    }

    void increase(int amount) {
        this.quantity += amount;
    }

    void decrease(int amount) {
        if (amount >= this.quantity) {
            throw new IllegalStateException("라인 수량 이상 차감은 라인 삭제로 처리해야 합니다");
        }
        this.quantity -= amount;
    }

    CartItem copy() {
        return new CartItem(this.productId, this.quantity);
    }
}
