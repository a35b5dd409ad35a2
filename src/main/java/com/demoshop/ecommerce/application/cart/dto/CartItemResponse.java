package com.demoshop.ecommerce.application.cart.dto;

import com.demoshop.ecommerce.domain.cart.CartItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 아이템 응답 (Application layer 내부 DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItemResponse {
    private String productId;
    private Integer quantity;

    public static CartItemResponse from(CartItem item) {
        return CartItemResponse.builder()
                .productId(item.getProductId())
                .quantity(item.getQuantity())
                .build();
    }
}
