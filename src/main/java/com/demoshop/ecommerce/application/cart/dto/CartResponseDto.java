package com.demoshop.ecommerce.application.cart.dto;

import com.demoshop.ecommerce.domain.cart.Cart;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 장바구니 응답 (Application layer 내부 DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartResponseDto {
    private String cartId;
    private String userId;
    private List<CartItemResponse> items;
    private BigDecimal totalPrice;
    private LocalDateTime updatedAt;

    public static CartResponseDto fromCart(Cart cart) {
        return CartResponseDto.builder()
                .cartId(cart.getCartId())
                .userId(cart.getUserId())
                .items(cart.getItems().stream()
                        .map(CartItemResponse::from)
                        .collect(Collectors.toList()))
                .totalPrice(cart.getTotalPrice())
                .updatedAt(cart.getUpdatedAt())
                .build();
    }
}
