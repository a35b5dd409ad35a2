package com.demoshop.ecommerce.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 장바구니 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartResponseDto {

    @JsonProperty("id")
    private String cartId;

    @JsonProperty("user_id")
    private String userId;

    private List<CartItemResponse> items;

    @JsonProperty("total")
    private BigDecimal totalPrice;

    @JsonProperty("updated")
    private LocalDateTime updatedAt;
}
