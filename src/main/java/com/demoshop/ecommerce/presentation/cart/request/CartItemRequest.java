package com.demoshop.ecommerce.presentation.cart.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 아이템 추가/제거 요청 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItemRequest {

    @JsonProperty("product_id")
    private String productId;

    private Integer quantity;
}
