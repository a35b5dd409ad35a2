package com.demoshop.ecommerce.presentation.order.response;

import com.demoshop.ecommerce.presentation.cart.response.CartItemResponse;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResponse {

    @JsonProperty("id")
    private String orderId;

    @JsonProperty("user_id")
    private String userId;

    private List<CartItemResponse> items;

    @JsonProperty("total")
    private BigDecimal totalPrice;

    private String status;

    @JsonProperty("created")
    private LocalDateTime createdAt;

    @JsonProperty("completed")
    private LocalDateTime completedAt;
}
