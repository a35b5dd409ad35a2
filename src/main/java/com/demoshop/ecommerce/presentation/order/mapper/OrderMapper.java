package com.demoshop.ecommerce.presentation.order.mapper;

import com.demoshop.ecommerce.application.order.dto.OrderItemResponse;
import com.demoshop.ecommerce.application.order.dto.OrderResponse;
import com.demoshop.ecommerce.presentation.cart.response.CartItemResponse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderMapper - Application OrderResponse → Presentation OrderResponse 변환
 * 주문 라인은 장바구니 라인과 같은 {product_id, quantity} 형태로 직렬화된다.
 */
@Component
public class OrderMapper {

    public com.demoshop.ecommerce.presentation.order.response.OrderResponse toOrderResponse(OrderResponse order) {
        return com.demoshop.ecommerce.presentation.order.response.OrderResponse.builder()
                .orderId(order.getOrderId())
                .userId(order.getUserId())
                .items(order.getItems().stream()
                        .map(this::toItemResponse)
                        .collect(Collectors.toList()))
                .totalPrice(order.getTotalPrice())
                .status(order.getStatus())
                .createdAt(order.getCreatedAt())
                .completedAt(order.getCompletedAt())
                .build();
    }

    public List<com.demoshop.ecommerce.presentation.order.response.OrderResponse> toOrderResponses(List<OrderResponse> orders) {
        return orders.stream()
                .map(this::toOrderResponse)
                .collect(Collectors.toList());
    }

    private CartItemResponse toItemResponse(OrderItemResponse item) {
        return CartItemResponse.builder()
                .productId(item.getProductId())
                .quantity(item.getQuantity())
                .build();
    }
}
