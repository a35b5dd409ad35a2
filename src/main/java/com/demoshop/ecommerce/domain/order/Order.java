package com.demoshop.ecommerce.domain.order;

import com.demoshop.ecommerce.domain.cart.Cart;
import com.demoshop.ecommerce.domain.cart.CartItem;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Order 도메인 엔티티
 *
 * 핵심 비즈니스 규칙:
 * - 결제(checkout)로만 생성되며 생성 후 변경/삭제되지 않음
 * - 항목과 총액은 결제 시점 장바구니의 스냅샷
 * - 항목이 비어 있는 주문은 존재하지 않음
 * - 생성 즉시 COMPLETED (createdAt == completedAt)
 */
@Getter
@Builder
public class Order {

    private final String orderId;

    private final String userId;

    private final List<OrderItem> orderItems;

    private final BigDecimal totalPrice;

    private final OrderStatus orderStatus;

    private final LocalDateTime createdAt;

    private final LocalDateTime completedAt;

    /**
     * 장바구니 스냅샷으로 완료 주문 생성
     *
     * @param cart 결제할 장바구니 (비어 있으면 안 됨)
     * @param now  결제 시각
     */
    public static Order completeFrom(Cart cart, LocalDateTime now) {
        if (cart.isEmpty()) {
            throw new IllegalArgumentException("빈 장바구니로 주문을 생성할 수 없습니다");
        }
        List<OrderItem> items = List.copyOf(cart.snapshotItems().stream()
                .map(Order::toOrderItem)
                .collect(Collectors.toList()));

        return Order.builder()
                .orderId(UUID.randomUUID().toString())
                .userId(cart.getUserId())
                .orderItems(items)
                .totalPrice(cart.getTotalPrice())
                .orderStatus(OrderStatus.COMPLETED)
                .createdAt(now)
                .completedAt(now)
                .build();
    }

    private static OrderItem toOrderItem(CartItem cartItem) {
        return OrderItem.builder()
                .productId(cartItem.getProductId())
                .quantity(cartItem.getQuantity())
                .build();
    }
}
