package com.demoshop.ecommerce.application.order;

import com.demoshop.ecommerce.application.order.dto.OrderResponse;
import com.demoshop.ecommerce.common.exception.InvalidRequestException;
import com.demoshop.ecommerce.domain.cart.Cart;
import com.demoshop.ecommerce.domain.cart.CartRepository;
import com.demoshop.ecommerce.domain.order.EmptyCartException;
import com.demoshop.ecommerce.domain.order.Order;
import com.demoshop.ecommerce.domain.order.OrderRepository;
import com.demoshop.ecommerce.domain.product.ProductRepository;
import com.demoshop.ecommerce.infrastructure.lock.LockKeyGenerator;
import com.demoshop.ecommerce.infrastructure.lock.UserLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderService - 결제 및 주문 이력 (Application 계층)
 *
 * 결제 플로우 (장바구니 변경과 같은 사용자 락 안에서 한 단위로 실행):
 * 1. 장바구니 조회 (없거나 비어 있으면 ValidationError)
 * 2. 현재 카탈로그 가격으로 총액 재계산
 * 3. 항목/총액 스냅샷으로 COMPLETED 주문 생성 및 저장
 * 4. 장바구니 비우기 (cartId 유지)
 *
 * 재고는 결제 시 차감하지 않는다.
 */
@Slf4j
@Service
public class OrderService {

    private final CartRepository cartRepository;
    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;

    public OrderService(CartRepository cartRepository,
                        OrderRepository orderRepository,
                        ProductRepository productRepository) {
        this.cartRepository = cartRepository;
        this.orderRepository = orderRepository;
        this.productRepository = productRepository;
    }

    @UserLock(key = LockKeyGenerator.CART_KEY_TEMPLATE)
    public OrderResponse checkout(String userId) {
        InvalidRequestException.requireUserId(userId);

        Cart cart = cartRepository.findByUserId(userId)
                .orElseThrow(() -> EmptyCartException.noCart(userId));
        if (cart.isEmpty()) {
            throw EmptyCartException.emptyCart(userId);
        }

        LocalDateTime now = LocalDateTime.now();
        cart.recalculateTotal(productRepository::findById);

        Order order = orderRepository.save(Order.completeFrom(cart, now));

        cart.clear(now);
        cartRepository.save(cart);

        log.info("[OrderService] 결제 완료: userId={}, orderId={}, items={}, total={}",
                userId, order.getOrderId(), order.getOrderItems().size(), order.getTotalPrice());
        return OrderResponse.from(order);
    }

    /**
     * 사용자 주문 이력 (생성 순서, 없으면 빈 목록)
     */
    public List<OrderResponse> getOrderHistory(String userId) {
        InvalidRequestException.requireUserId(userId);
        return orderRepository.findByUserId(userId).stream()
                .map(OrderResponse::from)
                .collect(Collectors.toList());
    }
}
