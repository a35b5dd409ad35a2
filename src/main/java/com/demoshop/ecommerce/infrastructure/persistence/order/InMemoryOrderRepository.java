package com.demoshop.ecommerce.infrastructure.persistence.order;

import com.demoshop.ecommerce.domain.order.Order;
import com.demoshop.ecommerce.domain.order.OrderRepository;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * InMemoryOrderRepository - Order 저장소 구현체 (인메모리)
 *
 * 주문은 추가 전용이다. 같은 orderId로 다시 저장하려 하면 거부한다.
 * 사용자별 목록은 저장 순서(=생성 순서)를 유지한다.
 */
@Repository
public class InMemoryOrderRepository implements OrderRepository {

    private final ConcurrentHashMap<String, Order> orders = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<Order>> ordersByUser = new ConcurrentHashMap<>();

    @Override
    public Order save(Order order) {
        Order previous = orders.putIfAbsent(order.getOrderId(), order);
        if (previous != null) {
            throw new IllegalStateException("주문은 수정할 수 없습니다: " + order.getOrderId());
        }
        ordersByUser.computeIfAbsent(order.getUserId(), id -> new CopyOnWriteArrayList<>()).add(order);
        return order;
    }

    @Override
    public Optional<Order> findById(String orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public List<Order> findByUserId(String userId) {
        return new ArrayList<>(ordersByUser.getOrDefault(userId, List.of()));
    }

    /**
     * 테스트용: 모든 주문 삭제
     */
    public void clear() {
        orders.clear();
        ordersByUser.clear();
    }
}
