package com.demoshop.ecommerce.infrastructure.persistence.cart;

import com.demoshop.ecommerce.domain.cart.Cart;
import com.demoshop.ecommerce.domain.cart.CartRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * InMemory Cart Repository 구현
 * ConcurrentHashMap 기반의 인메모리 저장소
 *
 * 저장/조회 모두 복사본을 사용하므로 호출자가 조회한 Cart를 수정해도
 * save() 전까지 저장소 상태는 바뀌지 않는다.
 */
@Repository
public class InMemoryCartRepository implements CartRepository {

    private final ConcurrentHashMap<String, Cart> carts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> userCartMap = new ConcurrentHashMap<>(); // userId -> cartId 매핑

    @Override
    public Optional<Cart> findByUserId(String userId) {
        String cartId = userCartMap.get(userId);
        if (cartId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(carts.get(cartId)).map(Cart::copy);
    }

    @Override
    public Cart findOrCreateByUserId(String userId) {
        String cartId = userCartMap.computeIfAbsent(userId, id -> {
            Cart created = Cart.createFor(id, LocalDateTime.now());
            carts.put(created.getCartId(), created);
            return created.getCartId();
        });
        return carts.get(cartId).copy();
    }

    @Override
    public Cart save(Cart cart) {
        Cart stored = cart.copy();
        carts.put(stored.getCartId(), stored);
        userCartMap.putIfAbsent(stored.getUserId(), stored.getCartId());
        return stored.copy();
    }

    /**
     * 테스트용: 모든 장바구니 삭제
     */
    public void clear() {
        carts.clear();
        userCartMap.clear();
    }
}
