package com.demoshop.ecommerce.domain.cart;

import java.util.Optional;

/**
 * Cart Repository Interface (Domain Layer - Port)
 * 의존성 역전: 구현체는 이 인터페이스에 의존한다.
 *
 * 구현체는 저장/조회 시 복사본을 주고받아야 한다.
 * (조회한 Cart를 변경해도 save 전까지는 저장소 상태가 바뀌지 않음)
 */
public interface CartRepository {

    /**
     * 사용자의 장바구니 조회
     */
    Optional<Cart> findByUserId(String userId);

    /**
     * 사용자의 장바구니 조회 또는 생성 (생성 시 저장까지 수행)
     */
    Cart findOrCreateByUserId(String userId);

    /**
     * 장바구니 저장 (생성 또는 수정)
     */
    Cart save(Cart cart);
}
