package com.demoshop.ecommerce.infrastructure.lock;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 사용자별 락 어노테이션
 *
 * 메서드에 붙여서 프로세스 내 ReentrantLock 기반 상호 배제를 적용합니다.
 * 같은 키를 가진 호출은 순차 실행되므로 "조회 → 변경 → 총액 재계산 → 저장" 사이에
 * 다른 변경이 끼어들 수 없습니다.
 * Spring EL을 지원하므로 메서드 파라미터를 동적 키로 사용할 수 있습니다.
 *
 * 예제:
 * @UserLock(key = LockKeyGenerator.CART_KEY_TEMPLATE)
 * public CartResult addItem(String userId, AddCartItemCommand command) { ... }
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface UserLock {

    /**
     * 락 키 (Spring EL)
     *
     * - #p0, #p1, ... : 메서드 파라미터 (위치 기반)
     * - "'cart:' + #p0" : 첫 번째 파라미터를 사용자 ID로 사용
     */
    String key();
}
