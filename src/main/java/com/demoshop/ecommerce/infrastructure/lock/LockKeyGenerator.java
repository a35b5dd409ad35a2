package com.demoshop.ecommerce.infrastructure.lock;

/**
 * 락 키 생성 유틸리티
 *
 * 설계 원칙:
 * - 패턴: resource_type:resource_id
 * - 장바구니 변경과 결제는 같은 키를 사용해야 서로 직렬화된다.
 */
public class LockKeyGenerator {

    // ============ Spring EL 템플릿 (어노테이션용) ============

    /**
     * 사용자 장바구니 락 키 템플릿
     * 사용: @UserLock(key = LockKeyGenerator.CART_KEY_TEMPLATE)
     * 예: addItem(userId="u1", ...) → "cart:u1"
     */
    public static final String CART_KEY_TEMPLATE = "'cart:' + #p0";

    // ============ 프로그래밍 방식 (동적 생성용) ============

    /**
     * @param userId 사용자 ID
     * @return 락 키 (예: "cart:u1")
     */
    public static String cart(String userId) {
        return "cart:" + userId;
    }

    private LockKeyGenerator() {
        throw new AssertionError("이 클래스는 인스턴스화될 수 없습니다");
    }
}
