package com.demoshop.ecommerce.common.exception;

/**
 * DomainException - 도메인 규칙 위반 예외
 *
 * 역할:
 * - 비즈니스 도메인의 규칙 위반 또는 호출자의 잘못된 입력 시 발생
 * - 재시도 대상이 아님 (로컬, 동기, 결정적)
 * - 일반적으로 클라이언트 오류(4XX)로 응답
 *
 * 사용 예:
 * - CartNotFoundException: 장바구니 조회 실패
 * - InsufficientStockException: 재고 부족
 * - EmptyCartException: 빈 장바구니 결제
 */
public class DomainException extends BizException {

    public DomainException(ErrorCode errorCode) {
        super(errorCode);
    }

    public DomainException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public DomainException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
