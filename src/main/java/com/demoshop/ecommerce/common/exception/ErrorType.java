package com.demoshop.ecommerce.common.exception;

/**
 * ErrorType - 에러 분류
 *
 * 경계 계층(HTTP)이 응답 코드로 변환할 수 있도록 모든 ErrorCode는 정확히 하나의 분류를 가진다.
 * - VALIDATION: 잘못되었거나 누락된 입력 (사용자 ID 누락, 알 수 없는 상품, 빈 검색어, 빈 장바구니 결제)
 * - NOT_FOUND: 참조한 장바구니/상품이 존재하지 않음
 * - INSUFFICIENT_STOCK: 요청 수량이 현재 카탈로그 재고를 초과
 * - SYSTEM: 인프라 오류 (락 획득 실패 등)
 */
public enum ErrorType {
    VALIDATION,
    NOT_FOUND,
    INSUFFICIENT_STOCK,
    SYSTEM
}
