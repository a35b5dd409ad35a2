package com.demoshop.ecommerce.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 역할:
 * - 모든 비즈니스 예외의 코드와 메시지 정의
 * - HTTP 상태 코드 및 ErrorType 매핑
 * - 일관된 에러 응답 제공
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: DOMAIN_CART_NOT_FOUND, SYSTEM_LOCK_ACQUISITION_FAILED
 */
public enum ErrorCode {

    // ========== Request Validation (400) ==========

    INVALID_REQUEST("DOMAIN_INVALID_REQUEST", "잘못된 요청입니다", 400, ErrorType.VALIDATION),
    USER_ID_REQUIRED("DOMAIN_USER_ID_REQUIRED", "user_id는 필수입니다", 400, ErrorType.VALIDATION),
    SEARCH_QUERY_REQUIRED("DOMAIN_SEARCH_QUERY_REQUIRED", "검색어는 필수입니다", 400, ErrorType.VALIDATION),
    METHOD_NOT_ALLOWED("DOMAIN_METHOD_NOT_ALLOWED", "지원하지 않는 HTTP 메서드입니다", 405, ErrorType.VALIDATION),
    RESOURCE_NOT_FOUND("DOMAIN_RESOURCE_NOT_FOUND", "요청한 경로를 찾을 수 없습니다", 404, ErrorType.NOT_FOUND),

    // Product Domain
    PRODUCT_NOT_FOUND("DOMAIN_PRODUCT_NOT_FOUND", "상품을 찾을 수 없습니다", 404, ErrorType.NOT_FOUND),
    UNKNOWN_PRODUCT("DOMAIN_PRODUCT_UNKNOWN", "존재하지 않는 상품입니다", 400, ErrorType.VALIDATION),
    INSUFFICIENT_STOCK("DOMAIN_PRODUCT_INSUFFICIENT_STOCK", "재고가 부족합니다", 400, ErrorType.INSUFFICIENT_STOCK),

    // Cart Domain
    CART_NOT_FOUND("DOMAIN_CART_NOT_FOUND", "장바구니를 찾을 수 없습니다", 404, ErrorType.NOT_FOUND),
    CART_INVALID_QUANTITY("DOMAIN_CART_INVALID_QUANTITY", "수량은 1 이상이어야 합니다", 400, ErrorType.VALIDATION),

    // Order Domain
    CHECKOUT_CART_NOT_FOUND("DOMAIN_ORDER_CART_NOT_FOUND", "결제할 장바구니가 없습니다", 400, ErrorType.VALIDATION),
    EMPTY_CART("DOMAIN_ORDER_EMPTY_CART", "장바구니가 비어 있습니다", 400, ErrorType.VALIDATION),

    // ========== System Errors (5XX) ==========

    LOCK_ACQUISITION_FAILED("SYSTEM_LOCK_ACQUISITION_FAILED", "락 획득에 실패했습니다", 503, ErrorType.SYSTEM),
    INTERNAL_SERVER_ERROR("SYSTEM_INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500, ErrorType.SYSTEM);

    private final String code;
    private final String message;
    private final int statusCode;
    private final ErrorType type;

    ErrorCode(String code, String message, int statusCode, ErrorType type) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
        this.type = type;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public ErrorType getType() {
        return type;
    }
}
