package com.demoshop.ecommerce.domain.product;

import com.demoshop.ecommerce.common.exception.DomainException;
import com.demoshop.ecommerce.common.exception.ErrorCode;

/**
 * ProductNotFoundException - 상품을 찾을 수 없을 때 발생하는 예외 (Domain 계층)
 *
 * 역할:
 * - 상품 단건 조회 시 존재하지 않는 경우 발생
 * - HTTP 404 Not Found 응답으로 변환됨
 *
 * 장바구니 추가 시 알 수 없는 상품은 이 예외가 아니라 UnknownProductException(400)으로 처리한다.
 */
public class ProductNotFoundException extends DomainException {

    public ProductNotFoundException(String productId) {
        super(ErrorCode.PRODUCT_NOT_FOUND, "productId=" + productId);
    }
}
