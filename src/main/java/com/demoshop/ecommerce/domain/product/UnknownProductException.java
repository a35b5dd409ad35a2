package com.demoshop.ecommerce.domain.product;

import com.demoshop.ecommerce.common.exception.DomainException;
import com.demoshop.ecommerce.common.exception.ErrorCode;

/**
 * 장바구니에 카탈로그에 없는 상품을 담으려 할 때 발생하는 예외 (ErrorType.VALIDATION)
 */
public class UnknownProductException extends DomainException {

    public UnknownProductException(String productId) {
        super(ErrorCode.UNKNOWN_PRODUCT, "productId=" + productId);
    }
}
