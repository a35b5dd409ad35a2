package com.demoshop.ecommerce.domain.cart;

import com.demoshop.ecommerce.common.exception.DomainException;
import com.demoshop.ecommerce.common.exception.ErrorCode;

/**
 * 유효하지 않은 수량일 때 발생하는 예외
 */
public class InvalidQuantityException extends DomainException {

    public InvalidQuantityException(Integer quantity) {
        super(ErrorCode.CART_INVALID_QUANTITY, "입력값: " + quantity);
    }
}
