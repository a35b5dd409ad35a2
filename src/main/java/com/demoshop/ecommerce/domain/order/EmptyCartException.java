package com.demoshop.ecommerce.domain.order;

import com.demoshop.ecommerce.common.exception.DomainException;
import com.demoshop.ecommerce.common.exception.ErrorCode;

/**
 * 결제할 장바구니가 없거나 비어 있을 때 발생하는 예외 (ErrorType.VALIDATION)
 */
public class EmptyCartException extends DomainException {

    private EmptyCartException(ErrorCode errorCode, String userId) {
        super(errorCode, "userId=" + userId);
    }

    public static EmptyCartException noCart(String userId) {
        return new EmptyCartException(ErrorCode.CHECKOUT_CART_NOT_FOUND, userId);
    }

    public static EmptyCartException emptyCart(String userId) {
        return new EmptyCartException(ErrorCode.EMPTY_CART, userId);
    }
}
