package com.demoshop.ecommerce.domain.cart;

import com.demoshop.ecommerce.common.exception.DomainException;
import com.demoshop.ecommerce.common.exception.ErrorCode;

/**
 * 사용자의 장바구니가 아직 없을 때 발생하는 예외
 */
public class CartNotFoundException extends DomainException {

    public CartNotFoundException(String userId) {
        super(ErrorCode.CART_NOT_FOUND, "userId=" + userId);
    }
}
