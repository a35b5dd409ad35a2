package com.demoshop.ecommerce.domain.product;

import com.demoshop.ecommerce.common.exception.DomainException;
import com.demoshop.ecommerce.common.exception.ErrorCode;
import lombok.Getter;

/**
 * InsufficientStockException - 요청 수량이 카탈로그 재고를 초과할 때 발생하는 예외
 */
@Getter
public class InsufficientStockException extends DomainException {

    private final String productId;
    private final int requested;
    private final int available;

    public InsufficientStockException(String productId, int requested, int available) {
        super(ErrorCode.INSUFFICIENT_STOCK,
                String.format("productId=%s (요청: %d, 보유: %d)", productId, requested, available));
        this.productId = productId;
        this.requested = requested;
        this.available = available;
    }
}
