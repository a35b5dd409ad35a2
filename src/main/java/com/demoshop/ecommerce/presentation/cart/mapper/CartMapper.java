package com.demoshop.ecommerce.presentation.cart.mapper;

import com.demoshop.ecommerce.application.cart.dto.CartItemCommand;
import com.demoshop.ecommerce.application.cart.dto.CartItemResponse;
import com.demoshop.ecommerce.application.cart.dto.CartResponseDto;
import com.demoshop.ecommerce.presentation.cart.request.CartItemRequest;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * CartMapper - Presentation layer와 Application layer 간의 DTO 변환
 *
 * 책임:
 * - Presentation Request DTO → Application Command 변환
 * - Application Response DTO → Presentation Response DTO 변환
 *
 * @JsonProperty 같은 직렬화 관심사는 Presentation DTO에만 둔다.
 */
@Component
public class CartMapper {

    /**
     * CartItemRequest → CartItemCommand로 변환 (추가/제거 공용)
     */
    public CartItemCommand toCartItemCommand(CartItemRequest request) {
        return CartItemCommand.builder()
                .productId(request.getProductId())
                .quantity(request.getQuantity())
                .build();
    }

    public com.demoshop.ecommerce.presentation.cart.response.CartResponseDto toCartResponseDto(CartResponseDto response) {
        return com.demoshop.ecommerce.presentation.cart.response.CartResponseDto.builder()
                .cartId(response.getCartId())
                .userId(response.getUserId())
                .items(response.getItems().stream()
                        .map(this::toCartItemResponse)
                        .collect(Collectors.toList()))
                .totalPrice(response.getTotalPrice())
                .updatedAt(response.getUpdatedAt())
                .build();
    }

    private com.demoshop.ecommerce.presentation.cart.response.CartItemResponse toCartItemResponse(CartItemResponse item) {
        return com.demoshop.ecommerce.presentation.cart.response.CartItemResponse.builder()
                .productId(item.getProductId())
                .quantity(item.getQuantity())
                .build();
    }
}
