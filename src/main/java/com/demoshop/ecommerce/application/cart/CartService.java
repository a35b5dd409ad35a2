package com.demoshop.ecommerce.application.cart;

import com.demoshop.ecommerce.application.cart.dto.CartItemCommand;
import com.demoshop.ecommerce.application.cart.dto.CartResponseDto;
import com.demoshop.ecommerce.common.exception.InvalidRequestException;
import com.demoshop.ecommerce.domain.cart.Cart;
import com.demoshop.ecommerce.domain.cart.CartConstants;
import com.demoshop.ecommerce.domain.cart.CartNotFoundException;
import com.demoshop.ecommerce.domain.cart.CartRepository;
import com.demoshop.ecommerce.domain.cart.InvalidQuantityException;
import com.demoshop.ecommerce.domain.product.InsufficientStockException;
import com.demoshop.ecommerce.domain.product.Product;
import com.demoshop.ecommerce.domain.product.ProductRepository;
import com.demoshop.ecommerce.domain.product.UnknownProductException;
import com.demoshop.ecommerce.infrastructure.lock.LockKeyGenerator;
import com.demoshop.ecommerce.infrastructure.lock.UserLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * CartService - Application 계층
 * 장바구니 변경 규칙 처리
 *
 * 아키텍처:
 * - Domain 계층의 CartRepository, ProductRepository 인터페이스에만 의존 (Port)
 * - 변경 연산은 @UserLock으로 사용자 단위 직렬화
 *   (조회 → 항목 변경 → 총액 재계산 → 저장이 한 단위로 실행됨)
 */
@Slf4j
@Service
public class CartService {

    private final CartRepository cartRepository;
    private final ProductRepository productRepository;

    public CartService(CartRepository cartRepository,
                       ProductRepository productRepository) {
        this.cartRepository = cartRepository;
        this.productRepository = productRepository;
    }

    /**
     * 장바구니 조회
     *
     * @throws CartNotFoundException 아직 장바구니가 없는 경우
     */
    public CartResponseDto getCart(String userId) {
        InvalidRequestException.requireUserId(userId);

        Cart cart = cartRepository.findByUserId(userId)
                .orElseThrow(() -> new CartNotFoundException(userId));
        return CartResponseDto.fromCart(cart);
    }

    /**
     * 장바구니에 아이템 추가
     *
     * 재고 검증은 누적 수량이 아닌 이번 요청 수량 기준으로만 수행한다.
     * 검증 실패 시 장바구니는 생성되지도 변경되지도 않는다.
     */
    @UserLock(key = LockKeyGenerator.CART_KEY_TEMPLATE)
    public CartResponseDto addItem(String userId, CartItemCommand command) {
        InvalidRequestException.requireUserId(userId);
        validateQuantity(command.getQuantity());

        Product product = productRepository.findById(command.getProductId())
                .orElseThrow(() -> new UnknownProductException(command.getProductId()));

        if (!product.hasStockFor(command.getQuantity())) {
            throw new InsufficientStockException(product.getProductId(), command.getQuantity(), product.getStock());
        }

        Cart cart = cartRepository.findOrCreateByUserId(userId);
        cart.addItem(product.getProductId(), command.getQuantity());
        Cart saved = recalculateAndSave(cart);

        log.info("[CartService] 아이템 추가: userId={}, productId={}, quantity={}, total={}",
                userId, product.getProductId(), command.getQuantity(), saved.getTotalPrice());
        return CartResponseDto.fromCart(saved);
    }

    /**
     * 장바구니에서 아이템 제거
     *
     * - 요청 수량 >= 라인 수량: 라인 삭제
     * - 요청 수량 < 라인 수량: 수량 차감
     * - 장바구니에 없는 상품: 변경 없이 현재 장바구니 반환
     *
     * @throws CartNotFoundException 아직 장바구니가 없는 경우
     */
    @UserLock(key = LockKeyGenerator.CART_KEY_TEMPLATE)
    public CartResponseDto removeItem(String userId, CartItemCommand command) {
        InvalidRequestException.requireUserId(userId);
        validateQuantity(command.getQuantity());

        Cart cart = cartRepository.findByUserId(userId)
                .orElseThrow(() -> new CartNotFoundException(userId));

        boolean removed = cart.removeItem(command.getProductId(), command.getQuantity());
        if (!removed) {
            log.debug("[CartService] 장바구니에 없는 상품 제거 요청 무시: userId={}, productId={}",
                    userId, command.getProductId());
        }
        Cart saved = recalculateAndSave(cart);

        log.info("[CartService] 아이템 제거: userId={}, productId={}, quantity={}, total={}",
                userId, command.getProductId(), command.getQuantity(), saved.getTotalPrice());
        return CartResponseDto.fromCart(saved);
    }

    /**
     * 총액 재계산 후 저장 (현재 카탈로그 가격 기준)
     */
    private Cart recalculateAndSave(Cart cart) {
        cart.recalculateTotal(productRepository::findById);
        cart.touch(LocalDateTime.now());
        return cartRepository.save(cart);
    }

    /**
     * 수량 유효성 검증
     */
    private void validateQuantity(Integer quantity) {
        if (quantity == null || quantity < CartConstants.MIN_CART_QUANTITY) {
            throw new InvalidQuantityException(quantity);
        }
    }
}
