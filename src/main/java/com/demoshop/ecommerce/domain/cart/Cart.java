package com.demoshop.ecommerce.domain.cart;

import com.demoshop.ecommerce.domain.product.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Cart 도메인 엔티티 (Rich Domain Model)
 * 사용자별 쇼핑 카트 (사용자당 하나)
 *
 * 핵심 비즈니스 규칙:
 * - 장바구니 내 상품 ID당 라인은 최대 하나 (같은 상품 추가 시 수량 누적)
 * - 라인 수량은 항상 1 이상 (차감 결과가 0 이하이면 라인 삭제)
 * - totalPrice는 저장값을 신뢰하지 않고 현재 카탈로그 가격으로 항상 재계산
 * - 결제 후에도 cartId는 유지되고 항목과 총액만 초기화
 */
@Getter
@Builder
@AllArgsConstructor
public class Cart {

    private final String cartId;

    private final String userId;

    @Builder.Default
    private final List<CartItem> items = new ArrayList<>();

    @Builder.Default
    private BigDecimal totalPrice = CartConstants.ZERO_TOTAL;

    private final LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * 새 장바구니 생성 (빈 항목, 총액 0)
     */
    public static Cart createFor(String userId, LocalDateTime now) {
        return Cart.builder()
                .cartId(UUID.randomUUID().toString())
                .userId(userId)
                .items(new ArrayList<>())
                .totalPrice(CartConstants.ZERO_TOTAL)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public List<CartItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public Optional<CartItem> findItem(String productId) {
        return items.stream()
                .filter(item -> item.getProductId().equals(productId))
                .findFirst();
    }

    /**
     * 상품 추가
     * 같은 상품의 라인이 있으면 수량을 누적하고, 없으면 라인을 새로 추가한다.
     */
    public void addItem(String productId, int quantity) {
        if (quantity < CartConstants.MIN_CART_QUANTITY) {
            throw new InvalidQuantityException(quantity);
        }
        Optional<CartItem> existing = findItem(productId);
        if (existing.isPresent()) {
            existing.get().increase(quantity);
        } else {
            items.add(CartItem.of(productId, quantity));
        }
    }

    /**
     * 상품 제거
     * 요청 수량이 라인 수량 이상이면 라인을 삭제하고, 미만이면 수량만 차감한다.
     *
     * @return 장바구니에 해당 상품이 있었는지 여부 (없으면 아무것도 변경하지 않음)
     */
    public boolean removeItem(String productId, int quantity) {
        if (quantity < CartConstants.MIN_CART_QUANTITY) {
            throw new InvalidQuantityException(quantity);
        }
        Iterator<CartItem> iterator = items.iterator();
        while (iterator.hasNext()) {
            CartItem item = iterator.next();
            if (item.getProductId().equals(productId)) {
                if (quantity >= item.getQuantity()) {
                    iterator.remove();
                } else {
                    item.decrease(quantity);
                }
                return true;
            }
        }
        return false;
    }

    /**
     * 총액 재계산
     *
     * 현재 카탈로그 가격 × 수량의 합계.
     * 카탈로그에서 더 이상 조회되지 않는 상품의 라인은 0으로 계산한다.
     *
     * @param catalog 상품 ID → 상품 조회 함수
     */
    public void recalculateTotal(Function<String, Optional<Product>> catalog) {
        BigDecimal total = CartConstants.ZERO_TOTAL;
        for (CartItem item : items) {
            BigDecimal lineTotal = catalog.apply(item.getProductId())
                    .map(product -> product.getPrice().multiply(BigDecimal.valueOf(item.getQuantity())))
                    .orElse(BigDecimal.ZERO);
            total = total.add(lineTotal);
        }
        this.totalPrice = total.setScale(CartConstants.PRICE_SCALE, RoundingMode.HALF_UP);
    }

    public void touch(LocalDateTime now) {
        this.updatedAt = now;
    }

    /**
     * 결제 시점 항목 스냅샷 (깊은 복사)
     */
    public List<CartItem> snapshotItems() {
        List<CartItem> snapshot = new ArrayList<>(items.size());
        for (CartItem item : items) {
            snapshot.add(item.copy());
        }
        return snapshot;
    }

    /**
     * 결제 후 초기화: 항목 비우고 총액 0 (cartId 유지)
     */
    public void clear(LocalDateTime now) {
        this.items.clear();
        this.totalPrice = CartConstants.ZERO_TOTAL;
        this.updatedAt = now;
    }

    /**
     * 저장소 경계에서 사용하는 깊은 복사본
     */
    public Cart copy() {
        return Cart.builder()
                .cartId(cartId)
                .userId(userId)
                .items(snapshotItems())
                .totalPrice(totalPrice)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .build();
    }
}
