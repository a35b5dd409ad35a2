package com.demoshop.ecommerce.domain.product;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Product 도메인 엔티티
 *
 * 책임:
 * - 카탈로그 상품 정보 보관 (시딩 이후 불변)
 * - 재고 충분 여부 판단
 * - 검색어 매칭
 *
 * 핵심 비즈니스 규칙:
 * - 가격은 0 이상
 * - 재고는 0 이상
 * - 검색어 매칭은 대소문자를 구분하는 부분 문자열 포함 여부
 */
@Getter
@Builder
@AllArgsConstructor
@EqualsAndHashCode(of = "productId")
@ToString(of = {"productId", "productName", "price", "category"})
public class Product {

    private final String productId;

    private final String productName;

    private final String description;

    private final BigDecimal price;

    private final String category;

    private final int stock;

    private final double rating;

    private final String imageUrl;

    /**
     * 상품 생성 팩토리 메서드
     *
     * 비즈니스 규칙:
     * - 상품 ID와 상품명은 필수
     * - 가격은 0 이상
     * - 재고는 0 이상
     */
    public static Product createProduct(String productId, String productName, String description,
                                        BigDecimal price, String category, int stock,
                                        double rating, String imageUrl) {
        if (productId == null || productId.isBlank()) {
            throw new IllegalArgumentException("상품 ID는 필수입니다");
        }
        if (productName == null || productName.isBlank()) {
            throw new IllegalArgumentException("상품명은 필수입니다");
        }
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("가격은 0 이상이어야 합니다");
        }
        if (stock < 0) {
            throw new IllegalArgumentException("재고는 0 이상이어야 합니다");
        }

        return Product.builder()
                .productId(productId)
                .productName(productName)
                .description(description)
                .price(price)
                .category(category)
                .stock(stock)
                .rating(rating)
                .imageUrl(imageUrl)
                .build();
    }

    /**
     * 요청 수량만큼 재고가 있는지 확인
     * 장바구니 누적 수량이 아닌 요청 수량 기준으로만 판단한다.
     */
    public boolean hasStockFor(int quantity) {
        return this.stock >= quantity;
    }

    /**
     * 상품 검색 매칭 (상품명, 설명, 카테고리)
     */
    public boolean matches(String query) {
        return matchesNameOrDescription(query) || contains(this.category, query);
    }

    /**
     * 검색 이력 기반 추천 매칭 (상품명, 설명만)
     */
    public boolean matchesNameOrDescription(String query) {
        return contains(this.productName, query) || contains(this.description, query);
    }

    private static boolean contains(String text, String query) {
        return text != null && query != null && text.contains(query);
    }
}
