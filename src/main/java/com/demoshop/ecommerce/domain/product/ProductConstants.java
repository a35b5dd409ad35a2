package com.demoshop.ecommerce.domain.product;

import java.util.Comparator;

/**
 * ProductConstants - 상품 도메인 상수
 *
 * 역할:
 * - 상위 상품/추천 목록의 기본 개수
 * - 평점 기반 정렬 기준
 */
public class ProductConstants {

    /** limit이 없거나 0 이하일 때 사용하는 기본 개수 */
    public static final int DEFAULT_LIMIT = 5;

    /** 평점 내림차순, 동점이면 상품 ID 오름차순 */
    public static final Comparator<Product> BY_RATING_DESC =
            Comparator.comparingDouble(Product::getRating).reversed()
                    .thenComparing(Product::getProductId);

    /**
     * limit 정규화: null 또는 0 이하이면 기본값 사용
     */
    public static int normalizeLimit(Integer limit, int defaultLimit) {
        if (limit == null || limit <= 0) {
            return defaultLimit;
        }
        return limit;
    }

    private ProductConstants() {
        throw new AssertionError("ProductConstants는 인스턴스화할 수 없습니다");
    }
}
