package com.demoshop.ecommerce.application.recommendation;

import com.demoshop.ecommerce.domain.product.Product;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * RecommendationContext - 한 번의 추천 요청에서 모든 전략이 공유하는 입력
 *
 * 카탈로그는 요청 시작 시점에 한 번만 스냅샷을 떠서 모든 전략이 같은 가격/재고/카테고리를 보게 한다.
 */
@Getter
public class RecommendationContext {

    private final String userId;
    private final int limit;
    private final List<Product> catalog;
    private final Map<String, Product> catalogById;

    public RecommendationContext(String userId, int limit, List<Product> catalog) {
        this.userId = userId;
        this.limit = limit;
        this.catalog = Collections.unmodifiableList(catalog);
        Map<String, Product> byId = new LinkedHashMap<>();
        for (Product product : catalog) {
            byId.put(product.getProductId(), product);
        }
        this.catalogById = Collections.unmodifiableMap(byId);
    }

    public Optional<Product> findProduct(String productId) {
        return Optional.ofNullable(catalogById.get(productId));
    }
}
