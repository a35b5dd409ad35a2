package com.demoshop.ecommerce.application.recommendation.strategy;

import com.demoshop.ecommerce.application.recommendation.RecommendationContext;
import com.demoshop.ecommerce.application.recommendation.RecommendationStrategy;
import com.demoshop.ecommerce.domain.product.Product;
import com.demoshop.ecommerce.domain.product.ProductConstants;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 인기 상품 추천 (최종 fallback)
 * 평점 내림차순, 동점이면 상품 ID 오름차순으로 limit개
 */
@Component
public class PopularityRecommendationStrategy implements RecommendationStrategy {

    @Override
    public String getName() {
        return "POPULARITY";
    }

    @Override
    public List<Product> recommend(RecommendationContext context) {
        return context.getCatalog().stream()
                .sorted(ProductConstants.BY_RATING_DESC)
                .limit(context.getLimit())
                .collect(Collectors.toList());
    }

    @Override
    public int getOrder() {
        return 3;
    }
}
