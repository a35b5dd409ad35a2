package com.demoshop.ecommerce.application.recommendation.strategy;

import com.demoshop.ecommerce.application.recommendation.RecommendationContext;
import com.demoshop.ecommerce.application.recommendation.RecommendationStrategy;
import com.demoshop.ecommerce.domain.product.Product;
import com.demoshop.ecommerce.domain.search.SearchHistory;
import com.demoshop.ecommerce.domain.search.SearchHistoryRepository;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 검색 이력 기반 추천
 *
 * 기록된 검색어를 순서대로 보며, 상품명 또는 설명에 검색어가 포함된 상품을
 * 발견 순서대로 limit개까지 모은다. 여러 검색어에 걸린 상품은 걸린 횟수만큼 반복된다.
 */
@Component
public class SearchHistoryRecommendationStrategy implements RecommendationStrategy {

    private final SearchHistoryRepository searchHistoryRepository;

    public SearchHistoryRecommendationStrategy(SearchHistoryRepository searchHistoryRepository) {
        this.searchHistoryRepository = searchHistoryRepository;
    }

    @Override
    public String getName() {
        return "SEARCH_HISTORY";
    }

    @Override
    public List<Product> recommend(RecommendationContext context) {
        List<SearchHistory> searches = searchHistoryRepository.findByUserId(context.getUserId());
        List<Product> recommendations = new ArrayList<>();

        for (SearchHistory search : searches) {
            for (Product product : context.getCatalog()) {
                if (recommendations.size() >= context.getLimit()) {
                    return recommendations;
                }
                if (product.matchesNameOrDescription(search.getQuery())) {
                    recommendations.add(product);
                }
            }
        }
        return recommendations;
    }

    @Override
    public int getOrder() {
        return 2;
    }
}
