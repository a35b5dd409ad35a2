package com.demoshop.ecommerce.application.recommendation;

import com.demoshop.ecommerce.application.product.dto.ProductResponse;
import com.demoshop.ecommerce.common.exception.InvalidRequestException;
import com.demoshop.ecommerce.domain.product.Product;
import com.demoshop.ecommerce.domain.product.ProductConstants;
import com.demoshop.ecommerce.domain.product.ProductRepository;
import com.demoshop.ecommerce.infrastructure.config.DemoShopProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * RecommendationService - 3단계 fallback 추천 (Application 계층)
 *
 * 전략들을 getOrder() 순서로 실행하고 처음으로 비어 있지 않은 결과를 그대로 반환한다.
 * 단계 간 결과를 섞지 않으며 결과 개수는 항상 limit 이하이다.
 */
@Slf4j
@Service
public class RecommendationService {

    private final ProductRepository productRepository;
    private final List<RecommendationStrategy> strategies;
    private final int defaultLimit;

    public RecommendationService(ProductRepository productRepository,
                                 List<RecommendationStrategy> strategies,
                                 DemoShopProperties properties) {
        this.productRepository = productRepository;
        this.strategies = strategies.stream()
                .sorted(Comparator.comparingInt(RecommendationStrategy::getOrder))
                .collect(Collectors.toList());
        this.defaultLimit = properties.getRecommendation().getDefaultLimit() > 0
                ? properties.getRecommendation().getDefaultLimit()
                : ProductConstants.DEFAULT_LIMIT;
    }

    public List<ProductResponse> getRecommendations(String userId, Integer limit) {
        InvalidRequestException.requireUserId(userId);
        int size = ProductConstants.normalizeLimit(limit, defaultLimit);
        RecommendationContext context = new RecommendationContext(userId, size, productRepository.findAll());

        for (RecommendationStrategy strategy : strategies) {
            List<Product> products = strategy.recommend(context);
            if (!products.isEmpty()) {
                log.info("[RecommendationService] 추천 완료: userId={}, tier={}, count={}",
                        userId, strategy.getName(), products.size());
                return products.stream()
                        .limit(size)
                        .map(ProductResponse::from)
                        .collect(Collectors.toList());
            }
            log.debug("[RecommendationService] 추천 결과 없음, 다음 단계로: userId={}, tier={}",
                    userId, strategy.getName());
        }

        log.info("[RecommendationService] 모든 단계에서 추천 결과 없음: userId={}", userId);
        return List.of();
    }
}
