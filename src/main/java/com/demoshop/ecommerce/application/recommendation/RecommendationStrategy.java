package com.demoshop.ecommerce.application.recommendation;

import com.demoshop.ecommerce.domain.product.Product;

import java.util.List;

/**
 * RecommendationStrategy - 추천 단계(tier) 인터페이스
 *
 * 구현 규칙:
 * - 각 전략은 독립적이고 부수효과가 없어야 함 (장바구니/주문/검색 이력을 변경하지 않음)
 * - 결과는 최대 context.getLimit()개
 * - 추천할 것이 없으면 빈 목록을 반환 (다음 전략으로 넘어감)
 * - 실행 순서는 getOrder()로 정의 (숫자가 작을수록 먼저 실행)
 *
 * 실행 순서:
 * 1. OrderHistoryRecommendationStrategy (order=1): 주문 이력 카테고리 기반
 * 2. SearchHistoryRecommendationStrategy (order=2): 검색 이력 기반
 * 3. PopularityRecommendationStrategy (order=3): 평점 기반 (최종 fallback)
 */
public interface RecommendationStrategy {

    /**
     * 전략 이름 (로깅용)
     */
    String getName();

    List<Product> recommend(RecommendationContext context);

    default int getOrder() {
        return 0;
    }
}
