package com.demoshop.ecommerce.presentation.recommendation;

import com.demoshop.ecommerce.application.recommendation.RecommendationService;
import com.demoshop.ecommerce.presentation.product.mapper.ProductMapper;
import com.demoshop.ecommerce.presentation.product.response.ProductResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * RecommendationController - 상품 추천 API
 * GET /recommendations/{userId}?limit={limit}
 * 주문 이력 → 검색 이력 → 인기 상품 순으로 fallback
 */
@RestController
@RequestMapping("/recommendations")
public class RecommendationController {

    private final RecommendationService recommendationService;
    private final ProductMapper productMapper;

    public RecommendationController(RecommendationService recommendationService, ProductMapper productMapper) {
        this.recommendationService = recommendationService;
        this.productMapper = productMapper;
    }

    @GetMapping("/{userId}")
    public ResponseEntity<List<ProductResponse>> getRecommendations(
            @PathVariable("userId") String userId,
            @RequestParam(value = "limit", required = false) Integer limit) {
        return ResponseEntity.ok(productMapper.toProductResponses(
                recommendationService.getRecommendations(userId, limit)));
    }
}
