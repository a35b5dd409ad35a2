package com.demoshop.ecommerce.application.product;

import com.demoshop.ecommerce.application.product.dto.ProductResponse;
import com.demoshop.ecommerce.domain.product.ProductConstants;
import com.demoshop.ecommerce.domain.product.ProductRepository;
import com.demoshop.ecommerce.infrastructure.config.CacheConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * ProductRankingReader - 평점순 전체 상품 랭킹 조회 (캐싱 적용)
 *
 * 카탈로그는 시딩 이후 변하지 않으므로 전체 랭킹 하나만 캐시에 둔다.
 * limit별 자르기는 호출 측(ProductService)에서 수행하여 캐시 엔트리 수를 1개로 고정한다.
 *
 * 캐시 이름: topProducts, 캐시 키: ranking
 */
@Slf4j
@Component
public class ProductRankingReader {

    public static final String RANKING_KEY = "ranking";

    private final ProductRepository productRepository;

    public ProductRankingReader(ProductRepository productRepository) {
        this.productRepository = productRepository;
    }

    /**
     * 평점 내림차순, 동점이면 상품 ID 오름차순
     */
    @Cacheable(value = CacheConfig.TOP_PRODUCTS, key = "'" + RANKING_KEY + "'")
    public List<ProductResponse> getRanking() {
        log.debug("[ProductRankingReader] 상품 랭킹 계산 (캐시 미스)");
        return productRepository.findAll().stream()
                .sorted(ProductConstants.BY_RATING_DESC)
                .map(ProductResponse::from)
                .collect(Collectors.toList());
    }
}
