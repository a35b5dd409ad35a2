package com.demoshop.ecommerce.application.product;

import com.demoshop.ecommerce.application.product.dto.ProductResponse;
import com.demoshop.ecommerce.domain.product.ProductConstants;
import com.demoshop.ecommerce.domain.product.ProductNotFoundException;
import com.demoshop.ecommerce.domain.product.ProductRepository;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * ProductService - 상품 조회 비즈니스 로직 (Application 계층)
 *
 * 기능:
 * - 전체 상품 목록 조회 (카탈로그 순서)
 * - 상품 단건 조회
 * - 평점 상위 상품 조회 (캐싱 적용)
 */
@Service
public class ProductService {

    private final ProductRepository productRepository;
    private final ProductRankingReader productRankingReader;

    public ProductService(ProductRepository productRepository,
                          ProductRankingReader productRankingReader) {
        this.productRepository = productRepository;
        this.productRankingReader = productRankingReader;
    }

    public List<ProductResponse> getProducts() {
        return productRepository.findAll().stream()
                .map(ProductResponse::from)
                .collect(Collectors.toList());
    }

    /**
     * 상품 단건 조회
     *
     * @throws ProductNotFoundException 상품이 없는 경우
     */
    public ProductResponse getProduct(String productId) {
        return productRepository.findById(productId)
                .map(ProductResponse::from)
                .orElseThrow(() -> new ProductNotFoundException(productId));
    }

    /**
     * 평점 상위 상품 조회
     *
     * 정렬: 평점 내림차순, 동점이면 상품 ID 오름차순
     * limit이 없거나 0 이하이면 5개
     *
     * 랭킹은 ProductRankingReader에서 캐시된 전체 목록을 받아 자른다.
     */
    public List<ProductResponse> getTopProducts(Integer limit) {
        int size = ProductConstants.normalizeLimit(limit, ProductConstants.DEFAULT_LIMIT);
        return productRankingReader.getRanking().stream()
                .limit(size)
                .collect(Collectors.toList());
    }
}
