package com.demoshop.ecommerce.domain.product;

import java.util.List;
import java.util.Optional;

/**
 * Product Repository Interface (Domain Layer - Port)
 * 카탈로그 조회 인터페이스
 * 의존성 역전: 구현체는 이 인터페이스에 의존한다.
 */
public interface ProductRepository {

    /**
     * 모든 상품 조회 (카탈로그 순서 보장)
     */
    List<Product> findAll();

    /**
     * ID로 상품 조회
     */
    Optional<Product> findById(String productId);

    /**
     * 상품 저장 (시딩용)
     */
    void save(Product product);
}
