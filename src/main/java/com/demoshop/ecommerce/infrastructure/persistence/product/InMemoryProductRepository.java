package com.demoshop.ecommerce.infrastructure.persistence.product;

import com.demoshop.ecommerce.domain.product.Product;
import com.demoshop.ecommerce.domain.product.ProductRepository;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * InMemory Product Repository 구현
 *
 * 카탈로그는 시작 시 한 번 시딩되고 이후 읽기 전용으로 취급한다.
 * 순회 순서는 삽입 순서로 고정되어 추천 결과가 결정적이다.
 */
@Repository
public class InMemoryProductRepository implements ProductRepository {

    private final Map<String, Product> products = new LinkedHashMap<>();

    public InMemoryProductRepository() {
        initializeSampleData();
    }

    /**
     * 샘플 데이터 초기화
     */
    private void initializeSampleData() {
        save(Product.createProduct("1", "iPhone 15 Pro", "Latest iPhone with advanced features",
                new BigDecimal("999.99"), "Electronics", 50, 4.5, "https://example.com/iphone.jpg"));
        save(Product.createProduct("2", "MacBook Pro M3", "Powerful laptop for professionals",
                new BigDecimal("1999.99"), "Electronics", 30, 4.8, "https://example.com/macbook.jpg"));
        save(Product.createProduct("3", "AirPods Pro", "Wireless earbuds with noise cancellation",
                new BigDecimal("249.99"), "Electronics", 100, 4.6, "https://example.com/airpods.jpg"));
        save(Product.createProduct("4", "iPad Air", "Versatile tablet for work and play",
                new BigDecimal("599.99"), "Electronics", 75, 4.4, "https://example.com/ipad.jpg"));
        save(Product.createProduct("5", "Apple Watch Series 9", "Smartwatch with health monitoring",
                new BigDecimal("399.99"), "Electronics", 60, 4.7, "https://example.com/watch.jpg"));
    }

    @Override
    public synchronized List<Product> findAll() {
        return new ArrayList<>(products.values());
    }

    @Override
    public synchronized Optional<Product> findById(String productId) {
        return Optional.ofNullable(products.get(productId));
    }

    @Override
    public synchronized void save(Product product) {
        products.put(product.getProductId(), product);
    }

    /**
     * 테스트용: 카탈로그 비우기
     */
    public synchronized void clear() {
        products.clear();
    }
}
