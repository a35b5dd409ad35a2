package com.demoshop.ecommerce.infrastructure.config;

import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 캐시 설정 (프로세스 내 ConcurrentMap 캐시)
 *
 * 캐시 전략:
 * - topProducts: 평점 상위 상품 (키: limit)
 *
 * 카탈로그는 시딩 이후 변경되지 않으므로 만료/무효화가 필요 없다.
 * 카탈로그 변경 기능이 생기면 해당 지점에서 @CacheEvict를 추가해야 한다.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String TOP_PRODUCTS = "topProducts";

    @Bean
    public CacheManager cacheManager() {
        return new ConcurrentMapCacheManager(TOP_PRODUCTS);
    }
}
