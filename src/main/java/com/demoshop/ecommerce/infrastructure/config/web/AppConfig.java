package com.demoshop.ecommerce.infrastructure.config.web;

import com.demoshop.ecommerce.presentation.health.HealthController;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.config.annotation.PathMatchConfigurer;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * AppConfig - API 전역 설정
 * 헬스 체크를 제외한 모든 @RestController 요청에 /api/v1 prefix를 추가합니다.
 */
@Configuration
public class AppConfig implements WebMvcConfigurer {

    public static final String API_PREFIX = "/api/v1";

    @Override
    public void configurePathMatch(PathMatchConfigurer configurer) {
        configurer.addPathPrefix(API_PREFIX, c -> c.isAnnotationPresent(RestController.class)
                && !HealthController.class.equals(c));
    }
}
