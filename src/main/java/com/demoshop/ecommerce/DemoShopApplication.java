package com.demoshop.ecommerce;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Demo Shop 애플리케이션 메인 클래스
 *
 * 활성화된 기능:
 * - @EnableAspectJAutoProxy: 사용자별 락(@UserLock) Aspect 자동 프록시 생성
 * - @ConfigurationPropertiesScan: demoshop.* 설정 바인딩
 */
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@SpringBootApplication
public class DemoShopApplication {

    public static void main(String[] args) {
        SpringApplication.run(DemoShopApplication.class, args);
    }

}
