package com.demoshop.ecommerce.infrastructure.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * DemoShopProperties - demoshop.* 설정 바인딩
 *
 * application.yml 예:
 * demoshop:
 *   service-name: Demo Shop E-commerce API
 *   version: 1.0.0
 *   lock:
 *     wait-time-ms: 3000
 *   recommendation:
 *     default-limit: 5
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "demoshop")
public class DemoShopProperties {

    /** 헬스 체크 응답에 노출되는 서비스명 */
    private String serviceName = "Demo Shop E-commerce API";

    private String version = "1.0.0";

    private Lock lock = new Lock();

    private Recommendation recommendation = new Recommendation();

    @Getter
    @Setter
    public static class Lock {
        /** 사용자별 락 획득 대기 시간 (밀리초) */
        private long waitTimeMs = 3000;
    }

    @Getter
    @Setter
    public static class Recommendation {
        /** limit 미지정/0 이하일 때 사용하는 추천 개수 */
        private int defaultLimit = 5;
    }
}
