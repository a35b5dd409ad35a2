package com.demoshop.ecommerce.presentation.health;

import com.demoshop.ecommerce.infrastructure.config.DemoShopProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HealthController - GET /health (API prefix 미적용)
 */
@RestController
public class HealthController {

    private final DemoShopProperties properties;

    public HealthController(DemoShopProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("timestamp", Instant.now().toString());
        body.put("service", properties.getServiceName());
        body.put("version", properties.getVersion());
        return ResponseEntity.ok(body);
    }
}
