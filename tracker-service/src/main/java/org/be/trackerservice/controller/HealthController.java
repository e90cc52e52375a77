package org.be.trackerservice.controller;

import lombok.RequiredArgsConstructor;
import org.be.trackerservice.service.health.HealthCheckService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
public class HealthController {

    private final HealthCheckService healthCheckService;

    /**
     * 기본 헬스체크
     * GET /api/v1/health
     */
    @GetMapping
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "healthy",
                "timestamp", java.time.Instant.now().toString()
        ));
    }

    /**
     * 상세 헬스체크 (DB, 소스 설정 포함)
     * GET /api/v1/health/detailed
     */
    @GetMapping("/detailed")
    public ResponseEntity<Map<String, Object>> detailedHealth() {
        Map<String, Object> health = healthCheckService.getDetailedHealth();

        if ("healthy".equals(health.get("status"))) {
            return ResponseEntity.ok(health);
        }
        return ResponseEntity.status(503).body(health);
    }
}
