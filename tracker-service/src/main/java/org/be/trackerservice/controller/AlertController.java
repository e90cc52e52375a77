package org.be.trackerservice.controller;

import lombok.RequiredArgsConstructor;
import org.be.trackerservice.dto.SpikeFinding;
import org.be.trackerservice.dto.request.AlertFilterDto;
import org.be.trackerservice.entity.Alert;
import org.be.trackerservice.service.alert.AlertManager;
import org.be.trackerservice.service.detection.AnomalyDetector;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/alerts")
@RequiredArgsConstructor
public class AlertController {

    private final AlertManager alertManager;
    private final AnomalyDetector anomalyDetector;

    /**
     * 알림 목록 (최신순)
     * GET /api/v1/alerts?active=&type=&limit=
     */
    @GetMapping
    public ResponseEntity<List<Alert>> listAlerts(AlertFilterDto filter) {
        return ResponseEntity.ok(alertManager.list(filter));
    }

    /**
     * GET /api/v1/alerts/{id}
     */
    @GetMapping("/{id}")
    public ResponseEntity<Alert> getAlert(@PathVariable Long id) {
        return ResponseEntity.ok(alertManager.get(id));
    }

    /**
     * 알림 해결 처리 (멱등)
     * PUT /api/v1/alerts/{id}/resolve
     */
    @PutMapping("/{id}/resolve")
    public ResponseEntity<Alert> resolveAlert(@PathVariable Long id) {
        return ResponseEntity.ok(alertManager.resolve(id));
    }

    /**
     * DELETE /api/v1/alerts/{id}
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> deleteAlert(@PathVariable Long id) {
        alertManager.delete(id);
        return ResponseEntity.ok(Map.of("message", "Alert deleted successfully"));
    }

    /**
     * 시간 단위 급증 탐지 (알림은 만들지 않음)
     * POST /api/v1/alerts/detect?windowHours=&sigma=
     */
    @PostMapping("/detect")
    public ResponseEntity<List<SpikeFinding>> detectNow(
            @RequestParam(defaultValue = "24") int windowHours,
            @RequestParam(defaultValue = "2.5") double sigma) {
        return ResponseEntity.ok(anomalyDetector.detectNow(windowHours, sigma));
    }
}
