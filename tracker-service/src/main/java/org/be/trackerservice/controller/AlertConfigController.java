package org.be.trackerservice.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.be.trackerservice.dto.request.AlertConfigRequestDto;
import org.be.trackerservice.entity.AlertConfig;
import org.be.trackerservice.service.alert.AlertConfigService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/alert-configs")
@RequiredArgsConstructor
public class AlertConfigController {

    private final AlertConfigService alertConfigService;

    @GetMapping
    public ResponseEntity<List<AlertConfig>> getConfigs() {
        return ResponseEntity.ok(alertConfigService.getConfigs());
    }

    @GetMapping("/{id}")
    public ResponseEntity<AlertConfig> getConfig(@PathVariable Long id) {
        return ResponseEntity.ok(alertConfigService.getConfig(id));
    }

    @PostMapping
    public ResponseEntity<AlertConfig> createConfig(@Valid @RequestBody AlertConfigRequestDto request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(alertConfigService.createConfig(request));
    }

    @PutMapping("/{id}")
    public ResponseEntity<AlertConfig> updateConfig(@PathVariable Long id,
                                                    @Valid @RequestBody AlertConfigRequestDto request) {
        return ResponseEntity.ok(alertConfigService.updateConfig(id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> deleteConfig(@PathVariable Long id) {
        alertConfigService.deleteConfig(id);
        return ResponseEntity.ok(Map.of("message", "Alert config deleted successfully"));
    }
}
