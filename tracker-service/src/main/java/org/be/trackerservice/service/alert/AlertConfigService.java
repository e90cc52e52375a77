package org.be.trackerservice.service.alert;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.be.trackerservice.dto.request.AlertConfigRequestDto;
import org.be.trackerservice.entity.AlertConfig;
import org.be.trackerservice.enums.AlertType;
import org.be.trackerservice.exception.AlertConfigNotFoundException;
import org.be.trackerservice.repository.AlertConfigRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AlertConfigService {

    private final AlertConfigRepository alertConfigRepository;

    public List<AlertConfig> getConfigs() {
        return alertConfigRepository.findAllByOrderByIdAsc();
    }

    public AlertConfig getConfig(Long id) {
        return alertConfigRepository.findById(id)
                .orElseThrow(() -> new AlertConfigNotFoundException(id));
    }

    @Transactional
    public AlertConfig createConfig(AlertConfigRequestDto request) {
        AlertConfig config = AlertConfig.builder()
                .name(request.getName().trim())
                .alertType(AlertType.fromCode(request.getAlertType().trim()))
                .threshold(request.getThreshold())
                .windowHours(request.getWindowHours())
                .enabled(request.getEnabled() == null || request.getEnabled())
                .build();

        AlertConfig saved = alertConfigRepository.save(config);
        log.info("Created alert config {} '{}' ({}, threshold={}, window={}h)", saved.getId(), saved.getName(),
                saved.getAlertType().getCode(), saved.getThreshold(), saved.getWindowHours());
        return saved;
    }

    @Transactional
    public AlertConfig updateConfig(Long id, AlertConfigRequestDto request) {
        AlertConfig config = getConfig(id);

        config.setName(request.getName().trim());
        config.setAlertType(AlertType.fromCode(request.getAlertType().trim()));
        config.setThreshold(request.getThreshold());
        config.setWindowHours(request.getWindowHours());
        if (request.getEnabled() != null) {
            config.setEnabled(request.getEnabled());
        }

        log.info("Updated alert config {}", id);
        return alertConfigRepository.save(config);
    }

    @Transactional
    public void deleteConfig(Long id) {
        AlertConfig config = getConfig(id);
        alertConfigRepository.delete(config);
        log.info("Deleted alert config {}", id);
    }
}
