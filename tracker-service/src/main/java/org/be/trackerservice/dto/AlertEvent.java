package org.be.trackerservice.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.be.trackerservice.entity.Alert;

import java.time.LocalDateTime;

/**
 * Kafka 로 발행되는 알림 이벤트
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertEvent {
    private Long alertId;
    private String type; // spike, sentiment_shift, trend
    private String title;
    private String description;
    private String severity; // low, medium, high, critical
    private LocalDateTime timestamp;

    public static AlertEvent from(Alert alert) {
        return AlertEvent.builder()
                .alertId(alert.getId())
                .type(alert.getAlertType().getCode())
                .title(alert.getTitle())
                .description(alert.getDescription())
                .severity(alert.getSeverity().getCode())
                .timestamp(alert.getCreatedAt())
                .build();
    }
}
