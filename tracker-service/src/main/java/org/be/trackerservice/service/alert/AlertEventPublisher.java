package org.be.trackerservice.service.alert;

import lombok.extern.slf4j.Slf4j;
import org.be.trackerservice.config.AlertProperties;
import org.be.trackerservice.dto.AlertEvent;
import org.be.trackerservice.entity.Alert;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * 새로 생성된 알림을 Kafka 토픽으로 발행한다. 발행 실패는 로그만 남긴다.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "alert.publish", name = "enabled", havingValue = "true")
public class AlertEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String topic;

    public AlertEventPublisher(KafkaTemplate<String, Object> kafkaTemplate, AlertProperties alertProperties) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = alertProperties.getPublish().getTopic();
        log.info("Alert event publishing enabled: topic={}", topic);
    }

    public void publish(Alert alert) {
        AlertEvent event = AlertEvent.from(alert);
        String key = alert.getAlertType().getCode();

        try {
            kafkaTemplate.send(topic, key, event).whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish alert {} to {}: {}", alert.getId(), topic, ex.getMessage());
                } else {
                    log.debug("Published alert {} to {} partition {} offset {}", alert.getId(), topic,
                            result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
                }
            });
        } catch (RuntimeException e) {
            log.error("Failed to publish alert {} to {}", alert.getId(), topic, e);
        }
    }
}
