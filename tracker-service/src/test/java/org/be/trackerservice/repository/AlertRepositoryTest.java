package org.be.trackerservice.repository;

import org.be.trackerservice.entity.Alert;
import org.be.trackerservice.enums.AlertSeverity;
import org.be.trackerservice.enums.AlertType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
class AlertRepositoryTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 1, 12, 0);

    @Autowired
    private AlertRepository alertRepository;

    @Test
    @DisplayName("같은 유형의 활성 알림은 두 개 저장할 수 없다")
    void onlyOneActiveAlertPerType() {
        // given
        alertRepository.saveAndFlush(Alert.open(AlertType.SPIKE, AlertSeverity.HIGH, "Mention Spike Detected",
                "first", NOW));

        // when & then
        assertThatThrownBy(() -> alertRepository.saveAndFlush(Alert.open(AlertType.SPIKE, AlertSeverity.MEDIUM,
                "Mention Spike Detected", "second", NOW.plusHours(1))))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("해결된 알림은 같은 유형의 새 알림을 막지 않는다")
    void resolvedAlertFreesType() {
        // given
        Alert first = alertRepository.saveAndFlush(Alert.open(AlertType.SPIKE, AlertSeverity.HIGH,
                "Mention Spike Detected", "first", NOW));
        first.resolve(NOW.plusMinutes(30));
        alertRepository.saveAndFlush(first);

        // when
        alertRepository.saveAndFlush(Alert.open(AlertType.SPIKE, AlertSeverity.MEDIUM,
                "Mention Spike Detected", "second", NOW.plusHours(1)));

        // then
        assertThat(alertRepository.count()).isEqualTo(2);
        assertThat(alertRepository.countByActiveTrue()).isEqualTo(1);
        assertThat(alertRepository.existsByAlertTypeAndActiveTrue(AlertType.SPIKE)).isTrue();
        assertThat(alertRepository.existsByAlertTypeAndActiveTrue(AlertType.SENTIMENT_SHIFT)).isFalse();
    }

    @Test
    @DisplayName("유형이 다르면 동시에 활성 가능")
    void differentTypesCoexist() {
        alertRepository.saveAndFlush(Alert.open(AlertType.SPIKE, AlertSeverity.HIGH, "s", "d", NOW));
        alertRepository.saveAndFlush(Alert.open(AlertType.SENTIMENT_SHIFT, AlertSeverity.MEDIUM, "n", "d", NOW));

        assertThat(alertRepository.countByActiveTrue()).isEqualTo(2);
    }
}
