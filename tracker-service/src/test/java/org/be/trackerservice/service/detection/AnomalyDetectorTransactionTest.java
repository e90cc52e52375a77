package org.be.trackerservice.service.detection;

import org.be.trackerservice.config.AlertProperties;
import org.be.trackerservice.dto.DetectionReport;
import org.be.trackerservice.entity.Mention;
import org.be.trackerservice.enums.MentionSource;
import org.be.trackerservice.enums.SentimentLabel;
import org.be.trackerservice.enums.ShiftClassification;
import org.be.trackerservice.repository.MentionRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 실제 트랜잭션 경계에서 한 검사의 저장소 오류가 다른 검사 결과를 없애지 않는지 확인한다.
 * 테이블을 지우므로 컨텍스트를 재사용하지 않는다.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
@Import({AnomalyDetector.class, AnomalyDetectorTransactionTest.DetectorTestConfig.class})
class AnomalyDetectorTransactionTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @TestConfiguration
    static class DetectorTestConfig {

        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }

        @Bean
        AlertProperties alertProperties() {
            return new AlertProperties();
        }
    }

    @Autowired
    private AnomalyDetector anomalyDetector;

    @Autowired
    private MentionRepository mentionRepository;

    @Autowired
    private DataSource dataSource;

    @Test
    @DisplayName("설정 테이블 조회가 실패해도 감성 전환 결과는 유지")
    void configLookupFailureKeepsShiftFinding() throws SQLException {
        // given
        LocalDateTime createdAt = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC).minusHours(1);
        mentionRepository.saveAll(IntStream.range(0, 10)
                .mapToObj(i -> negativeMention(i, createdAt))
                .collect(Collectors.toList()));
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            statement.execute("DROP TABLE alert_configs");
        }

        // when
        DetectionReport report = anomalyDetector.runConfiguredChecks();

        // then
        assertThat(report.getSpikes()).isEmpty();
        assertThat(report.getSentimentShift()).isNotNull();
        assertThat(report.getSentimentShift().getShift()).isEqualTo(ShiftClassification.NEGATIVE);
        assertThat(report.getSentimentShift().getTotal()).isEqualTo(10L);
    }

    private static Mention negativeMention(int index, LocalDateTime createdAt) {
        Mention mention = Mention.builder()
                .source(MentionSource.TWITTER)
                .url("https://example.com/status/" + index)
                .author("tester")
                .content("acme outage " + index)
                .topic("support")
                .createdAt(createdAt)
                .build();
        mention.applySentiment(SentimentLabel.NEGATIVE, 0.9);
        return mention;
    }
}
