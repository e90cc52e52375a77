package org.be.trackerservice.service.ingestion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.be.trackerservice.dto.response.IngestionResult;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "tracker.schedule", name = "enabled", havingValue = "true")
public class IngestionScheduler {

    private final IngestionPipeline ingestionPipeline;

    /**
     * 설정된 기본 쿼리로 주기 수집. 이전 실행 종료 후 interval-ms 만큼 대기한다
     */
    @Scheduled(fixedDelayString = "${tracker.schedule.interval-ms:3600000}",
            initialDelayString = "${tracker.schedule.initial-delay-ms:60000}")
    public void runScheduledIngestion() {
        try {
            IngestionResult result = ingestionPipeline.run(null);
            log.info("Scheduled ingestion completed: persisted={}, alerts={}",
                    result.getCount(), result.getAlertsRaised());
        } catch (RuntimeException e) {
            log.error("Scheduled ingestion failed", e);
        }
    }
}
