package org.be.trackerservice.service.ingestion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.be.trackerservice.config.TrackerProperties;
import org.be.trackerservice.dto.DetectionReport;
import org.be.trackerservice.dto.MentionCandidate;
import org.be.trackerservice.dto.SourceFetchResult;
import org.be.trackerservice.dto.response.IngestionResult;
import org.be.trackerservice.entity.Mention;
import org.be.trackerservice.enums.MentionSource;
import org.be.trackerservice.exception.IngestionException;
import org.be.trackerservice.metrics.TrackerMetrics;
import org.be.trackerservice.service.aggregation.MentionAggregator;
import org.be.trackerservice.service.alert.AlertManager;
import org.be.trackerservice.service.detection.AnomalyDetector;
import org.be.trackerservice.service.enrichment.MentionEnricher;
import org.be.trackerservice.service.mention.MentionService;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 수집 → 보강 → 일괄 저장 → 탐지/알림 순으로 한 번의 수집을 실행한다.
 * 저장은 단일 트랜잭션이며, 커밋 이후 탐지 단계의 실패는 실행 결과를 실패로 만들지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionPipeline {

    private final MentionAggregator mentionAggregator;
    private final MentionEnricher mentionEnricher;
    private final MentionService mentionService;
    private final AnomalyDetector anomalyDetector;
    private final AlertManager alertManager;
    private final TrackerProperties trackerProperties;
    private final TrackerMetrics trackerMetrics;
    private final Clock clock;

    public IngestionResult run(String query) {
        String resolvedQuery = resolveQuery(query);
        LocalDateTime startedAt = LocalDateTime.now(clock);
        long startTime = System.currentTimeMillis();
        log.info("Ingestion run started: query='{}'", resolvedQuery);

        List<SourceFetchResult> fetchResults = mentionAggregator.fetchAll(resolvedQuery);
        List<IngestionResult.SourceSummary> summaries = fetchResults.stream()
                .map(IngestionResult.SourceSummary::from)
                .collect(Collectors.toList());
        List<MentionCandidate> candidates = fetchResults.stream()
                .flatMap(result -> result.getCandidates().stream())
                .collect(Collectors.toList());

        if (candidates.isEmpty()) {
            log.info("No candidates for query '{}', nothing to persist", resolvedQuery);
            return result(resolvedQuery, 0, summaries, 0, startedAt, startTime);
        }

        List<Mention> mentions = mentionEnricher.enrich(candidates);
        if (mentions.isEmpty()) {
            log.info("All candidates were dropped during enrichment for query '{}'", resolvedQuery);
            return result(resolvedQuery, 0, summaries, 0, startedAt, startTime);
        }

        List<Mention> saved;
        try {
            saved = mentionService.saveBatch(mentions);
        } catch (RuntimeException e) {
            trackerMetrics.incrementIngestionFailure();
            log.error("Failed to persist {} mentions for query '{}', batch rolled back", mentions.size(), resolvedQuery, e);
            throw new IngestionException("Failed to persist mentions for query '" + resolvedQuery + "'", e);
        }
        recordIngested(saved);

        int alertsRaised = detectAndAlert();

        IngestionResult result = result(resolvedQuery, saved.size(), summaries, alertsRaised, startedAt, startTime);
        log.info("Ingestion run finished: query='{}', persisted={}, alerts={}", resolvedQuery, saved.size(), alertsRaised);
        return result;
    }

    private int detectAndAlert() {
        try {
            DetectionReport report = anomalyDetector.runConfiguredChecks();
            return alertManager.handleFindings(report).size();
        } catch (RuntimeException e) {
            // 저장은 이미 커밋됨
            log.error("Detection after ingestion failed, mentions remain persisted", e);
            return 0;
        }
    }

    private String resolveQuery(String query) {
        if (StringUtils.hasText(query)) {
            return query.trim();
        }
        return trackerProperties.resolveDefaultQuery()
                .orElseThrow(() -> new IngestionException(
                        "No query given and none of tracker.search-query, tracker.brand-keywords, tracker.brand-name is configured"));
    }

    private void recordIngested(List<Mention> saved) {
        Map<MentionSource, Integer> bySource = new EnumMap<>(MentionSource.class);
        for (Mention mention : saved) {
            bySource.merge(mention.getSource(), 1, Integer::sum);
        }
        bySource.forEach(trackerMetrics::incrementIngested);
    }

    private IngestionResult result(String query, int count, List<IngestionResult.SourceSummary> summaries,
                                   int alertsRaised, LocalDateTime startedAt, long startTime) {
        trackerMetrics.recordIngestionTime(System.currentTimeMillis() - startTime);
        return IngestionResult.builder()
                .query(query)
                .count(count)
                .sources(summaries)
                .alertsRaised(alertsRaised)
                .startedAt(startedAt)
                .finishedAt(LocalDateTime.now(clock))
                .build();
    }
}
