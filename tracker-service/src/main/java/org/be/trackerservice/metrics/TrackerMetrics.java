package org.be.trackerservice.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.be.trackerservice.dto.SourceFetchResult;
import org.be.trackerservice.enums.AlertType;
import org.be.trackerservice.enums.MentionSource;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

@Slf4j
@Component
public class TrackerMetrics {

    private final MeterRegistry meterRegistry;

    private final ConcurrentHashMap<String, Counter> sourceFetchCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<MentionSource, Counter> ingestedCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<AlertType, Counter> alertCreatedCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<AlertType, Counter> alertDeduplicatedCounters = new ConcurrentHashMap<>();

    private final Counter scoringFallbackCounter;
    private final Counter ingestionFailureCounter;
    private final Timer ingestionTimer;

    public TrackerMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.scoringFallbackCounter = Counter.builder("tracker.scoring.fallback")
                .description("Mentions enriched with the neutral/uncategorized fallback")
                .register(meterRegistry);
        this.ingestionFailureCounter = Counter.builder("tracker.ingestion.failure")
                .description("Ingestion runs aborted by a persistence failure")
                .register(meterRegistry);
        this.ingestionTimer = Timer.builder("tracker.ingestion.duration")
                .description("Time taken for one ingestion run")
                .register(meterRegistry);
    }

    // === 소스 수집 결과 ===
    public void recordSourceFetch(SourceFetchResult result) {
        String outcome = result.skipReason()
                .map(reason -> reason.name().toLowerCase())
                .orElse("success");
        String key = result.getSource().getCode() + "_" + outcome;

        Counter counter = sourceFetchCounters.computeIfAbsent(key,
                k -> Counter.builder("tracker.source.fetch")
                        .tag("source", result.getSource().getCode())
                        .tag("outcome", outcome)
                        .description("Source fetch attempts by outcome")
                        .register(meterRegistry));

        counter.increment();
        log.trace("Recorded source fetch: {} -> {}", result.getSource(), outcome);
    }

    // === 저장된 멘션 수 ===
    public void incrementIngested(MentionSource source, int count) {
        Counter counter = ingestedCounters.computeIfAbsent(source,
                s -> Counter.builder("tracker.mentions.ingested")
                        .tag("source", s.getCode())
                        .description("Mentions persisted by ingestion runs")
                        .register(meterRegistry));

        counter.increment(count);
    }

    public void incrementScoringFallback() {
        scoringFallbackCounter.increment();
    }

    public void incrementIngestionFailure() {
        ingestionFailureCounter.increment();
    }

    public void recordIngestionTime(long timeInMillis) {
        ingestionTimer.record(timeInMillis, TimeUnit.MILLISECONDS);
    }

    // === 알림 ===
    public void incrementAlertCreated(AlertType type) {
        alertCreatedCounters.computeIfAbsent(type,
                t -> Counter.builder("tracker.alerts.created")
                        .tag("type", t.getCode())
                        .description("Alerts raised from detector findings")
                        .register(meterRegistry))
                .increment();
    }

    public void incrementAlertDeduplicated(AlertType type) {
        alertDeduplicatedCounters.computeIfAbsent(type,
                t -> Counter.builder("tracker.alerts.deduplicated")
                        .tag("type", t.getCode())
                        .description("Findings suppressed because an alert of the same type is active")
                        .register(meterRegistry))
                .increment();
    }
}
