package org.be.trackerservice.service.detection;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.be.trackerservice.config.AlertProperties;
import org.be.trackerservice.dto.DetectionReport;
import org.be.trackerservice.dto.SentimentShiftFinding;
import org.be.trackerservice.dto.SpikeFinding;
import org.be.trackerservice.entity.AlertConfig;
import org.be.trackerservice.enums.AlertType;
import org.be.trackerservice.enums.BucketGranularity;
import org.be.trackerservice.enums.SentimentLabel;
import org.be.trackerservice.enums.ShiftClassification;
import org.be.trackerservice.repository.AlertConfigRepository;
import org.be.trackerservice.repository.MentionRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 저장된 멘션 이력에서 급증(spike)과 감성 전환을 찾는다. 읽기 전용이다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AnomalyDetector {

    static final double NEGATIVE_SHIFT_PERCENT = 50.0;
    static final double POSITIVE_SHIFT_PERCENT = 20.0;

    private final MentionRepository mentionRepository;
    private final AlertConfigRepository alertConfigRepository;
    private final AlertProperties alertProperties;
    private final Clock clock;

    /**
     * 윈도우 내 버킷 중 mean + sigma * stdev 를 초과하는 버킷 (시간순)
     */
    public List<SpikeFinding> detectSpikes(int windowHours, double sigma, BucketGranularity granularity) {
        validateWindow(windowHours);
        if (Double.isNaN(sigma) || sigma < 0) {
            throw new IllegalArgumentException("sigma must be non-negative: " + sigma);
        }

        LocalDateTime since = LocalDateTime.now(clock).minusHours(windowHours);
        BucketedSeries series = BucketedSeries.of(mentionRepository.findCreatedAtSince(since), granularity);
        if (series.isEmpty()) {
            log.debug("No mentions in the last {}h, skipping spike detection", windowHours);
            return List.of();
        }

        SeriesStatistics stats = series.statistics();
        List<SpikeFinding> findings = series.spikes(stats, sigma);

        log.info("Spike detection ({}h, sigma={}, {}): {} buckets, mean={}, stdev={}, {} spikes",
                windowHours, sigma, granularity, stats.getSize(),
                String.format("%.2f", stats.getMean()), String.format("%.2f", stats.getSampleStdDev()),
                findings.size());
        return findings;
    }

    public SentimentShiftFinding detectSentimentShift(int windowHours) {
        validateWindow(windowHours);

        LocalDateTime since = LocalDateTime.now(clock).minusHours(windowHours);
        Map<SentimentLabel, Long> distribution = new EnumMap<>(SentimentLabel.class);
        for (SentimentLabel label : SentimentLabel.values()) {
            distribution.put(label, 0L);
        }
        for (Object[] row : mentionRepository.countBySentimentSince(since)) {
            distribution.put((SentimentLabel) row[0], ((Number) row[1]).longValue());
        }

        long total = distribution.values().stream().mapToLong(Long::longValue).sum();
        Map<SentimentLabel, Double> percentages = new EnumMap<>(SentimentLabel.class);
        for (Map.Entry<SentimentLabel, Long> entry : distribution.entrySet()) {
            percentages.put(entry.getKey(), total > 0 ? entry.getValue() * 100.0 / total : 0.0);
        }

        ShiftClassification shift = classify(total, percentages.get(SentimentLabel.NEGATIVE));
        log.info("Sentiment shift ({}h): total={}, negative={}%, shift={}",
                windowHours, total, String.format("%.1f", percentages.get(SentimentLabel.NEGATIVE)), shift);

        return SentimentShiftFinding.builder()
                .windowHours(windowHours)
                .distribution(distribution)
                .percentages(percentages)
                .total(total)
                .shift(shift)
                .build();
    }

    /**
     * 시간 단위 급증 탐지 (수동 트리거)
     */
    public List<SpikeFinding> detectNow(int windowHours, double sigma) {
        return detectSpikes(windowHours, sigma, BucketGranularity.HOUR);
    }

    /**
     * 활성화된 AlertConfig 기준으로 모든 검사를 실행한다.
     * 설정이 잘못된 검사는 로그를 남기고 건너뛰며 나머지 검사는 계속한다.
     * 저장소 호출마다 별도 트랜잭션을 쓰므로 한 검사의 실패가 다른 검사 결과를 되돌리지 않는다.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public DetectionReport runConfiguredChecks() {
        DetectionReport report = DetectionReport.empty();
        report.getSpikes().addAll(runSpikeChecks());
        report.setSentimentShift(runShiftCheck());
        return report;
    }

    private List<SpikeFinding> runSpikeChecks() {
        AlertProperties.Spike defaults = alertProperties.getSpike();
        List<AlertConfig> configs = loadConfigs(AlertType.SPIKE);
        if (configs.isEmpty()) {
            return spikeCheck("default", defaults.getWindowHours(), defaults.getThresholdSigma(),
                    defaults.getGranularity());
        }

        // 여러 설정이 같은 버킷을 찾으면 먼저 찾은 것만 남긴다
        Map<LocalDateTime, SpikeFinding> merged = new LinkedHashMap<>();
        for (AlertConfig config : configs) {
            for (SpikeFinding finding : spikeCheck(config.getName(), config.getWindowHours(),
                    config.getThreshold(), defaults.getGranularity())) {
                merged.putIfAbsent(finding.getBucketStart(), finding);
            }
        }
        return new ArrayList<>(merged.values());
    }

    private List<SpikeFinding> spikeCheck(String name, Integer windowHours, Double sigma,
                                          BucketGranularity granularity) {
        try {
            if (windowHours == null || sigma == null) {
                throw new IllegalArgumentException("windowHours and threshold are required");
            }
            return detectSpikes(windowHours, sigma, granularity);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping spike check '{}': {}", name, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Spike check '{}' failed", name, e);
        }
        return List.of();
    }

    private SentimentShiftFinding runShiftCheck() {
        String name = "default";
        try {
            Integer windowHours = alertProperties.getSentimentShift().getWindowHours();
            List<AlertConfig> configs = loadConfigs(AlertType.SENTIMENT_SHIFT);
            if (!configs.isEmpty()) {
                name = configs.get(0).getName();
                windowHours = configs.get(0).getWindowHours();
            }
            if (windowHours == null) {
                throw new IllegalArgumentException("windowHours is required");
            }
            return detectSentimentShift(windowHours);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping sentiment shift check '{}': {}", name, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Sentiment shift check '{}' failed", name, e);
        }
        return null;
    }

    // 설정을 읽지 못하면 기본 파라미터로 검사한다
    private List<AlertConfig> loadConfigs(AlertType type) {
        try {
            return alertConfigRepository.findByAlertTypeAndEnabledTrueOrderByIdAsc(type);
        } catch (RuntimeException e) {
            log.error("Failed to load {} alert configs, using defaults", type, e);
            return List.of();
        }
    }

    static ShiftClassification classify(long total, double negativePercentage) {
        if (total == 0) {
            return ShiftClassification.NONE;
        }
        if (negativePercentage > NEGATIVE_SHIFT_PERCENT) {
            return ShiftClassification.NEGATIVE;
        }
        if (negativePercentage < POSITIVE_SHIFT_PERCENT) {
            return ShiftClassification.POSITIVE;
        }
        return ShiftClassification.NEUTRAL;
    }

    private static void validateWindow(int windowHours) {
        if (windowHours <= 0) {
            throw new IllegalArgumentException("windowHours must be positive: " + windowHours);
        }
    }
}
