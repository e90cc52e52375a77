package org.be.trackerservice.service.analytics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.be.trackerservice.dto.SpikeFinding;
import org.be.trackerservice.dto.response.AnalyticsResponseDto;
import org.be.trackerservice.enums.BucketGranularity;
import org.be.trackerservice.enums.MentionSource;
import org.be.trackerservice.enums.SentimentLabel;
import org.be.trackerservice.repository.MentionRepository;
import org.be.trackerservice.service.detection.BucketedSeries;
import org.be.trackerservice.service.detection.SeriesStatistics;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * 최근 N일 멘션에 대한 읽기 전용 집계
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AnalyticsService {

    static final int SUMMARY_TOP_N = 5;

    private final MentionRepository mentionRepository;
    private final Clock clock;

    public AnalyticsResponseDto.SentimentDistribution getSentimentDistribution(int days) {
        LocalDateTime since = since(days);

        long positive = 0;
        long negative = 0;
        long neutral = 0;
        for (Object[] row : mentionRepository.countBySentimentSince(since)) {
            long count = ((Number) row[1]).longValue();
            switch ((SentimentLabel) row[0]) {
                case POSITIVE -> positive = count;
                case NEGATIVE -> negative = count;
                default -> neutral = count;
            }
        }

        log.debug("Sentiment distribution for {} days: +{} -{} ={}", days, positive, negative, neutral);
        return AnalyticsResponseDto.SentimentDistribution.builder()
                .positive(positive)
                .negative(negative)
                .neutral(neutral)
                .total(positive + negative + neutral)
                .build();
    }

    public List<AnalyticsResponseDto.TopicCount> getTopTopics(int days, int limit) {
        validateLimit(limit);
        return mentionRepository.countByTopicSince(since(days), PageRequest.of(0, limit)).stream()
                .map(row -> new AnalyticsResponseDto.TopicCount((String) row[0], ((Number) row[1]).longValue()))
                .collect(Collectors.toList());
    }

    public List<AnalyticsResponseDto.SourceCount> getSourceBreakdown(int days) {
        return sourceCounts(since(days), MentionSource.values().length);
    }

    public AnalyticsResponseDto.Timeline getTimeline(int days, BucketGranularity granularity) {
        TreeMap<LocalDateTime, AnalyticsResponseDto.TimelinePoint> points = new TreeMap<>();

        for (Object[] row : mentionRepository.findTimelineRowsSince(since(days))) {
            LocalDateTime bucket = granularity.truncate((LocalDateTime) row[0]);
            AnalyticsResponseDto.TimelinePoint point = points.computeIfAbsent(bucket,
                    start -> AnalyticsResponseDto.TimelinePoint.builder().bucketStart(start).build());

            SentimentLabel label = (SentimentLabel) row[1];
            if (label == SentimentLabel.POSITIVE) {
                point.setPositive(point.getPositive() + 1);
            } else if (label == SentimentLabel.NEGATIVE) {
                point.setNegative(point.getNegative() + 1);
            } else {
                point.setNeutral(point.getNeutral() + 1);
            }
            point.setTotal(point.getTotal() + 1);
        }

        return AnalyticsResponseDto.Timeline.builder()
                .granularity(granularity)
                .points(new ArrayList<>(points.values()))
                .build();
    }

    /**
     * 일 단위 버킷 급증 보고서. 알림은 만들지 않는다
     */
    public AnalyticsResponseDto.SpikeReport getSpikeReport(int days, double sigma) {
        if (Double.isNaN(sigma) || sigma < 0) {
            throw new IllegalArgumentException("sigma must be non-negative: " + sigma);
        }

        BucketedSeries series = BucketedSeries.of(mentionRepository.findCreatedAtSince(since(days)),
                BucketGranularity.DAY);
        if (series.isEmpty()) {
            return new AnalyticsResponseDto.SpikeReport(List.of(), 0.0, 0.0);
        }

        SeriesStatistics stats = series.statistics();
        List<SpikeFinding> spikes = series.spikes(stats, sigma);

        log.info("Spike report for {} days: {} spikes", days, spikes.size());
        return new AnalyticsResponseDto.SpikeReport(spikes, stats.threshold(sigma), stats.getMean());
    }

    public AnalyticsResponseDto.Summary getSummary(int days) {
        LocalDateTime end = LocalDateTime.now(clock);
        LocalDateTime start = since(days);

        return AnalyticsResponseDto.Summary.builder()
                .totalMentions(mentionRepository.countByCreatedAtGreaterThanEqual(start))
                .sentimentDistribution(getSentimentDistribution(days))
                .topSources(sourceCounts(start, SUMMARY_TOP_N))
                .topTopics(getTopTopics(days, SUMMARY_TOP_N))
                .rangeStart(start)
                .rangeEnd(end)
                .build();
    }

    private List<AnalyticsResponseDto.SourceCount> sourceCounts(LocalDateTime since, int limit) {
        return mentionRepository.countBySourceSince(since, PageRequest.of(0, limit)).stream()
                .map(row -> new AnalyticsResponseDto.SourceCount((MentionSource) row[0], ((Number) row[1]).longValue()))
                .collect(Collectors.toList());
    }

    private LocalDateTime since(int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive: " + days);
        }
        return LocalDateTime.now(clock).minusDays(days);
    }

    private static void validateLimit(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
    }
}
