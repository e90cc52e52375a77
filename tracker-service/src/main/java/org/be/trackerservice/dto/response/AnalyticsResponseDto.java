package org.be.trackerservice.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.be.trackerservice.dto.SpikeFinding;
import org.be.trackerservice.enums.BucketGranularity;
import org.be.trackerservice.enums.MentionSource;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 분석 API 응답 모델
 */
public final class AnalyticsResponseDto {

    private AnalyticsResponseDto() {
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SentimentDistribution {
        private long positive;
        private long negative;
        private long neutral;
        private long total;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TopicCount {
        private String topic;
        private long count;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SourceCount {
        private MentionSource source;
        private long count;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TimelinePoint {
        private LocalDateTime bucketStart;
        private long positive;
        private long negative;
        private long neutral;
        private long total;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Timeline {
        private BucketGranularity granularity;
        private List<TimelinePoint> points;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SpikeReport {
        private List<SpikeFinding> spikes;

        /**
         * mean + sigma * stdev, 데이터가 없으면 0
         */
        private double threshold;

        private double baseline;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Summary {
        private long totalMentions;
        private SentimentDistribution sentimentDistribution;
        private List<SourceCount> topSources;
        private List<TopicCount> topTopics;
        private LocalDateTime rangeStart;
        private LocalDateTime rangeEnd;
    }
}
