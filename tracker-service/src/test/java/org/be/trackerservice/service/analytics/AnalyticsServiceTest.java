package org.be.trackerservice.service.analytics;

import org.be.trackerservice.dto.response.AnalyticsResponseDto;
import org.be.trackerservice.enums.BucketGranularity;
import org.be.trackerservice.enums.MentionSource;
import org.be.trackerservice.enums.SentimentLabel;
import org.be.trackerservice.repository.MentionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnalyticsServiceTest {

    private static final LocalDateTime NOW_UTC = LocalDateTime.of(2024, 5, 8, 12, 0);

    @Mock
    private MentionRepository mentionRepository;

    private AnalyticsService analyticsService;

    @BeforeEach
    void setUp() {
        analyticsService = new AnalyticsService(mentionRepository,
                Clock.fixed(Instant.parse("2024-05-08T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("없는 감성 라벨은 0으로 채운다")
    void sentimentDistribution() {
        // given
        when(mentionRepository.countBySentimentSince(NOW_UTC.minusDays(7))).thenReturn(rows(
                new Object[]{SentimentLabel.POSITIVE, 4L},
                new Object[]{SentimentLabel.NEGATIVE, 1L}));

        // when
        AnalyticsResponseDto.SentimentDistribution distribution = analyticsService.getSentimentDistribution(7);

        // then
        assertThat(distribution.getPositive()).isEqualTo(4);
        assertThat(distribution.getNegative()).isEqualTo(1);
        assertThat(distribution.getNeutral()).isZero();
        assertThat(distribution.getTotal()).isEqualTo(5);
    }

    @Test
    @DisplayName("타임라인은 일 단위로 감성별 집계")
    void dailyTimeline() {
        // given
        LocalDateTime day1 = LocalDateTime.of(2024, 5, 6, 0, 0);
        LocalDateTime day2 = LocalDateTime.of(2024, 5, 7, 0, 0);
        when(mentionRepository.findTimelineRowsSince(any())).thenReturn(rows(
                new Object[]{day1.plusHours(3), SentimentLabel.POSITIVE},
                new Object[]{day1.plusHours(9), SentimentLabel.NEGATIVE},
                new Object[]{day2.plusHours(1), SentimentLabel.NEUTRAL},
                new Object[]{day2.plusHours(2), null}));

        // when
        AnalyticsResponseDto.Timeline timeline = analyticsService.getTimeline(7, BucketGranularity.DAY);

        // then
        assertThat(timeline.getPoints()).hasSize(2);
        AnalyticsResponseDto.TimelinePoint first = timeline.getPoints().get(0);
        assertThat(first.getBucketStart()).isEqualTo(day1);
        assertThat(first.getPositive()).isEqualTo(1);
        assertThat(first.getNegative()).isEqualTo(1);
        assertThat(first.getTotal()).isEqualTo(2);
        assertThat(timeline.getPoints().get(1).getNeutral()).isEqualTo(2);
    }

    @Test
    @DisplayName("일별 급증 보고서는 기준선과 임계값을 포함")
    void spikeReport() {
        // given - 10일간 하루 10건, 마지막 날 100건
        List<LocalDateTime> timestamps = new ArrayList<>();
        LocalDateTime start = LocalDateTime.of(2024, 4, 27, 6, 0);
        for (int day = 0; day < 10; day++) {
            for (int i = 0; i < 10; i++) {
                timestamps.add(start.plusDays(day).plusMinutes(i));
            }
        }
        for (int i = 0; i < 100; i++) {
            timestamps.add(start.plusDays(10).plusMinutes(i));
        }
        when(mentionRepository.findCreatedAtSince(NOW_UTC.minusDays(14))).thenReturn(timestamps);

        // when
        AnalyticsResponseDto.SpikeReport report = analyticsService.getSpikeReport(14, 2.5);

        // then
        assertThat(report.getSpikes()).hasSize(1);
        assertThat(report.getSpikes().get(0).getBucketStart()).isEqualTo(LocalDateTime.of(2024, 5, 7, 0, 0));
        assertThat(report.getBaseline()).isCloseTo(18.18, within(0.01));
        assertThat(report.getThreshold()).isGreaterThan(report.getBaseline());
    }

    @Test
    @DisplayName("데이터가 없으면 빈 급증 보고서")
    void emptySpikeReport() {
        when(mentionRepository.findCreatedAtSince(any())).thenReturn(List.of());

        AnalyticsResponseDto.SpikeReport report = analyticsService.getSpikeReport(7, 2.5);

        assertThat(report.getSpikes()).isEmpty();
        assertThat(report.getBaseline()).isZero();
    }

    @Test
    @DisplayName("요약은 상위 5개 소스와 토픽, 조회 범위를 포함")
    void summary() {
        // given
        when(mentionRepository.countByCreatedAtGreaterThanEqual(NOW_UTC.minusDays(7))).thenReturn(12L);
        when(mentionRepository.countBySentimentSince(any())).thenReturn(List.of());
        when(mentionRepository.countBySourceSince(NOW_UTC.minusDays(7), PageRequest.of(0, 5))).thenReturn(rows(
                new Object[]{MentionSource.TWITTER, 8L},
                new Object[]{MentionSource.NEWS, 4L}));
        when(mentionRepository.countByTopicSince(NOW_UTC.minusDays(7), PageRequest.of(0, 5))).thenReturn(rows(
                new Object[]{"product", 7L}));

        // when
        AnalyticsResponseDto.Summary summary = analyticsService.getSummary(7);

        // then
        assertThat(summary.getTotalMentions()).isEqualTo(12);
        assertThat(summary.getTopSources()).extracting(AnalyticsResponseDto.SourceCount::getSource)
                .containsExactly(MentionSource.TWITTER, MentionSource.NEWS);
        assertThat(summary.getTopTopics()).extracting(AnalyticsResponseDto.TopicCount::getTopic)
                .containsExactly("product");
        assertThat(summary.getRangeStart()).isEqualTo(NOW_UTC.minusDays(7));
        assertThat(summary.getRangeEnd()).isEqualTo(NOW_UTC);
    }

    @Test
    @DisplayName("days, limit, sigma 검증")
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> analyticsService.getSentimentDistribution(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> analyticsService.getTopTopics(7, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> analyticsService.getSpikeReport(7, -0.5))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(mentionRepository);
    }

    private static List<Object[]> rows(Object[]... rows) {
        return Arrays.asList(rows);
    }
}
