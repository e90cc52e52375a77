package org.be.trackerservice.service.detection;

import org.be.trackerservice.dto.SpikeFinding;
import org.be.trackerservice.enums.BucketGranularity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class BucketedSeriesTest {

    private static final LocalDateTime BASE = LocalDateTime.of(2024, 5, 1, 0, 0);

    @Test
    @DisplayName("시간 단위로 잘라 세고 시작 시각 오름차순으로 정렬")
    void bucketsByHour() {
        // given
        List<LocalDateTime> timestamps = Arrays.asList(
                BASE.plusHours(2).plusMinutes(59),
                BASE.plusMinutes(5),
                BASE.plusMinutes(45),
                null,
                BASE.plusHours(2));

        // when
        BucketedSeries series = BucketedSeries.of(timestamps, BucketGranularity.HOUR);

        // then
        assertThat(series.getBuckets()).containsExactly(
                new BucketedSeries.Bucket(BASE, 2),
                new BucketedSeries.Bucket(BASE.plusHours(2), 2));
    }

    @Test
    @DisplayName("일 단위 버킷")
    void bucketsByDay() {
        BucketedSeries series = BucketedSeries.of(
                List.of(BASE.plusHours(1), BASE.plusHours(23), BASE.plusDays(1).plusHours(3)),
                BucketGranularity.DAY);

        assertThat(series.getBuckets()).extracting(BucketedSeries.Bucket::getCount).containsExactly(2L, 1L);
    }

    @Test
    @DisplayName("임계값을 넘는 버킷만 급증으로 보고")
    void reportsSpikesAboveThreshold() {
        // given - 10건씩 10시간, 마지막 시간 100건
        List<LocalDateTime> timestamps = new ArrayList<>();
        for (int hour = 0; hour < 10; hour++) {
            timestamps.addAll(repeat(BASE.plusHours(hour), 10));
        }
        timestamps.addAll(repeat(BASE.plusHours(10), 100));
        BucketedSeries series = BucketedSeries.of(timestamps, BucketGranularity.HOUR);

        // when
        SeriesStatistics stats = series.statistics();
        List<SpikeFinding> spikes = series.spikes(stats, 2.5);

        // then
        assertThat(spikes).hasSize(1);
        SpikeFinding spike = spikes.get(0);
        assertThat(spike.getBucketStart()).isEqualTo(BASE.plusHours(10));
        assertThat(spike.getCount()).isEqualTo(100);
        assertThat(spike.getBaselineMean()).isCloseTo(18.18, within(0.01));
        assertThat(spike.getPercentageDeviation()).isCloseTo(450.0, within(0.01));
    }

    @Test
    @DisplayName("균일한 시계열에서는 급증 없음")
    void uniformSeriesHasNoSpikes() {
        List<LocalDateTime> timestamps = new ArrayList<>();
        for (int hour = 0; hour < 5; hour++) {
            timestamps.addAll(repeat(BASE.plusHours(hour), 3));
        }
        BucketedSeries series = BucketedSeries.of(timestamps, BucketGranularity.HOUR);

        assertThat(series.spikes(series.statistics(), 0.0)).isEmpty();
    }

    private static List<LocalDateTime> repeat(LocalDateTime timestamp, int times) {
        List<LocalDateTime> result = new ArrayList<>(times);
        for (int i = 0; i < times; i++) {
            result.add(timestamp);
        }
        return result;
    }
}
