package org.be.trackerservice.service.detection;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.be.trackerservice.dto.SpikeFinding;
import org.be.trackerservice.enums.BucketGranularity;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 시각을 버킷 단위로 잘라 센 시계열. 비어 있는 버킷은 포함하지 않는다.
 */
public final class BucketedSeries {

    private final BucketGranularity granularity;
    private final List<Bucket> buckets;

    private BucketedSeries(BucketGranularity granularity, List<Bucket> buckets) {
        this.granularity = granularity;
        this.buckets = Collections.unmodifiableList(buckets);
    }

    public static BucketedSeries of(Collection<LocalDateTime> timestamps, BucketGranularity granularity) {
        TreeMap<LocalDateTime, Long> counts = new TreeMap<>();
        for (LocalDateTime timestamp : timestamps) {
            if (timestamp != null) {
                counts.merge(granularity.truncate(timestamp), 1L, Long::sum);
            }
        }

        List<Bucket> buckets = new ArrayList<>(counts.size());
        for (Map.Entry<LocalDateTime, Long> entry : counts.entrySet()) {
            buckets.add(new Bucket(entry.getKey(), entry.getValue()));
        }
        return new BucketedSeries(granularity, buckets);
    }

    public BucketGranularity getGranularity() {
        return granularity;
    }

    /**
     * 시작 시각 오름차순
     */
    public List<Bucket> getBuckets() {
        return buckets;
    }

    public boolean isEmpty() {
        return buckets.isEmpty();
    }

    public SeriesStatistics statistics() {
        return SeriesStatistics.of(buckets.stream().mapToLong(Bucket::getCount).toArray());
    }

    /**
     * mean + sigma * stdev 를 초과하는 버킷 (시간순)
     */
    public List<SpikeFinding> spikes(SeriesStatistics stats, double sigma) {
        double threshold = stats.threshold(sigma);
        List<SpikeFinding> findings = new ArrayList<>();
        for (Bucket bucket : buckets) {
            if (bucket.getCount() > threshold) {
                findings.add(SpikeFinding.builder()
                        .bucketStart(bucket.getStart())
                        .count(bucket.getCount())
                        .baselineMean(stats.getMean())
                        .baselineStdDev(stats.getSampleStdDev())
                        .threshold(threshold)
                        .percentageDeviation(stats.percentageDeviation(bucket.getCount()))
                        .build());
            }
        }
        return findings;
    }

    @Data
    @AllArgsConstructor
    public static class Bucket {
        private LocalDateTime start;
        private long count;
    }
}
