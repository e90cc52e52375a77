package org.be.trackerservice.service.aggregation;

import lombok.extern.slf4j.Slf4j;
import org.be.trackerservice.client.source.SourceAdapter;
import org.be.trackerservice.dto.MentionCandidate;
import org.be.trackerservice.dto.SourceFetchResult;
import org.be.trackerservice.enums.SkipReason;
import org.be.trackerservice.metrics.TrackerMetrics;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * 등록된 모든 소스 어댑터를 동시에 호출하고 결과를 등록 순서대로 합친다.
 * 한 소스의 실패는 건너뜀 결과가 될 뿐 다른 소스 결과에 영향을 주지 않는다.
 */
@Slf4j
@Service
public class MentionAggregator {

    private final List<SourceAdapter> adapters;
    private final Executor sourceFetchExecutor;
    private final TrackerMetrics trackerMetrics;

    public MentionAggregator(List<SourceAdapter> adapters,
                             @Qualifier("sourceFetchExecutor") Executor sourceFetchExecutor,
                             TrackerMetrics trackerMetrics) {
        this.adapters = List.copyOf(adapters);
        this.sourceFetchExecutor = sourceFetchExecutor;
        this.trackerMetrics = trackerMetrics;
    }

    public List<MentionCandidate> aggregate(String query) {
        return fetchAll(query).stream()
                .flatMap(result -> result.getCandidates().stream())
                .collect(Collectors.toList());
    }

    /**
     * 어댑터별 수집 결과 (등록 순서)
     */
    public List<SourceFetchResult> fetchAll(String query) {
        log.info("Aggregating mentions for query '{}' from {} sources", query, adapters.size());

        List<CompletableFuture<SourceFetchResult>> futures = new ArrayList<>(adapters.size());
        for (SourceAdapter adapter : adapters) {
            futures.add(submit(adapter, query));
        }

        List<SourceFetchResult> results = futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());

        results.forEach(trackerMetrics::recordSourceFetch);

        int total = results.stream().mapToInt(r -> r.getCandidates().size()).sum();
        long skipped = results.stream().filter(SourceFetchResult::isSkipped).count();
        log.info("Aggregated {} candidates ({} of {} sources skipped)", total, skipped, results.size());
        return results;
    }

    private CompletableFuture<SourceFetchResult> submit(SourceAdapter adapter, String query) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> adapter.fetch(query), sourceFetchExecutor)
                    .exceptionally(e -> {
                        log.error("Source {} failed unexpectedly", adapter.getSource().getCode(), e);
                        return SourceFetchResult.skipped(adapter.getSource(), SkipReason.UNEXPECTED_ERROR,
                                String.valueOf(e.getMessage()));
                    });
        } catch (RuntimeException e) {
            // 실행자 포화로 거부된 경우
            log.error("Source {} could not be scheduled", adapter.getSource().getCode(), e);
            return CompletableFuture.completedFuture(SourceFetchResult.skipped(adapter.getSource(),
                    SkipReason.UNEXPECTED_ERROR, "Fetch task rejected: " + e.getMessage()));
        }
    }
}
