package org.be.trackerservice.service.aggregation;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.be.trackerservice.client.source.SourceAdapter;
import org.be.trackerservice.dto.MentionCandidate;
import org.be.trackerservice.dto.SourceFetchResult;
import org.be.trackerservice.enums.MentionSource;
import org.be.trackerservice.enums.SkipReason;
import org.be.trackerservice.metrics.TrackerMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class MentionAggregatorTest {

    private ExecutorService executor;
    private SimpleMeterRegistry meterRegistry;
    private TrackerMetrics trackerMetrics;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(3);
        meterRegistry = new SimpleMeterRegistry();
        trackerMetrics = new TrackerMetrics(meterRegistry);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("어댑터 등록 순서대로 결과를 합친다")
    void aggregatePreservesRegistrationOrder() {
        // given
        MentionAggregator aggregator = new MentionAggregator(List.of(
                adapter(MentionSource.TWITTER, query -> success(MentionSource.TWITTER, "t1", "t2")),
                adapter(MentionSource.REDDIT, query -> success(MentionSource.REDDIT, "r1")),
                adapter(MentionSource.NEWS, query -> success(MentionSource.NEWS, "n1"))
        ), executor, trackerMetrics);

        // when
        List<MentionCandidate> candidates = aggregator.aggregate("acme");

        // then
        assertThat(candidates).extracting(MentionCandidate::getContent)
                .containsExactly("t1 acme", "t2 acme", "r1 acme", "n1 acme");
    }

    @Test
    @DisplayName("예외를 던진 어댑터는 UNEXPECTED_ERROR 로 건너뛰고 나머지는 유지")
    void throwingAdapterDoesNotRemoveOthers() {
        // given
        MentionAggregator aggregator = new MentionAggregator(List.of(
                adapter(MentionSource.TWITTER, query -> success(MentionSource.TWITTER, "t1")),
                adapter(MentionSource.REDDIT, query -> {
                    throw new IllegalStateException("boom");
                }),
                adapter(MentionSource.NEWS, query -> SourceFetchResult.skipped(MentionSource.NEWS,
                        SkipReason.MISSING_CREDENTIALS, "news credentials not configured"))
        ), executor, trackerMetrics);

        // when
        List<SourceFetchResult> results = aggregator.fetchAll("acme");

        // then
        assertThat(results).extracting(SourceFetchResult::getSource)
                .containsExactly(MentionSource.TWITTER, MentionSource.REDDIT, MentionSource.NEWS);
        assertThat(results.get(0).getCandidates()).hasSize(1);
        assertThat(results.get(1).skipReason()).contains(SkipReason.UNEXPECTED_ERROR);
        assertThat(results.get(2).skipReason()).contains(SkipReason.MISSING_CREDENTIALS);

        assertThat(meterRegistry.get("tracker.source.fetch")
                .tag("source", "reddit").tag("outcome", "unexpected_error").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("tracker.source.fetch")
                .tag("source", "twitter").tag("outcome", "success").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("실행자가 작업을 거부해도 예외 없이 건너뜀 결과")
    void rejectedTaskBecomesSkip() {
        // given
        MentionAggregator aggregator = new MentionAggregator(List.of(
                adapter(MentionSource.TWITTER, query -> success(MentionSource.TWITTER, "t1"))
        ), task -> {
            throw new RejectedExecutionException("saturated");
        }, trackerMetrics);

        // when
        List<SourceFetchResult> results = aggregator.fetchAll("acme");

        // then
        assertThat(results).hasSize(1);
        assertThat(results.get(0).skipReason()).contains(SkipReason.UNEXPECTED_ERROR);
        assertThat(aggregator.aggregate("acme")).isEmpty();
    }

    private static SourceAdapter adapter(MentionSource source, Function<String, SourceFetchResult> behavior) {
        return new SourceAdapter() {
            @Override
            public MentionSource getSource() {
                return source;
            }

            @Override
            public SourceFetchResult fetch(String query) {
                return behavior.apply(query);
            }
        };
    }

    private static SourceFetchResult success(MentionSource source, String... contents) {
        return SourceFetchResult.success(source, Arrays.stream(contents)
                .map(content -> MentionCandidate.builder()
                        .source(source)
                        .content(content + " acme")
                        .build())
                .collect(Collectors.toList()));
    }
}
