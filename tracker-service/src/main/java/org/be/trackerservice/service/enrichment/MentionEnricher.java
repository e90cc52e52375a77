package org.be.trackerservice.service.enrichment;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.be.trackerservice.client.scoring.SentimentScorer;
import org.be.trackerservice.client.scoring.TopicClassifier;
import org.be.trackerservice.config.ScoringProperties;
import org.be.trackerservice.dto.MentionCandidate;
import org.be.trackerservice.dto.SentimentScore;
import org.be.trackerservice.entity.Mention;
import org.be.trackerservice.metrics.TrackerMetrics;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 후보마다 감성 점수와 토픽을 붙여 {@link Mention} 으로 만든다.
 * 점수 호출이 실패하거나 시간 초과되면 neutral/0.5, uncategorized 로 대체한다.
 * 타임아웃은 호출이 실행자에서 시작된 시점부터 적용된다.
 */
@Slf4j
@Service
public class MentionEnricher {

    static final int MAX_SCORING_LENGTH = 512;
    static final String FALLBACK_TOPIC = "uncategorized";

    private final SentimentScorer sentimentScorer;
    private final TopicClassifier topicClassifier;
    private final Executor scoringExecutor;
    private final ScoringProperties scoringProperties;
    private final TrackerMetrics trackerMetrics;
    private final Clock clock;

    public MentionEnricher(SentimentScorer sentimentScorer,
                           TopicClassifier topicClassifier,
                           @Qualifier("scoringExecutor") Executor scoringExecutor,
                           ScoringProperties scoringProperties,
                           TrackerMetrics trackerMetrics,
                           Clock clock) {
        this.sentimentScorer = sentimentScorer;
        this.topicClassifier = topicClassifier;
        this.scoringExecutor = scoringExecutor;
        this.scoringProperties = scoringProperties;
        this.trackerMetrics = trackerMetrics;
        this.clock = clock;
    }

    public List<Mention> enrich(List<MentionCandidate> candidates) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        log.info("Enriching {} candidates", candidates.size());

        List<PendingMention> pending = new ArrayList<>(candidates.size());
        for (MentionCandidate candidate : candidates) {
            if (!StringUtils.hasText(candidate.getContent())) {
                log.debug("Dropping candidate with blank content from {}", candidate.getSource());
                continue;
            }
            String text = truncate(candidate.getContent());
            pending.add(new PendingMention(candidate,
                    call(() -> sentimentScorer.score(text), SentimentScore.NEUTRAL_FALLBACK, "sentiment"),
                    call(() -> topicClassifier.classify(text), FALLBACK_TOPIC, "topic")));
        }

        List<Mention> mentions = new ArrayList<>(pending.size());
        for (PendingMention item : pending) {
            mentions.add(toMention(item.getCandidate(), item.getSentiment().join(), item.getTopic().join()));
        }

        log.info("Enriched {} mentions", mentions.size());
        return mentions;
    }

    private <T> CompletableFuture<T> call(Supplier<T> scoringCall, T fallback, String kind) {
        CompletableFuture<T> result = new CompletableFuture<>();
        FutureTask<T> task = new FutureTask<>(() -> {
            // 대기열에서 기다린 시간은 빼고 실제 호출 시작부터 잰다
            result.orTimeout(scoringProperties.getTimeoutMs(), TimeUnit.MILLISECONDS);
            try {
                T value = scoringCall.get();
                result.complete(value);
                return value;
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
                throw e;
            }
        });
        // 시간 초과된 호출은 스레드를 붙잡지 않도록 중단시킨다
        result.whenComplete((value, e) -> {
            if (e instanceof TimeoutException) {
                task.cancel(true);
            }
        });

        try {
            scoringExecutor.execute(task);
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
        }

        return result
                .thenApply(value -> {
                    if (value == null) {
                        throw new IllegalStateException(kind + " scorer returned no result");
                    }
                    return value;
                })
                .exceptionally(e -> {
                    log.warn("{} scoring failed, using fallback: {}", kind, e.getMessage());
                    trackerMetrics.incrementScoringFallback();
                    return fallback;
                });
    }

    private Mention toMention(MentionCandidate candidate, SentimentScore score, String topic) {
        LocalDateTime createdAt = candidate.getPublishedAt() != null
                ? candidate.getPublishedAt()
                : LocalDateTime.now(clock);

        Mention mention = Mention.builder()
                .source(candidate.getSource())
                .url(candidate.getUrl())
                .author(truncateAuthor(candidate.getAuthor()))
                .content(candidate.getContent())
                .topic(StringUtils.hasText(topic) ? topic : FALLBACK_TOPIC)
                .createdAt(createdAt)
                .build();

        if (score.getLabel() == null || score.getConfidence() < 0.0 || score.getConfidence() > 1.0) {
            log.warn("Invalid sentiment score {}, using neutral fallback", score);
            trackerMetrics.incrementScoringFallback();
            score = SentimentScore.NEUTRAL_FALLBACK;
        }
        mention.applySentiment(score.getLabel(), score.getConfidence());
        return mention;
    }

    static String truncate(String content) {
        return content.length() > MAX_SCORING_LENGTH ? content.substring(0, MAX_SCORING_LENGTH) : content;
    }

    // author 컬럼 길이 100
    private static String truncateAuthor(String author) {
        return author.length() > 100 ? author.substring(0, 100) : author;
    }

    @Getter
    @RequiredArgsConstructor
    private static class PendingMention {
        private final MentionCandidate candidate;
        private final CompletableFuture<SentimentScore> sentiment;
        private final CompletableFuture<String> topic;
    }
}
