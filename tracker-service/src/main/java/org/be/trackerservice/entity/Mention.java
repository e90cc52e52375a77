package org.be.trackerservice.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.be.trackerservice.enums.MentionSource;
import org.be.trackerservice.enums.SentimentLabel;

import java.time.LocalDateTime;
import java.util.Objects;

@Entity
@Table(name = "mentions", indexes = {
        @Index(name = "idx_mentions_created_at", columnList = "created_at"),
        @Index(name = "idx_source_created_at", columnList = "source, created_at"),
        @Index(name = "idx_sentiment_created_at", columnList = "sentiment, created_at"),
        @Index(name = "idx_topic_created_at", columnList = "topic, created_at")
})
@Data
@NoArgsConstructor
public class Mention {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private MentionSource source;

    @Column(columnDefinition = "TEXT")
    private String url;

    @Column(length = 100)
    private String author;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String content;

    /**
     * 감성 라벨과 신뢰도는 항상 함께 설정된다 ({@link #applySentiment})
     */
    @Setter(AccessLevel.NONE)
    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private SentimentLabel sentiment;

    @Setter(AccessLevel.NONE)
    @Column(name = "sentiment_score")
    private Double sentimentScore;

    @Column(length = 100)
    private String topic;

    /**
     * 원본 게시 시각 (UTC). 출처가 제공하지 않으면 수집 시각
     */
    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    /**
     * 감성은 빌더로 받지 않는다. 생성 후 {@link #applySentiment} 로 설정한다.
     */
    @Builder
    public Mention(Long id, MentionSource source, String url, String author, String content,
                   String topic, LocalDateTime createdAt) {
        this.id = id;
        this.source = source;
        this.url = url;
        this.author = author;
        this.content = content;
        this.topic = topic;
        this.createdAt = createdAt;
    }

    public void applySentiment(SentimentLabel label, double confidence) {
        Objects.requireNonNull(label, "Sentiment label must not be null");
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("Sentiment confidence must be within [0, 1], got: " + confidence);
        }
        this.sentiment = label;
        this.sentimentScore = confidence;
    }
}
