package org.be.trackerservice.entity;

import org.be.trackerservice.enums.MentionSource;
import org.be.trackerservice.enums.SentimentLabel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MentionTest {

    @Test
    @DisplayName("빌더로 만든 멘션은 감성 라벨과 신뢰도가 모두 비어 있음")
    void builtMentionHasNoSentiment() {
        Mention mention = mention();

        assertThat(mention.getSentiment()).isNull();
        assertThat(mention.getSentimentScore()).isNull();
    }

    @Test
    @DisplayName("감성 라벨과 신뢰도는 함께 설정됨")
    void applySentimentSetsBoth() {
        // given
        Mention mention = mention();

        // when
        mention.applySentiment(SentimentLabel.NEGATIVE, 0.87);

        // then
        assertThat(mention.getSentiment()).isEqualTo(SentimentLabel.NEGATIVE);
        assertThat(mention.getSentimentScore()).isEqualTo(0.87);
    }

    @Test
    @DisplayName("범위를 벗어난 신뢰도는 거부하고 기존 값을 유지")
    void invalidConfidenceLeavesStateUnchanged() {
        // given
        Mention mention = mention();
        mention.applySentiment(SentimentLabel.POSITIVE, 0.6);

        // when & then
        assertThatThrownBy(() -> mention.applySentiment(SentimentLabel.NEGATIVE, 1.2))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> mention.applySentiment(SentimentLabel.NEGATIVE, Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> mention.applySentiment(null, 0.5))
                .isInstanceOf(NullPointerException.class);
        assertThat(mention.getSentiment()).isEqualTo(SentimentLabel.POSITIVE);
        assertThat(mention.getSentimentScore()).isEqualTo(0.6);
    }

    private static Mention mention() {
        return Mention.builder()
                .source(MentionSource.REDDIT)
                .url("https://reddit.com/r/acme/1")
                .author("tester")
                .content("acme support is slow")
                .topic("support")
                .createdAt(LocalDateTime.of(2024, 5, 1, 12, 0))
                .build();
    }
}
