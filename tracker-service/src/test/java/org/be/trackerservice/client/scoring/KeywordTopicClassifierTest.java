package org.be.trackerservice.client.scoring;

import org.be.trackerservice.config.ScoringProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordTopicClassifierTest {

    private KeywordTopicClassifier classifier;

    @BeforeEach
    void setUp() {
        ScoringProperties scoringProperties = new ScoringProperties();
        scoringProperties.getTopics().put("product", List.of("launch", "release"));
        scoringProperties.getTopics().put("support", List.of("outage", "bug"));
        classifier = new KeywordTopicClassifier(scoringProperties);
    }

    @Test
    @DisplayName("대소문자 구분 없이 키워드 매칭")
    void matchesCaseInsensitively() {
        assertThat(classifier.classify("Big LAUNCH event today")).isEqualTo("product");
        assertThat(classifier.classify("Another Bug in the app")).isEqualTo("support");
    }

    @Test
    @DisplayName("여러 토픽이 일치하면 먼저 선언된 토픽")
    void firstDeclaredTopicWins() {
        assertThat(classifier.classify("outage right after the release")).isEqualTo("product");
    }

    @Test
    @DisplayName("일치하는 토픽이 없으면 general")
    void fallsBackToGeneral() {
        assertThat(classifier.classify("just talking about acme")).isEqualTo("general");
    }
}
