package org.be.trackerservice.client.scoring;

import lombok.RequiredArgsConstructor;
import org.be.trackerservice.config.ScoringProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 설정된 토픽별 키워드를 본문에서 찾는다. 일치하는 토픽이 없으면 "general".
 */
@Component
@RequiredArgsConstructor
public class KeywordTopicClassifier implements TopicClassifier {

    static final String DEFAULT_TOPIC = "general";

    private final ScoringProperties scoringProperties;

    @Override
    public String classify(String text) {
        String normalized = text.toLowerCase(Locale.ROOT);

        for (Map.Entry<String, List<String>> topic : scoringProperties.getTopics().entrySet()) {
            boolean matched = topic.getValue().stream()
                    .filter(keyword -> keyword != null && !keyword.isBlank())
                    .map(keyword -> keyword.toLowerCase(Locale.ROOT).trim())
                    .anyMatch(normalized::contains);
            if (matched) {
                return topic.getKey();
            }
        }
        return DEFAULT_TOPIC;
    }
}
