package org.be.trackerservice.client.scoring;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.be.trackerservice.config.ScoringProperties;
import org.be.trackerservice.dto.SentimentScore;
import org.be.trackerservice.enums.SentimentLabel;
import org.be.trackerservice.exception.ScoringException;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Locale;
import java.util.Map;

/**
 * Hugging Face inference 형식의 감성 분석 서비스 클라이언트.
 * 응답은 [{label, score}] 또는 [[{label, score}, ...]] 이며 가장 높은 점수의 라벨을 쓴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RemoteSentimentScorer implements SentimentScorer {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final ScoringProperties scoringProperties;

    @Override
    public SentimentScore score(String text) {
        if (!StringUtils.hasText(scoringProperties.getSentimentUrl())) {
            throw new ScoringException("Sentiment service is not configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (StringUtils.hasText(scoringProperties.getSentimentApiToken())) {
            headers.setBearerAuth(scoringProperties.getSentimentApiToken());
        }

        String body;
        try {
            body = restTemplate.postForObject(scoringProperties.getSentimentUrl(),
                    new HttpEntity<>(Map.of("inputs", text), headers), String.class);
        } catch (RestClientException e) {
            throw new ScoringException("Sentiment service call failed: " + e.getMessage(), e);
        }

        try {
            return parse(objectMapper.readTree(body != null ? body : ""));
        } catch (JsonProcessingException e) {
            throw new ScoringException("Malformed sentiment response", e);
        }
    }

    SentimentScore parse(JsonNode root) {
        JsonNode candidates = root;
        // 배치 응답은 한 겹 더 감싸져 있다
        if (candidates.isArray() && candidates.size() > 0 && candidates.get(0).isArray()) {
            candidates = candidates.get(0);
        }
        if (!candidates.isArray() || candidates.isEmpty()) {
            throw new ScoringException("Sentiment response has no predictions");
        }

        JsonNode best = null;
        for (JsonNode candidate : candidates) {
            if (!candidate.hasNonNull("label") || !candidate.path("score").isNumber()) {
                continue;
            }
            if (best == null || candidate.get("score").asDouble() > best.get("score").asDouble()) {
                best = candidate;
            }
        }
        if (best == null) {
            throw new ScoringException("Sentiment response has no usable label/score pair");
        }

        double confidence = best.get("score").asDouble();
        if (confidence < 0.0 || confidence > 1.0) {
            throw new ScoringException("Sentiment confidence out of range: " + confidence);
        }

        SentimentLabel label = mapLabel(best.get("label").asText());
        log.debug("Sentiment analysis: {} ({})", label.getCode(), String.format("%.2f", confidence));
        return new SentimentScore(label, confidence);
    }

    static SentimentLabel mapLabel(String rawLabel) {
        String label = rawLabel.toLowerCase(Locale.ROOT);
        if (label.contains("pos")) {
            return SentimentLabel.POSITIVE;
        }
        if (label.contains("neg")) {
            return SentimentLabel.NEGATIVE;
        }
        return SentimentLabel.NEUTRAL;
    }
}
