package org.be.trackerservice.client.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.be.trackerservice.config.SourcesProperties;
import org.be.trackerservice.dto.MentionCandidate;
import org.be.trackerservice.enums.MentionSource;
import org.be.trackerservice.enums.SkipReason;
import org.be.trackerservice.exception.SourceFetchException;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Twitter/X 최근 트윗 검색 (application-only bearer 토큰)
 */
@Slf4j
@Component
@Order(1)
public class TwitterSourceAdapter extends AbstractSourceAdapter {

    // 예: "Wed Oct 10 20:19:24 +0000 2018"
    static final DateTimeFormatter CREATED_AT_FORMAT =
            DateTimeFormatter.ofPattern("EEE MMM dd HH:mm:ss Z yyyy", Locale.ENGLISH);

    private final SourcesProperties.Twitter config;

    public TwitterSourceAdapter(RestTemplate restTemplate, ObjectMapper objectMapper,
                                SourcesProperties sourcesProperties) {
        super(restTemplate, objectMapper);
        this.config = sourcesProperties.getTwitter();
    }

    @Override
    public MentionSource getSource() {
        return MentionSource.TWITTER;
    }

    @Override
    protected boolean isConfigured() {
        return config.isConfigured();
    }

    @Override
    protected List<MentionCandidate> search(String query) {
        String bearer = obtainClientCredentialsToken(
                config.getAuthUrl(), config.getApiKey(), config.getApiSecret(), null);

        URI uri = UriComponentsBuilder.fromHttpUrl(config.getSearchUrl())
                .queryParam("q", query)
                .queryParam("lang", "en")
                .queryParam("result_type", "recent")
                .queryParam("count", config.getCount())
                .encode()
                .build()
                .toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(bearer);

        JsonNode statuses = getJson(uri, headers).path("statuses");
        if (!statuses.isMissingNode() && !statuses.isArray()) {
            throw new SourceFetchException(SkipReason.MALFORMED_PAYLOAD, "twitter 'statuses' is not an array");
        }

        List<MentionCandidate> mentions = new ArrayList<>();
        for (JsonNode tweet : statuses) {
            String text = textOf(tweet, "text");
            if (text.isEmpty()) {
                continue;
            }

            String tweetId = textOf(tweet, "id_str");
            mentions.add(MentionCandidate.builder()
                    .source(MentionSource.TWITTER)
                    .url(tweetId.isEmpty() ? "" : "https://twitter.com/i/web/status/" + tweetId)
                    .author(textOf(tweet.path("user"), "screen_name"))
                    .content(text)
                    .publishedAt(parseCreatedAt(textOf(tweet, "created_at")))
                    .build());
        }
        return mentions;
    }

    static LocalDateTime parseCreatedAt(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(raw, CREATED_AT_FORMAT)
                    .withZoneSameInstant(ZoneOffset.UTC)
                    .toLocalDateTime();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable twitter created_at: {}", raw);
            return null;
        }
    }
}
