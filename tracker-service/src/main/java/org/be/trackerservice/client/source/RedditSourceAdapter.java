package org.be.trackerservice.client.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Reddit OAuth 검색. 본문(selftext)이 없으면 제목을 쓴다.
 */
@Component
@Order(2)
public class RedditSourceAdapter extends AbstractSourceAdapter {

    private final SourcesProperties.Reddit config;
    private final String userAgent;

    public RedditSourceAdapter(RestTemplate restTemplate, ObjectMapper objectMapper,
                               SourcesProperties sourcesProperties) {
        super(restTemplate, objectMapper);
        this.config = sourcesProperties.getReddit();
        this.userAgent = sourcesProperties.getHttp().getUserAgent();
    }

    @Override
    public MentionSource getSource() {
        return MentionSource.REDDIT;
    }

    @Override
    protected boolean isConfigured() {
        return config.isConfigured();
    }

    @Override
    protected List<MentionCandidate> search(String query) {
        // Reddit 은 User-Agent 없는 요청을 거부한다
        HttpHeaders agentHeader = new HttpHeaders();
        agentHeader.set(HttpHeaders.USER_AGENT, userAgent);

        String accessToken = obtainClientCredentialsToken(
                config.getAuthUrl(), config.getClientId(), config.getClientSecret(), agentHeader);

        URI uri = UriComponentsBuilder.fromHttpUrl(config.getSearchUrl())
                .queryParam("q", query)
                .queryParam("limit", config.getLimit())
                .queryParam("sort", "new")
                .queryParam("t", "week")
                .encode()
                .build()
                .toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "bearer " + accessToken);
        headers.set(HttpHeaders.USER_AGENT, userAgent);

        JsonNode children = getJson(uri, headers).path("data").path("children");
        if (!children.isMissingNode() && !children.isArray()) {
            throw new SourceFetchException(SkipReason.MALFORMED_PAYLOAD, "reddit 'data.children' is not an array");
        }

        List<MentionCandidate> mentions = new ArrayList<>();
        for (JsonNode child : children) {
            JsonNode post = child.path("data");
            String text = textOf(post, "selftext");
            if (text.isEmpty()) {
                text = textOf(post, "title");
            }
            if (text.isEmpty()) {
                continue;
            }

            mentions.add(MentionCandidate.builder()
                    .source(MentionSource.REDDIT)
                    .url("https://www.reddit.com" + textOf(post, "permalink"))
                    .author(textOf(post, "author"))
                    .content(text)
                    .publishedAt(parseCreatedUtc(post.get("created_utc")))
                    .build());
        }
        return mentions;
    }

    static LocalDateTime parseCreatedUtc(JsonNode createdUtc) {
        if (createdUtc == null || !createdUtc.isNumber()) {
            return null;
        }
        return LocalDateTime.ofInstant(Instant.ofEpochSecond(createdUtc.asLong()), ZoneOffset.UTC);
    }
}
