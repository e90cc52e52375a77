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
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * NewsAPI everything 검색. 제목 + 설명 + 본문을 이어 붙여 내용으로 쓴다.
 */
@Slf4j
@Component
@Order(3)
public class NewsApiSourceAdapter extends AbstractSourceAdapter {

    private final SourcesProperties.News config;

    public NewsApiSourceAdapter(RestTemplate restTemplate, ObjectMapper objectMapper,
                                SourcesProperties sourcesProperties) {
        super(restTemplate, objectMapper);
        this.config = sourcesProperties.getNews();
    }

    @Override
    public MentionSource getSource() {
        return MentionSource.NEWS;
    }

    @Override
    protected boolean isConfigured() {
        return config.isConfigured();
    }

    @Override
    protected List<MentionCandidate> search(String query) {
        URI uri = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl())
                .path("/v2/everything")
                .queryParam("q", query)
                .queryParam("language", "en")
                .queryParam("sortBy", "publishedAt")
                .queryParam("pageSize", config.getPageSize())
                .queryParam("apiKey", config.getApiKey())
                .encode()
                .build()
                .toUri();

        JsonNode articles = getJson(uri, new HttpHeaders()).path("articles");
        if (!articles.isMissingNode() && !articles.isArray()) {
            throw new SourceFetchException(SkipReason.MALFORMED_PAYLOAD, "news 'articles' is not an array");
        }

        List<MentionCandidate> mentions = new ArrayList<>();
        for (JsonNode article : articles) {
            String fullContent = Stream.of(
                            textOf(article, "title"),
                            textOf(article, "description"),
                            textOf(article, "content"))
                    .filter(part -> !part.isEmpty())
                    .collect(Collectors.joining(" "));

            if (fullContent.isEmpty()) {
                continue;
            }

            String author = textOf(article, "author");
            if (author.isEmpty()) {
                author = textOf(article.path("source"), "name");
            }

            mentions.add(MentionCandidate.builder()
                    .source(MentionSource.NEWS)
                    .url(textOf(article, "url"))
                    .author(author)
                    .content(fullContent)
                    .publishedAt(parsePublishedAt(textOf(article, "publishedAt")))
                    .build());
        }
        return mentions;
    }

    static LocalDateTime parsePublishedAt(String raw) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable news publishedAt: {}", raw);
            return null;
        }
    }
}
