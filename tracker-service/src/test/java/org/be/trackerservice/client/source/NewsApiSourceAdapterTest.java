package org.be.trackerservice.client.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.be.trackerservice.config.SourcesProperties;
import org.be.trackerservice.dto.MentionCandidate;
import org.be.trackerservice.dto.SourceFetchResult;
import org.be.trackerservice.enums.SkipReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class NewsApiSourceAdapterTest {

    private static final String EVERYTHING_URL = "https://newsapi.org/v2/everything";

    private MockRestServiceServer server;
    private SourcesProperties sourcesProperties;
    private NewsApiSourceAdapter adapter;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        sourcesProperties = new SourcesProperties();
        sourcesProperties.getNews().setApiKey("news-key");

        adapter = new NewsApiSourceAdapter(restTemplate, new ObjectMapper(), sourcesProperties);
    }

    @Test
    @DisplayName("제목, 설명, 본문을 이어 붙이고 author 가 없으면 source.name 사용")
    void fetchNormalizesArticles() {
        // given
        server.expect(requestTo(startsWith(EVERYTHING_URL)))
                .andExpect(method(HttpMethod.GET))
                .andExpect(queryParam("q", "acme"))
                .andExpect(queryParam("sortBy", "publishedAt"))
                .andExpect(queryParam("apiKey", "news-key"))
                .andRespond(withSuccess("""
                        {"status": "ok", "articles": [
                          {"title": "Acme launches", "description": "New product", "content": null,
                           "author": null, "source": {"name": "Daily"}, "url": "https://news.example/1",
                           "publishedAt": "2024-03-01T12:15:30+02:00"},
                          {"title": "", "description": null, "content": ""},
                          {"title": "Acme stock", "author": "Eve", "publishedAt": "not-a-date"}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        // when
        SourceFetchResult result = adapter.fetch("acme");

        // then
        server.verify();
        assertThat(result.getCandidates()).hasSize(2);

        MentionCandidate first = result.getCandidates().get(0);
        assertThat(first.getContent()).isEqualTo("Acme launches New product");
        assertThat(first.getAuthor()).isEqualTo("Daily");
        assertThat(first.getUrl()).isEqualTo("https://news.example/1");
        assertThat(first.getPublishedAt()).isEqualTo(LocalDateTime.of(2024, 3, 1, 10, 15, 30));

        MentionCandidate second = result.getCandidates().get(1);
        assertThat(second.getAuthor()).isEqualTo("Eve");
        assertThat(second.getPublishedAt()).isNull();
    }

    @Test
    @DisplayName("API 키가 없으면 MISSING_CREDENTIALS")
    void skipsWhenApiKeyMissing() {
        // given
        sourcesProperties.getNews().setApiKey(" ");

        // when
        SourceFetchResult result = adapter.fetch("acme");

        // then
        server.verify();
        assertThat(result.skipReason()).contains(SkipReason.MISSING_CREDENTIALS);
    }

    @Test
    @DisplayName("4xx 응답은 REQUEST_FAILED")
    void clientErrorIsRequestFailure() {
        // given
        server.expect(requestTo(startsWith(EVERYTHING_URL))).andRespond(withBadRequest());

        // when
        SourceFetchResult result = adapter.fetch("acme");

        // then
        assertThat(result.skipReason()).contains(SkipReason.REQUEST_FAILED);
        assertThat(result.getSkipReason().isFailure()).isTrue();
    }
}
