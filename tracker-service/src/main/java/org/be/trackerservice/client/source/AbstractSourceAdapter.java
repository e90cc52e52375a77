package org.be.trackerservice.client.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.be.trackerservice.dto.MentionCandidate;
import org.be.trackerservice.dto.SourceFetchResult;
import org.be.trackerservice.enums.SkipReason;
import org.be.trackerservice.exception.SourceFetchException;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.List;

/**
 * 공통 흐름: 인증 정보 확인 -> (토큰 발급) -> 검색 -> 정규화.
 * 모든 예외는 여기서 {@link SourceFetchResult#skipped} 로 바뀐다.
 */
@Slf4j
public abstract class AbstractSourceAdapter implements SourceAdapter {

    protected final RestTemplate restTemplate;
    protected final ObjectMapper objectMapper;

    protected AbstractSourceAdapter(RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public final SourceFetchResult fetch(String query) {
        String source = getSource().getCode();

        if (!isConfigured()) {
            log.info("{} credentials not configured; skipping {} aggregation", source, source);
            return SourceFetchResult.skipped(getSource(), SkipReason.MISSING_CREDENTIALS,
                    source + " credentials not configured");
        }

        log.info("Aggregating from {} for query: {}", source, query);
        try {
            List<MentionCandidate> candidates = search(query);
            log.info("Fetched {} mentions from {}", candidates.size(), source);
            return SourceFetchResult.success(getSource(), candidates);
        } catch (SourceFetchException e) {
            log.error("{} fetch failed ({}): {}", source, e.getReason(), e.getMessage());
            return SourceFetchResult.skipped(getSource(), e.getReason(), e.getMessage());
        } catch (Exception e) {
            log.error("Unexpected error while fetching from {}", source, e);
            return SourceFetchResult.skipped(getSource(), SkipReason.UNEXPECTED_ERROR, e.getMessage());
        }
    }

    protected abstract boolean isConfigured();

    /**
     * 검색 후 정규화된 후보 목록. 내용이 빈 항목은 제외해야 한다.
     *
     * @throws SourceFetchException 인증, 요청, 파싱 실패
     */
    protected abstract List<MentionCandidate> search(String query);

    /**
     * client_credentials 방식 토큰 발급
     */
    protected String obtainClientCredentialsToken(String authUrl, String clientId, String clientSecret,
                                                  HttpHeaders extraHeaders) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setBasicAuth(clientId, clientSecret);
        if (extraHeaders != null) {
            headers.addAll(extraHeaders);
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");

        JsonNode body;
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    authUrl, new HttpEntity<>(form, headers), String.class);
            body = objectMapper.readTree(response.getBody() != null ? response.getBody() : "");
        } catch (RestClientException | JsonProcessingException e) {
            throw new SourceFetchException(SkipReason.AUTH_FAILED,
                    "Error obtaining " + getSource().getCode() + " access token: " + e.getMessage(), e);
        }

        String token = textOf(body, "access_token");
        if (!StringUtils.hasText(token)) {
            throw new SourceFetchException(SkipReason.AUTH_FAILED,
                    getSource().getCode() + " auth succeeded but no access_token was returned");
        }
        return token;
    }

    protected JsonNode getJson(URI uri, HttpHeaders headers) {
        String body;
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    uri, HttpMethod.GET, new HttpEntity<>(headers), String.class);
            body = response.getBody();
        } catch (RestClientException e) {
            throw new SourceFetchException(SkipReason.REQUEST_FAILED,
                    "Error while fetching from " + getSource().getCode() + ": " + e.getMessage(), e);
        }

        if (!StringUtils.hasText(body)) {
            throw new SourceFetchException(SkipReason.MALFORMED_PAYLOAD,
                    getSource().getCode() + " returned an empty body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SourceFetchException(SkipReason.MALFORMED_PAYLOAD,
                    "Malformed " + getSource().getCode() + " payload: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * 누락되었거나 JSON null 인 필드는 빈 문자열
     */
    protected static String textOf(JsonNode node, String field) {
        if (node == null) {
            return "";
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return "";
        }
        return value.asText("").trim();
    }
}
