package org.be.trackerservice.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * 멘션 수집 출처
 */
public enum MentionSource {
    TWITTER("twitter", "Twitter/X 검색"),
    REDDIT("reddit", "Reddit 검색"),
    NEWS("news", "NewsAPI 기사"),
    BLOG("blog", "블로그/기타");

    private final String code;
    private final String description;

    MentionSource(String code, String description) {
        this.code = code;
        this.description = description;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    @JsonCreator
    public static MentionSource fromCode(String code) {
        return Arrays.stream(values())
                .filter(source -> source.code.equalsIgnoreCase(code) || source.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown mention source: " + code));
    }
}
