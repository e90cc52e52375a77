package org.be.trackerservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;
import java.util.stream.Stream;

@Data
@Component
@ConfigurationProperties(prefix = "tracker")
public class TrackerProperties {

    private String brandName = "";
    private String brandKeywords = "";
    private String searchQuery = "";

    private Schedule schedule = new Schedule();

    @Data
    public static class Schedule {
        private boolean enabled = false;

        /**
         * 수집 주기 (밀리초), 이전 실행 종료 기준
         */
        private long intervalMs = 3_600_000L;

        private long initialDelayMs = 60_000L;
    }

    /**
     * search-query, brand-keywords, brand-name 순으로 첫 번째 값
     */
    public Optional<String> resolveDefaultQuery() {
        return Stream.of(searchQuery, brandKeywords, brandName)
                .filter(StringUtils::hasText)
                .map(String::trim)
                .findFirst();
    }
}
