package org.be.trackerservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * 외부 소스 인증 정보와 엔드포인트. 기동 시 한 번 바인딩되고 어댑터 생성자에 주입된다.
 */
@Data
@Component
@ConfigurationProperties(prefix = "sources")
public class SourcesProperties {

    private News news = new News();
    private Twitter twitter = new Twitter();
    private Reddit reddit = new Reddit();
    private Http http = new Http();

    /**
     * 소스 수집 스레드 수
     */
    private int fetchPoolSize = 4;

    @Data
    public static class News {
        private String apiKey = "";
        private String baseUrl = "https://newsapi.org";
        private int pageSize = 50;

        public boolean isConfigured() {
            return StringUtils.hasText(apiKey);
        }
    }

    @Data
    public static class Twitter {
        private String apiKey = "";
        private String apiSecret = "";
        private String authUrl = "https://api.twitter.com/oauth2/token";
        private String searchUrl = "https://api.twitter.com/1.1/search/tweets.json";
        private int count = 50;

        public boolean isConfigured() {
            return StringUtils.hasText(apiKey) && StringUtils.hasText(apiSecret);
        }
    }

    @Data
    public static class Reddit {
        private String clientId = "";
        private String clientSecret = "";
        private String authUrl = "https://www.reddit.com/api/v1/access_token";
        private String searchUrl = "https://oauth.reddit.com/search";
        private int limit = 50;

        public boolean isConfigured() {
            return StringUtils.hasText(clientId) && StringUtils.hasText(clientSecret);
        }
    }

    @Data
    public static class Http {
        /**
         * HTTP 연결 타임아웃 (밀리초)
         */
        private int connectTimeoutMs = 5000;

        /**
         * HTTP 읽기 타임아웃 (밀리초)
         */
        private int readTimeoutMs = 10000;

        private String userAgent = "brand-tracker/0.1";
    }

    /**
     * 설정 요약 정보 반환 (로깅용, 비밀값 제외)
     */
    public String getConfigSummary() {
        return String.format(
                "Sources[news=%s, twitter=%s, reddit=%s, connectTimeout=%dms, readTimeout=%dms]",
                news.isConfigured(), twitter.isConfigured(), reddit.isConfigured(),
                http.getConnectTimeoutMs(), http.getReadTimeoutMs());
    }
}
