package org.be.trackerservice.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final SourcesProperties sourcesProperties;

    /**
     * 소스 어댑터와 감성 분석 호출이 공유하는 RestTemplate. 모든 호출에 연결/읽기 타임아웃이 걸린다.
     */
    @Bean
    public RestTemplate restTemplate() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(sourcesProperties.getHttp().getConnectTimeoutMs());
        factory.setReadTimeout(sourcesProperties.getHttp().getReadTimeoutMs());
        log.info("RestTemplate configured: {}", sourcesProperties.getConfigSummary());
        return new RestTemplate(factory);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
