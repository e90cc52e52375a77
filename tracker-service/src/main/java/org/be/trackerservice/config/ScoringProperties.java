package org.be.trackerservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Component
@ConfigurationProperties(prefix = "scoring")
public class ScoringProperties {

    /**
     * 감성 분석 서비스 URL (Hugging Face inference 호환). 비어 있으면 중립 처리
     */
    private String sentimentUrl = "";

    private String sentimentApiToken = "";

    /**
     * 점수 호출 1건당 타임아웃 (밀리초)
     */
    private long timeoutMs = 5000;

    /**
     * 동시 점수 호출 수
     */
    private int poolSize = 4;

    private int queueCapacity = 500;

    /**
     * 토픽 -> 키워드 목록. 선언 순서대로 매칭한다
     */
    private Map<String, List<String>> topics = new LinkedHashMap<>();
}
