package org.be.trackerservice.config;

import lombok.Data;
import org.be.trackerservice.enums.BucketGranularity;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 활성화된 AlertConfig 가 없을 때 쓰는 기본 탐지 파라미터와 알림 발행 설정
 */
@Data
@Component
@ConfigurationProperties(prefix = "alert")
public class AlertProperties {

    private Spike spike = new Spike();
    private SentimentShift sentimentShift = new SentimentShift();
    private Publish publish = new Publish();

    @Data
    public static class Spike {
        private double thresholdSigma = 2.5;
        private int windowHours = 24;
        private BucketGranularity granularity = BucketGranularity.HOUR;
    }

    @Data
    public static class SentimentShift {
        private int windowHours = 24;
    }

    @Data
    public static class Publish {
        private boolean enabled = false;
        private String topic = "brand-alerts";
    }
}
