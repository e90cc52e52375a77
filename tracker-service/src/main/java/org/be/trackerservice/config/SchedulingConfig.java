package org.be.trackerservice.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * tracker.schedule.enabled=true 일 때만 스케줄링을 켠다
 */
@Slf4j
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "tracker.schedule", name = "enabled", havingValue = "true")
public class SchedulingConfig {

    /**
     * 수집 스케줄러. 단일 스레드라 실행이 겹치지 않는다
     */
    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("ingestion-scheduler-");
        scheduler.initialize();
        log.info("Scheduled ingestion enabled");
        return scheduler;
    }
}
