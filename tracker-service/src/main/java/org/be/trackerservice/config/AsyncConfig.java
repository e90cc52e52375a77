package org.be.trackerservice.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    private final SourcesProperties sourcesProperties;
    private final ScoringProperties scoringProperties;

    /**
     * 소스 수집 전용 실행자
     */
    @Bean(name = "sourceFetchExecutor")
    public ThreadPoolTaskExecutor sourceFetchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(sourcesProperties.getFetchPoolSize());
        executor.setMaxPoolSize(sourcesProperties.getFetchPoolSize());
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("source-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * 감성/토픽 점수 호출 전용 실행자. 외부 점수 서비스 부하를 제한한다.
     * 큐가 가득 차면 작업을 거부하고 해당 호출은 대체값을 쓴다.
     */
    @Bean(name = "scoringExecutor")
    public ThreadPoolTaskExecutor scoringExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(scoringProperties.getPoolSize());
        executor.setMaxPoolSize(scoringProperties.getPoolSize());
        executor.setQueueCapacity(scoringProperties.getQueueCapacity());
        executor.setThreadNamePrefix("scoring-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        log.info("Scoring executor initialized: poolSize={}, queueCapacity={}",
                scoringProperties.getPoolSize(), scoringProperties.getQueueCapacity());
        return executor;
    }
}
