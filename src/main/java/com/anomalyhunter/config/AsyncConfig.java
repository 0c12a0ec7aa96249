package com.anomalyhunter.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools used by the detection pipeline.
 *
 * <ul>
 *   <li>{@code detectorExecutor} -- fan-out of the three detectors of each run; when saturated it
 *       rejects, and the investigation reports the detector as failed</li>
 *   <li>{@code oracleExecutor} -- oracle calls, so a hanging oracle can be timed out</li>
 *   <li>{@code learningPersistenceExecutor} -- single thread, keeps learning-state writes ordered</li>
 * </ul>
 */
@Configuration
@EnableConfigurationProperties({DetectionProperties.class, OracleProperties.class, LearningProperties.class})
public class AsyncConfig {

    private final DetectionProperties detectionProperties;

    public AsyncConfig(DetectionProperties detectionProperties) {
        this.detectionProperties = detectionProperties;
    }

    @Bean("detectorExecutor")
    public ThreadPoolTaskExecutor detectorExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(detectionProperties.getPoolSize());
        executor.setMaxPoolSize(detectionProperties.getPoolSize());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("detector-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean("oracleExecutor")
    public ThreadPoolTaskExecutor oracleExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(detectionProperties.getPoolSize());
        executor.setMaxPoolSize(detectionProperties.getPoolSize());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("oracle-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        return executor;
    }

    @Bean("learningPersistenceExecutor")
    public ThreadPoolTaskExecutor learningPersistenceExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("learning-store-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
