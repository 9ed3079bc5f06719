package com.motaz.uptake.batch.config;

import com.motaz.uptake.core.config.DetectionProperties;
import com.motaz.uptake.core.pipeline.CohortPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Slf4j
@Configuration
public class BatchConfig {

    @Bean
    @ConfigurationProperties(prefix = "uptake.detection")
    public DetectionProperties detectionProperties() {
        return new DetectionProperties();
    }

    @Bean
    public CohortPipeline cohortPipeline(DetectionProperties detectionProperties) {
        return CohortPipeline.of(detectionProperties);
    }

    /**
     * Pool for the per-cohort backtest sweep. Cohorts share nothing mutable,
     * so the pool size only bounds memory and CPU use.
     */
    @Bean(name = "cohortExecutor")
    public Executor cohortExecutor(BatchProperties batchProperties) {
        BatchProperties.Executor settings = batchProperties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(settings.getMaxPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("CohortBacktest-");
        // queue full: run on the caller
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        log.info("CohortExecutor initialised: core={}, max={}, queue={}",
                executor.getCorePoolSize(), executor.getMaxPoolSize(), settings.getQueueCapacity());
        return executor;
    }
}
