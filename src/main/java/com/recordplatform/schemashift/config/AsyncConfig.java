package com.recordplatform.schemashift.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    @Value("${schemashift.adaptation.pool-size:4}")
    private int poolSize;

    @Value("${schemashift.adaptation.queue-capacity:100}")
    private int queueCapacity;

    // Bounded pool for the per-event adapter fan-out
    @Bean(name = "schemaAdaptationExecutor")
    public ThreadPoolTaskExecutor schemaAdaptationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("schema-adapt-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
