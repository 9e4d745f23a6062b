package com.clocked.backend.modules.realtime.infrastructure;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for persistence lookups triggered by socket events, kept off the container's I/O threads.
 */
@Configuration
public class RealtimeExecutorConfig {

    @Bean(name = "realtimeExecutor")
    public ThreadPoolTaskExecutor realtimeExecutor(
            @Value("${clocked.realtime.executor.core-size:4}") int coreSize,
            @Value("${clocked.realtime.executor.max-size:16}") int maxSize,
            @Value("${clocked.realtime.executor.queue-capacity:500}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("realtime-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        return executor;
    }
}
