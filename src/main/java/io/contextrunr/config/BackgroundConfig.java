package io.contextrunr.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded in-process pool for detached work (cache write-backs, backend searches).
 * Tasks beyond the queue capacity are rejected, not run on the caller.
 */
@Configuration
public class BackgroundConfig {

    @Bean(name = "contextTaskExecutor")
    public ThreadPoolTaskExecutor contextTaskExecutor(ContextProperties properties) {
        ContextProperties.Background background = properties.background();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(background.workerThreads());
        executor.setMaxPoolSize(background.workerThreads());
        executor.setQueueCapacity(background.queueCapacity());
        executor.setThreadNamePrefix("context-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
