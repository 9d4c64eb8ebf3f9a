package com.github.tubetune.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors are direct hand-off: no queue, no upper bound. A request never
 * waits behind another request.
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "requestExecutor")
    public ThreadPoolTaskExecutor requestExecutor() {
        return unbounded("request-", 60);
    }

    @Bean(name = "strategyExecutor")
    public ThreadPoolTaskExecutor strategyExecutor() {
        return unbounded("strategy-", 10);
    }

    @Bean(name = "progressExecutor")
    public ThreadPoolTaskExecutor progressExecutor() {
        return unbounded("progress-", 5);
    }

    private ThreadPoolTaskExecutor unbounded(String threadNamePrefix, int awaitTerminationSeconds) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(0);
        executor.setMaxPoolSize(Integer.MAX_VALUE);
        executor.setQueueCapacity(0);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(awaitTerminationSeconds);
        executor.initialize();
        return executor;
    }
}
