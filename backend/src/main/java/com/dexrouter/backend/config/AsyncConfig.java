package com.dexrouter.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    /**
     * Runs order executions. Sized to the queue concurrency; the queue never hands it more jobs than that.
     */
    @Bean(name = "orderExecutor")
    public ThreadPoolTaskExecutor orderExecutor(RouterProperties properties) {
        int concurrency = properties.getQueue().getConcurrency();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(concurrency);
        executor.setThreadNamePrefix("order-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "quoteExecutor")
    public ThreadPoolTaskExecutor quoteExecutor(RouterProperties properties) {
        int concurrency = properties.getQueue().getConcurrency();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(2, concurrency * 2));
        executor.setMaxPoolSize(Math.max(4, concurrency * 4));
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("venue-quote-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
