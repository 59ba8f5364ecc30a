package com.flagship.finance_automation.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded executors for the work that blocks on external calls.
 *
 * - pollExecutor: one task per bank poll
 * - fetchExecutor: individual balance fetches within a poll
 * - publishExecutor: fire-and-forget Home Assistant calls
 */
@Configuration
public class ExecutorConfig {

    @Bean
    public ThreadPoolTaskExecutor pollExecutor(FinanceProperties properties) {
        return executor("balance-poll-", properties.getPolling().getPollThreads(), 16);
    }

    @Bean
    public ThreadPoolTaskExecutor fetchExecutor(FinanceProperties properties) {
        return executor("balance-fetch-", properties.getPolling().getFetchThreads(), 64);
    }

    @Bean
    public ThreadPoolTaskExecutor publishExecutor(FinanceProperties properties) {
        return executor("ha-publish-", properties.getHomeAssistant().getPublishThreads(), 256);
    }

    private static ThreadPoolTaskExecutor executor(String prefix, int threads, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix(prefix);
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queueCapacity);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
