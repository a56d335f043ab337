package com.nfttrader.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class SchedulerConfig {

    public static final String AUTOMATION_SCHEDULER = "automationTaskScheduler";
    public static final String MARKET_DATA_EXECUTOR = "marketDataExecutor";

    /**
     * Runs one automation tick per owner at a time; different owners may overlap.
     */
    @Bean(AUTOMATION_SCHEDULER)
    public ThreadPoolTaskScheduler automationTaskScheduler(
            @Value("${nft.automation.scheduler.pool-size:4}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("nft-automation-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    /**
     * Marketplace lookups issued concurrently within a tick. Sized for overlapping I/O
     * waits, bounded to stay under marketplace rate limits.
     */
    @Bean(name = MARKET_DATA_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService marketDataExecutor(
            @Value("${nft.market-data.max-concurrent-requests:8}") int maxConcurrentRequests) {
        int corePoolSize = Math.max(2, maxConcurrentRequests / 2);
        int maxPoolSize = Math.max(corePoolSize, maxConcurrentRequests);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(corePoolSize, maxPoolSize,
                60L, TimeUnit.SECONDS, new LinkedBlockingQueue<>());
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }
}
