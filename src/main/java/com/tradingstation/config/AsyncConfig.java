package com.tradingstation.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    @Value("${tradingstation.async.core-pool-size:2}")
    private int corePoolSize;

    @Value("${tradingstation.async.max-pool-size:4}")
    private int maxPoolSize;

    @Value("${tradingstation.async.queue-capacity:50}")
    private int queueCapacity;

    /** Runs submitted backtests; each run stays on a single thread from start to finish. */
    @Bean("backtestExecutor")
    public ThreadPoolTaskExecutor backtestExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("backtest-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
