package com.tallybook.ledger.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncImportConfig {

    // Fixed worker count; the queue is unbounded so submitted tasks are never rejected
    @Bean(name = "importTaskExecutor")
    public ThreadPoolTaskExecutor importTaskExecutor(@Value("${tallybook.import.workers:2}") int workers) {
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(workers);
        exec.setMaxPoolSize(workers);
        exec.setQueueCapacity(Integer.MAX_VALUE);
        exec.setThreadNamePrefix("import-");
        exec.setWaitForTasksToCompleteOnShutdown(true);
        exec.setAwaitTerminationSeconds(30);
        exec.initialize();
        return exec;
    }
}
